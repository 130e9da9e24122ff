package dev.personarank.ranking;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for ranking and selection, bound from {@code personarank.ranking.*}.
 *
 * <ul>
 *   <li>{@code cap} - maximum number of sections in the output (default 15, bounded [1, 15])
 *   <li>{@code diversification-window} - how many positions past the best remaining section the
 *       ranker may look for a section from a less represented document (default 3, bounded [0,
 *       50]; 0 disables diversification)
 *   <li>{@code diversification-tolerance} - maximum score gap for such a swap (default 0.05,
 *       bounded [0.0, 1.0])
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "personarank.ranking")
public class RankingProperties {

  private int cap = SectionRanker.DEFAULT_CAP;
  private int diversificationWindow = SectionRanker.DEFAULT_WINDOW;
  private double diversificationTolerance = SectionRanker.DEFAULT_TOLERANCE;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (cap < 1 || cap > SectionRanker.DEFAULT_CAP) {
      throw new IllegalStateException("personarank.ranking.cap must be in [1, 15], got: " + cap);
    }
    if (diversificationWindow < 0 || diversificationWindow > 50) {
      throw new IllegalStateException(
          "personarank.ranking.diversification-window must be in [0, 50], got: "
              + diversificationWindow);
    }
    if (diversificationTolerance < 0.0 || diversificationTolerance > 1.0) {
      throw new IllegalStateException(
          "personarank.ranking.diversification-tolerance must be in [0.0, 1.0], got: "
              + diversificationTolerance);
    }
  }

  public int getCap() {
    return cap;
  }

  public void setCap(int cap) {
    this.cap = cap;
  }

  public int getDiversificationWindow() {
    return diversificationWindow;
  }

  public void setDiversificationWindow(int diversificationWindow) {
    this.diversificationWindow = diversificationWindow;
  }

  public double getDiversificationTolerance() {
    return diversificationTolerance;
  }

  public void setDiversificationTolerance(double diversificationTolerance) {
    this.diversificationTolerance = diversificationTolerance;
  }
}
