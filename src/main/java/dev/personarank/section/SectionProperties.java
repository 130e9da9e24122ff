package dev.personarank.section;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised quality thresholds for candidate sections, bound from {@code
 * personarank.sections.*}.
 *
 * <ul>
 *   <li>{@code min-body-length} - minimum number of characters the stripped body of a section
 *       needs to be scored (default 30, bounded [1, 1000])
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "personarank.sections")
public class SectionProperties {

  private int minBodyLength = SectionValidator.DEFAULT_MIN_BODY_LENGTH;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (minBodyLength < 1 || minBodyLength > 1000) {
      throw new IllegalStateException(
          "personarank.sections.min-body-length must be in [1, 1000], got: " + minBodyLength);
    }
  }

  public int getMinBodyLength() {
    return minBodyLength;
  }

  public void setMinBodyLength(int minBodyLength) {
    this.minBodyLength = minBodyLength;
  }
}
