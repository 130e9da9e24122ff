package dev.personarank.scoring;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for relevance scoring.
 *
 * <p>Properties are bound from {@code personarank.scoring.*} in application.yml.
 *
 * <ul>
 *   <li>{@code persona-weight} - weight of the persona-term density (default 0.6)
 *   <li>{@code job-weight} - weight of the job-term density (default 0.4); the two weights must sum
 *       to 1.0
 *   <li>{@code title-weight} - multiplier for title tokens (default 2.0, at least 1.0)
 *   <li>{@code amplification-exponent} - power applied to the raw score (default 2.0, at least 1.0)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "personarank.scoring")
public class ScoringProperties {

  private double personaWeight = ScoringWeights.DEFAULTS.personaWeight();
  private double jobWeight = ScoringWeights.DEFAULTS.jobWeight();
  private double titleWeight = ScoringWeights.DEFAULTS.titleWeight();
  private double amplificationExponent = ScoringWeights.DEFAULTS.amplificationExponent();

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    try {
      toWeights();
    } catch (IllegalArgumentException e) {
      throw new IllegalStateException("Invalid personarank.scoring configuration: " + e.getMessage(), e);
    }
  }

  /** Converts the bound values into validated {@link ScoringWeights}. */
  public ScoringWeights toWeights() {
    return new ScoringWeights(personaWeight, jobWeight, titleWeight, amplificationExponent);
  }

  public double getPersonaWeight() {
    return personaWeight;
  }

  public void setPersonaWeight(double personaWeight) {
    this.personaWeight = personaWeight;
  }

  public double getJobWeight() {
    return jobWeight;
  }

  public void setJobWeight(double jobWeight) {
    this.jobWeight = jobWeight;
  }

  public double getTitleWeight() {
    return titleWeight;
  }

  public void setTitleWeight(double titleWeight) {
    this.titleWeight = titleWeight;
  }

  public double getAmplificationExponent() {
    return amplificationExponent;
  }

  public void setAmplificationExponent(double amplificationExponent) {
    this.amplificationExponent = amplificationExponent;
  }
}
