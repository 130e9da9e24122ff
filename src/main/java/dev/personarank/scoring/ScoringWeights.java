package dev.personarank.scoring;

/**
 * Tunable constants of the relevance formula.
 *
 * @param personaWeight share of the persona-term density in the raw score
 * @param jobWeight share of the job-term density in the raw score; {@code personaWeight +
 *     jobWeight} must equal 1
 * @param titleWeight multiplier applied to title tokens relative to body tokens (at least 1)
 * @param amplificationExponent power the raw score is raised to (at least 1); 1 leaves the raw
 *     score unchanged
 */
public record ScoringWeights(
    double personaWeight, double jobWeight, double titleWeight, double amplificationExponent) {

  /** Default weights: persona dominant (0.6), job contributory (0.4), titles count double, squared. */
  public static final ScoringWeights DEFAULTS = new ScoringWeights(0.6, 0.4, 2.0, 2.0);

  private static final double SUM_TOLERANCE = 1e-9;

  /** Compact constructor validating the weights. */
  public ScoringWeights {
    requireFinite("personaWeight", personaWeight);
    requireFinite("jobWeight", jobWeight);
    requireFinite("titleWeight", titleWeight);
    requireFinite("amplificationExponent", amplificationExponent);
    if (personaWeight < 0.0 || personaWeight > 1.0) {
      throw new IllegalArgumentException("personaWeight must be in [0.0, 1.0], got: " + personaWeight);
    }
    if (jobWeight < 0.0 || jobWeight > 1.0) {
      throw new IllegalArgumentException("jobWeight must be in [0.0, 1.0], got: " + jobWeight);
    }
    if (Math.abs(personaWeight + jobWeight - 1.0) > SUM_TOLERANCE) {
      throw new IllegalArgumentException(
          "personaWeight + jobWeight must equal 1.0, got: " + (personaWeight + jobWeight));
    }
    if (titleWeight < 1.0) {
      throw new IllegalArgumentException("titleWeight must be at least 1.0, got: " + titleWeight);
    }
    if (amplificationExponent < 1.0) {
      throw new IllegalArgumentException(
          "amplificationExponent must be at least 1.0, got: " + amplificationExponent);
    }
  }

  private static void requireFinite(String name, double value) {
    if (!Double.isFinite(value)) {
      throw new IllegalArgumentException(name + " must be a finite number, got: " + value);
    }
  }
}
