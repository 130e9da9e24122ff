package dev.personarank.scoring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class ScoringWeightsTest {

  @Test
  void defaults_weight_persona_over_job() {
    assertThat(ScoringWeights.DEFAULTS.personaWeight()).isEqualTo(0.6);
    assertThat(ScoringWeights.DEFAULTS.jobWeight()).isEqualTo(0.4);
    assertThat(ScoringWeights.DEFAULTS.titleWeight()).isEqualTo(2.0);
    assertThat(ScoringWeights.DEFAULTS.amplificationExponent()).isEqualTo(2.0);
  }

  @Test
  void weights_must_sum_to_one() {
    assertThatThrownBy(() -> new ScoringWeights(0.7, 0.4, 2.0, 3.0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("must equal 1.0");
  }

  @Test
  void weights_must_lie_in_unit_interval() {
    assertThatThrownBy(() -> new ScoringWeights(-0.1, 1.1, 2.0, 3.0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("personaWeight");
  }

  @Test
  void title_weight_below_one_is_rejected() {
    assertThatThrownBy(() -> new ScoringWeights(0.6, 0.4, 0.5, 3.0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("titleWeight");
  }

  @Test
  void exponent_below_one_is_rejected() {
    assertThatThrownBy(() -> new ScoringWeights(0.6, 0.4, 2.0, 0.5))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("amplificationExponent");
  }

  @Test
  void non_finite_values_are_rejected() {
    assertThatThrownBy(() -> new ScoringWeights(Double.NaN, 0.4, 2.0, 2.0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("personaWeight must be a finite number");
    assertThatThrownBy(() -> new ScoringWeights(0.6, Double.NaN, 2.0, 2.0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("jobWeight");
    assertThatThrownBy(() -> new ScoringWeights(0.6, 0.4, Double.POSITIVE_INFINITY, 2.0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("titleWeight");
    assertThatThrownBy(() -> new ScoringWeights(0.6, 0.4, 2.0, Double.NaN))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("amplificationExponent");
  }

  @Test
  void nan_property_fails_startup_validation() {
    ScoringProperties properties = new ScoringProperties();
    properties.setPersonaWeight(Double.NaN);

    assertThatThrownBy(properties::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("finite");
  }

  @Test
  void properties_default_to_the_default_weights() {
    assertThat(new ScoringProperties().toWeights()).isEqualTo(ScoringWeights.DEFAULTS);
  }

  @Test
  void invalid_properties_fail_startup_validation() {
    ScoringProperties properties = new ScoringProperties();
    properties.setPersonaWeight(0.9);

    assertThatThrownBy(properties::validate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("personarank.scoring");
  }

  @Test
  void consistent_custom_properties_pass_validation() {
    ScoringProperties properties = new ScoringProperties();
    properties.setPersonaWeight(0.5);
    properties.setJobWeight(0.5);

    assertThatCode(properties::validate).doesNotThrowAnyException();
  }
}
