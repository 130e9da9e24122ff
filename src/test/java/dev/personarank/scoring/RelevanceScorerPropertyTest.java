package dev.personarank.scoring;

import static org.assertj.core.api.Assertions.assertThat;

import dev.personarank.persona.JobContext;
import dev.personarank.persona.PersonaCategory;
import dev.personarank.persona.PersonaProfile;
import dev.personarank.persona.TaskCategory;
import dev.personarank.section.SectionCandidate;
import java.util.List;
import java.util.Set;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Assume;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/**
 * Property-based tests for {@link RelevanceScorer}: bounds, determinism and the effect of adding or
 * swapping in a matching term, over generated section texts drawn from a small travel-flavoured
 * vocabulary.
 */
class RelevanceScorerPropertyTest {

  private static final List<String> WORDS =
      List.of(
          "hotel", "beach", "itinerary", "budget", "printer", "driver", "museum", "the", "and",
          "train", "paper", "tray", "restaurant", "group", "day");

  private static final PersonaProfile TRAVEL =
      new PersonaProfile(
          PersonaCategory.TRAVEL_PLANNER, Set.of("hotel", "beach", "itinerary", "budget", "museum"));

  private static final JobContext JOB =
      new JobContext("Plan a day trip", Set.of("plan", "day", "group"), TaskCategory.PREPARE);

  private final RelevanceScorer scorer = new RelevanceScorer(ScoringWeights.DEFAULTS);

  @Provide
  Arbitrary<String> texts() {
    return Arbitraries.of(WORDS).list().ofMaxSize(40).map(words -> String.join(" ", words));
  }

  @Property
  void score_is_always_within_unit_interval(
      @ForAll("texts") String title, @ForAll("texts") String body) {
    double score = scorer.score(candidate(title, body), TRAVEL, JOB);

    assertThat(score).isBetween(0.0, 1.0);
  }

  @Property
  void score_is_deterministic(@ForAll("texts") String title, @ForAll("texts") String body) {
    SectionCandidate candidate = candidate(title, body);

    assertThat(scorer.score(candidate, TRAVEL, JOB)).isEqualTo(scorer.score(candidate, TRAVEL, JOB));
  }

  @Property
  void text_without_vocabulary_terms_scores_zero(@ForAll("texts") String body) {
    String unrelated = body.replaceAll("\\b(hotel|beach|itinerary|budget|museum|group|day)\\b", "");

    assertThat(scorer.score(candidate("", unrelated), TRAVEL, JOB)).isZero();
  }

  @Property
  void adding_a_persona_term_to_the_body_never_lowers_the_score(@ForAll("texts") String body) {
    double before = scorer.score(candidate("", body), TRAVEL, JOB);
    double after = scorer.score(candidate("", body + " hotel"), TRAVEL, JOB);

    assertThat(after).isGreaterThanOrEqualTo(before);
  }

  @Property
  void swapping_a_neutral_token_for_a_persona_term_never_lowers_the_score(
      @ForAll("texts") String title, @ForAll("texts") String body) {
    // same token count and the same job hits on both sides
    double before = scorer.score(candidate(title, body + " printer"), TRAVEL, JOB);
    double after = scorer.score(candidate(title, body + " hotel"), TRAVEL, JOB);

    assertThat(after).isGreaterThanOrEqualTo(before);
  }

  @Property
  void swapping_a_neutral_token_for_a_persona_term_raises_an_unsaturated_score(
      @ForAll("texts") String title, @ForAll("texts") String body) {
    double before = scorer.score(candidate(title, body + " printer"), TRAVEL, JOB);
    double after = scorer.score(candidate(title, body + " hotel"), TRAVEL, JOB);

    Assume.that(before < 1.0);
    assertThat(after).isGreaterThan(before);
  }

  private static SectionCandidate candidate(String title, String body) {
    return new SectionCandidate("a.pdf", 1, title, body, 0);
  }
}
