package dev.personarank.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.personarank.output.OutputAssembler;
import dev.personarank.output.RankingResult;
import dev.personarank.persona.JobAnalyzer;
import dev.personarank.persona.PersonaCatalog;
import dev.personarank.persona.PersonaCategory;
import dev.personarank.persona.PersonaClassifier;
import dev.personarank.ranking.SectionRanker;
import dev.personarank.scoring.RelevanceScorer;
import dev.personarank.scoring.ScoringWeights;
import dev.personarank.section.DocumentSections;
import dev.personarank.section.RawSection;
import dev.personarank.section.SectionValidator;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Runs the real ranking core end to end on in-memory collections. */
class RankingPipelineTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);

  private static final String TRAVEL_ROLE = "Travel Planner, group trips";
  private static final String TRAVEL_JOB = "Plan a 5-day itinerary";

  private final RankingPipeline pipeline =
      new RankingPipeline(
          new SectionValidator(),
          new PersonaClassifier(PersonaCatalog.builtIn()),
          new JobAnalyzer(),
          new RelevanceScorer(ScoringWeights.DEFAULTS),
          new SectionRanker(),
          new OutputAssembler(CLOCK));

  private static List<DocumentSections> travelCollection() {
    return List.of(
        new DocumentSections(
            "tech.pdf",
            List.of(
                new RawSection(
                    "Printer Troubleshooting",
                    "Reset the printer driver and check the paper tray alignment.",
                    4))),
        new DocumentSections(
            "rome.pdf",
            List.of(
                new RawSection(
                    "Budget Hotels in Rome",
                    "Find accommodation on a budget and fit it into your itinerary.",
                    2),
                new RawSection("", "tiny", 3))));
  }

  @Test
  void travel_section_is_ranked_above_unrelated_section() {
    RankingResult result = pipeline.rank(TRAVEL_ROLE, TRAVEL_JOB, travelCollection());

    assertThat(result.extractedSections())
        .extracting(RankingResult.ExtractedSection::sectionTitle)
        .containsExactly("Budget Hotels in Rome", "Printer Troubleshooting");
    assertThat(result.extractedSections().get(0).relevanceScore())
        .isGreaterThan(result.extractedSections().get(1).relevanceScore());
    assertThat(result.metadata().personaCategory()).isEqualTo(PersonaCategory.TRAVEL_PLANNER);
  }

  @Test
  void invalid_sections_are_counted_but_never_emitted() {
    RankingResult result = pipeline.rank(TRAVEL_ROLE, TRAVEL_JOB, travelCollection());

    assertThat(result.metadata().candidatesRejected()).isEqualTo(1);
    assertThat(result.metadata().totalCandidatesConsidered()).isEqualTo(3);
    assertThat(result.extractedSections()).noneMatch(s -> s.content().equals("tiny"));
    assertThat(result.metadata().inputDocuments()).containsExactly("tech.pdf", "rome.pdf");
  }

  @Test
  void empty_collection_yields_empty_result() {
    RankingResult result = pipeline.rank(TRAVEL_ROLE, TRAVEL_JOB, List.of());

    assertThat(result.extractedSections()).isEmpty();
    assertThat(result.metadata().totalSectionsRetained()).isZero();
  }

  @Test
  void empty_role_falls_back_to_generic_and_still_scores_job_terms() {
    RankingResult result = pipeline.rank("", TRAVEL_JOB, travelCollection());

    assertThat(result.metadata().personaCategory()).isEqualTo(PersonaCategory.GENERIC);
    assertThat(result.extractedSections().get(0).sectionTitle()).isEqualTo("Budget Hotels in Rome");
    assertThat(result.extractedSections().get(0).relevanceScore()).isGreaterThan(0.0);
  }

  @Test
  void at_most_fifteen_sections_are_retained() {
    List<RawSection> sections = new ArrayList<>();
    for (int i = 1; i <= 20; i++) {
      sections.add(
          new RawSection("Hotel " + i, "A budget hotel close to the old town, number " + i, i));
    }

    RankingResult result =
        pipeline.rank(TRAVEL_ROLE, TRAVEL_JOB, List.of(new DocumentSections("big.pdf", sections)));

    assertThat(result.extractedSections()).hasSize(15);
  }

  @Test
  void content_is_truncated_but_scored_on_full_text() {
    String filler = "lorem ipsum dolor sit amet ".repeat(40);
    String body = filler + "itinerary hotel budget accommodation";
    var document =
        new DocumentSections("long.pdf", List.of(new RawSection("Appendix", body, 9)));

    RankingResult result = pipeline.rank(TRAVEL_ROLE, TRAVEL_JOB, List.of(document));

    RankingResult.ExtractedSection section = result.extractedSections().get(0);
    assertThat(section.content()).hasSize(1000).doesNotContain("itinerary");
    assertThat(section.relevanceScore()).isGreaterThan(0.0);
  }

  @Test
  void identical_input_produces_byte_identical_output() throws Exception {
    ObjectMapper mapper = new ObjectMapper();

    String first =
        mapper.writeValueAsString(pipeline.rank(TRAVEL_ROLE, TRAVEL_JOB, travelCollection()));
    String second =
        mapper.writeValueAsString(pipeline.rank(TRAVEL_ROLE, TRAVEL_JOB, travelCollection()));

    assertThat(first).isEqualTo(second);
  }
}
