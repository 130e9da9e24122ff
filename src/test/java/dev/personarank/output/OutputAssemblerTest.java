package dev.personarank.output;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.personarank.fixture.SectionCandidateBuilder;
import dev.personarank.persona.JobContext;
import dev.personarank.persona.PersonaCatalog;
import dev.personarank.persona.PersonaCategory;
import dev.personarank.persona.PersonaProfile;
import dev.personarank.persona.TaskCategory;
import dev.personarank.ranking.RankedOutput;
import dev.personarank.scoring.ScoredSection;
import dev.personarank.section.CandidateBatch;
import dev.personarank.section.SectionCandidate;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class OutputAssemblerTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);

  private final OutputAssembler assembler = new OutputAssembler(CLOCK);

  // --- Helper factory methods ---

  private static ScoredSection ranked(int rank, double score, String body) {
    SectionCandidate candidate =
        new SectionCandidateBuilder()
            .documentId("rome.pdf")
            .title("Section " + rank)
            .pageNumber(rank)
            .body(body)
            .ordinal(rank - 1)
            .build();
    return new ScoredSection(candidate, score, rank);
  }

  private static RankedOutput output(ScoredSection... sections) {
    return new RankedOutput(List.of(sections), sections.length, 15);
  }

  private static AssemblyContext context(List<ScoredSection> sections) {
    return context(
        sections,
        "Travel Planner",
        new PersonaProfile(PersonaCategory.TRAVEL_PLANNER, Set.of("hotel")),
        new JobContext("Plan a trip", Set.of("plan", "trip"), TaskCategory.PREPARE));
  }

  private static AssemblyContext context(
      List<ScoredSection> sections, String personaText, PersonaProfile persona, JobContext job) {
    List<SectionCandidate> candidates = sections.stream().map(ScoredSection::candidate).toList();
    return new AssemblyContext(
        personaText,
        persona,
        job,
        List.of("rome.pdf", "empty.pdf"),
        new CandidateBatch(candidates, 2, Map.of("rome.pdf", candidates.size())));
  }

  private static AssemblyContext researcherReviewContext(List<ScoredSection> sections) {
    return context(
        sections,
        "PhD Researcher",
        PersonaCatalog.builtIn().find(PersonaCategory.RESEARCHER).orElseThrow().toProfile(),
        new JobContext(
            "Review the literature", Set.of("review", "literature"), TaskCategory.REVIEW));
  }

  // --- Test cases ---

  @Test
  void content_is_truncated_to_max_body_length() {
    ScoredSection longSection = ranked(1, 0.8, "a".repeat(1500));

    RankingResult result = assembler.assemble(output(longSection), context(List.of(longSection)));

    assertThat(result.extractedSections().get(0).content()).hasSize(1000);
    assertThat(result.subsectionAnalysis().get(0).refinedText()).hasSize(300);
  }

  @Test
  void short_content_is_kept_whole() {
    ScoredSection section = ranked(1, 0.5, "Hotels near the station.");

    RankingResult result = assembler.assemble(output(section), context(List.of(section)));

    assertThat(result.extractedSections().get(0).content()).isEqualTo("Hotels near the station.");
  }

  @Test
  void extracted_sections_mirror_ranked_order() {
    ScoredSection first = ranked(1, 0.9, "first body");
    ScoredSection second = ranked(2, 0.3, "second body");

    RankingResult result =
        assembler.assemble(output(first, second), context(List.of(first, second)));

    assertThat(result.extractedSections())
        .extracting(RankingResult.ExtractedSection::importanceRank)
        .containsExactly(1, 2);
    assertThat(result.extractedSections().get(0).sectionTitle()).isEqualTo("Section 1");
    assertThat(result.extractedSections().get(0).document()).isEqualTo("rome.pdf");
    assertThat(result.extractedSections().get(1).pageNumber()).isEqualTo(2);
  }

  @Test
  void subsection_analysis_covers_only_the_top_five() {
    List<ScoredSection> sections = new ArrayList<>();
    for (int rank = 1; rank <= 7; rank++) {
      sections.add(ranked(rank, 0.5, "body " + rank));
    }

    RankingResult result =
        assembler.assemble(new RankedOutput(sections, sections.size(), 15), context(sections));

    assertThat(result.subsectionAnalysis())
        .extracting(RankingResult.SubsectionAnalysis::importanceRank)
        .containsExactly(1, 2, 3, 4, 5);
    assertThat(result.insights().topSections()).hasSize(5);
  }

  @Test
  void scores_are_rounded_to_four_decimals() {
    ScoredSection section = ranked(1, 0.123456, "body");

    RankingResult result = assembler.assemble(output(section), context(List.of(section)));

    assertThat(result.extractedSections().get(0).relevanceScore()).isEqualTo(0.1235);
    assertThat(result.insights().topSections().get(0).score()).isEqualTo(0.1235);
  }

  @Test
  void metadata_reports_run_context() {
    ScoredSection section = ranked(1, 0.5, "body");

    RankingResult.Metadata metadata =
        assembler.assemble(output(section), context(List.of(section))).metadata();

    assertThat(metadata.persona()).isEqualTo("Travel Planner");
    assertThat(metadata.personaCategory()).isEqualTo(PersonaCategory.TRAVEL_PLANNER);
    assertThat(metadata.jobToBeDone()).isEqualTo("Plan a trip");
    assertThat(metadata.taskCategory()).isEqualTo(TaskCategory.PREPARE);
    assertThat(metadata.inputDocuments()).containsExactly("rome.pdf", "empty.pdf");
    assertThat(metadata.totalDocumentsProcessed()).isEqualTo(2);
    assertThat(metadata.totalCandidatesConsidered()).isEqualTo(3);
    assertThat(metadata.candidatesRejected()).isEqualTo(2);
    assertThat(metadata.totalSectionsRetained()).isEqualTo(1);
    assertThat(metadata.maxContentLength()).isEqualTo(1000);
    assertThat(metadata.processingTimestamp()).isEqualTo("2026-01-15T10:00:00Z");
  }

  @Test
  void insights_bucket_scores_and_grade_alignment() {
    ScoredSection high = ranked(1, 0.9, "a");
    ScoredSection medium = ranked(2, 0.5, "b");
    ScoredSection low = ranked(3, 0.1, "c");

    RankingResult.Insights insights =
        assembler
            .assemble(output(high, medium, low), context(List.of(high, medium, low)))
            .insights();

    assertThat(insights.contentDistribution())
        .isEqualTo(new RankingResult.ContentDistribution(1, 1, 1));
    assertThat(insights.alignmentQuality()).isEqualTo("medium");
  }

  @Test
  void sections_carry_concepts_observations_and_importance() {
    ScoredSection section = ranked(1, 0.8, "Methodology and dataset results summary");

    RankingResult.ExtractedSection extracted =
        assembler
            .assemble(output(section), researcherReviewContext(List.of(section)))
            .extractedSections()
            .get(0);

    assertThat(extracted.relevantConcepts()).containsExactly("methodology", "dataset", "result");
    assertThat(extracted.roleObservations())
        .containsExactly(
            "Research methodology identified",
            "Data sources and datasets mentioned",
            "Research findings and results presented",
            "Summary content suitable for review");
    assertThat(extracted.importanceLevel()).isEqualTo(ImportanceLevel.HIGH);
  }

  @Test
  void role_analysis_counts_importance_levels_and_averages_scores() {
    ScoredSection high = ranked(1, 0.8, "Methodology and dataset results summary");
    ScoredSection medium = ranked(2, 0.4, "An overview of the chapter");
    ScoredSection low = ranked(3, 0.1, "Nothing relevant here");

    RankingResult.RoleAnalysis analysis =
        assembler
            .assemble(
                output(high, medium, low), researcherReviewContext(List.of(high, medium, low)))
            .roleAnalysis();

    assertThat(analysis.roleCategory()).isEqualTo(PersonaCategory.RESEARCHER);
    assertThat(analysis.roleDescription()).isEqualTo("PhD Researcher");
    assertThat(analysis.totalSectionsAnalyzed()).isEqualTo(3);
    assertThat(analysis.highImportanceSections()).isEqualTo(1);
    assertThat(analysis.mediumImportanceSections()).isEqualTo(1);
    assertThat(analysis.averageRelevanceScore()).isEqualTo(0.433);
  }

  @Test
  void alignment_quality_thresholds() {
    assertThat(OutputAssembler.alignmentQuality(0.7)).isEqualTo("high");
    assertThat(OutputAssembler.alignmentQuality(0.4)).isEqualTo("medium");
    assertThat(OutputAssembler.alignmentQuality(0.39)).isEqualTo("low");
  }

  @Test
  void empty_output_is_assembled_without_failure() {
    RankingResult result = assembler.assemble(RankedOutput.empty(15), context(List.of()));

    assertThat(result.extractedSections()).isEmpty();
    assertThat(result.subsectionAnalysis()).isEmpty();
    assertThat(result.insights().alignmentQuality()).isEqualTo("low");
    assertThat(result.insights().topSections()).isEmpty();
    assertThat(result.challengeInfo()).isNull();
    assertThat(result.roleAnalysis().totalSectionsAnalyzed()).isZero();
    assertThat(result.roleAnalysis().averageRelevanceScore()).isZero();
  }

  @Test
  void truncation_does_not_split_surrogate_pairs() {
    assertThat(OutputAssembler.truncate("a😀b", 2)).isEqualTo("a");
    assertThat(OutputAssembler.truncate("abc", 5)).isEqualTo("abc");
  }

  @Test
  void rejects_invalid_limits() {
    assertThatThrownBy(() -> new OutputAssembler(0, 300, 5, CLOCK))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
