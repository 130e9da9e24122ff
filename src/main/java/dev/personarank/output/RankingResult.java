package dev.personarank.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import dev.personarank.persona.PersonaCategory;
import dev.personarank.persona.TaskCategory;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Externally visible result of one collection run, serialised as JSON with snake_case names.
 *
 * @param challengeInfo free-form collection descriptor echoed from the batch input (absent in REST
 *     responses)
 * @param metadata run-level metadata
 * @param extractedSections the ranked sections with truncated content
 * @param subsectionAnalysis short excerpts of the top sections
 * @param insights aggregate view of the selection quality
 * @param roleAnalysis persona-centred summary of the selected sections
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
  "challenge_info",
  "metadata",
  "extracted_sections",
  "subsection_analysis",
  "insights",
  "role_analysis"
})
public record RankingResult(
    @JsonProperty("challenge_info") @Nullable Map<String, Object> challengeInfo,
    @JsonProperty("metadata") Metadata metadata,
    @JsonProperty("extracted_sections") List<ExtractedSection> extractedSections,
    @JsonProperty("subsection_analysis") List<SubsectionAnalysis> subsectionAnalysis,
    @JsonProperty("insights") Insights insights,
    @JsonProperty("role_analysis") RoleAnalysis roleAnalysis) {

  public RankingResult {
    extractedSections = List.copyOf(extractedSections);
    subsectionAnalysis = List.copyOf(subsectionAnalysis);
  }

  /** Returns a copy carrying the given challenge descriptor. */
  public RankingResult withChallengeInfo(@Nullable Map<String, Object> challengeInfo) {
    return new RankingResult(
        challengeInfo, metadata, extractedSections, subsectionAnalysis, insights, roleAnalysis);
  }

  /** Run-level metadata. */
  public record Metadata(
      @JsonProperty("input_documents") List<String> inputDocuments,
      @JsonProperty("total_documents_processed") int totalDocumentsProcessed,
      @JsonProperty("persona") String persona,
      @JsonProperty("persona_category") PersonaCategory personaCategory,
      @JsonProperty("job_to_be_done") String jobToBeDone,
      @JsonProperty("task_category") TaskCategory taskCategory,
      @JsonProperty("total_candidates_considered") int totalCandidatesConsidered,
      @JsonProperty("candidates_rejected") int candidatesRejected,
      @JsonProperty("total_sections_retained") int totalSectionsRetained,
      @JsonProperty("candidates_per_document") Map<String, Integer> candidatesPerDocument,
      @JsonProperty("max_content_length") int maxContentLength,
      @JsonProperty("processing_timestamp") String processingTimestamp) {}

  /** One ranked section. */
  public record ExtractedSection(
      @JsonProperty("document") String document,
      @JsonProperty("section_title") String sectionTitle,
      @JsonProperty("page_number") int pageNumber,
      @JsonProperty("content") String content,
      @JsonProperty("relevance_score") double relevanceScore,
      @JsonProperty("importance_rank") int importanceRank,
      @JsonProperty("importance_level") ImportanceLevel importanceLevel,
      @JsonProperty("relevant_concepts") List<String> relevantConcepts,
      @JsonProperty("role_observations") List<String> roleObservations) {}

  /** A short excerpt of one of the top sections. */
  public record SubsectionAnalysis(
      @JsonProperty("document") String document,
      @JsonProperty("refined_text") String refinedText,
      @JsonProperty("page_number") int pageNumber,
      @JsonProperty("importance_rank") int importanceRank) {}

  /** Aggregate quality indicators of the selection. */
  public record Insights(
      @JsonProperty("alignment_quality") String alignmentQuality,
      @JsonProperty("content_distribution") ContentDistribution contentDistribution,
      @JsonProperty("top_sections") List<TopSection> topSections) {}

  /** Number of selected sections per relevance band. */
  public record ContentDistribution(
      @JsonProperty("high_relevance_sections") int high,
      @JsonProperty("medium_relevance_sections") int medium,
      @JsonProperty("low_relevance_sections") int low) {}

  /** Compact summary of a top section. */
  public record TopSection(
      @JsonProperty("document") String document,
      @JsonProperty("title") String title,
      @JsonProperty("score") double score) {}

  /** Importance breakdown of the selection for the resolved role. */
  public record RoleAnalysis(
      @JsonProperty("role_category") PersonaCategory roleCategory,
      @JsonProperty("role_description") String roleDescription,
      @JsonProperty("total_sections_analyzed") int totalSectionsAnalyzed,
      @JsonProperty("high_importance_sections") int highImportanceSections,
      @JsonProperty("medium_importance_sections") int mediumImportanceSections,
      @JsonProperty("average_relevance_score") double averageRelevanceScore) {}
}
