package dev.personarank.output;

import dev.personarank.ranking.RankedOutput;
import dev.personarank.scoring.ScoredSection;
import dev.personarank.section.SectionCandidate;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Shapes a {@link RankedOutput} and its run context into the externally visible {@link
 * RankingResult}.
 *
 * <p>Section content is truncated here and only here: scoring always sees the full body. Scores are
 * rounded to four decimals for presentation; the ranking order is already fixed at that point.
 * Each selected section is annotated once by a {@link SectionAnnotator}, and the annotations feed
 * both the per-section fields and the run's role analysis.
 */
public class OutputAssembler {

  static final int DEFAULT_MAX_BODY_LENGTH = 1000;
  static final int DEFAULT_REFINED_TEXT_LENGTH = 300;
  static final int DEFAULT_SUBSECTION_COUNT = 5;

  static final double HIGH_RELEVANCE = 0.7;
  static final double MEDIUM_RELEVANCE = 0.4;

  private static final int TOP_SECTIONS_SUMMARY = 5;
  private static final int SCORE_DECIMALS = 4;
  private static final int AVERAGE_DECIMALS = 3;

  private final SectionAnnotator annotator = new SectionAnnotator();

  private final int maxBodyLength;
  private final int refinedTextLength;
  private final int subsectionCount;
  private final Clock clock;

  public OutputAssembler(Clock clock) {
    this(DEFAULT_MAX_BODY_LENGTH, DEFAULT_REFINED_TEXT_LENGTH, DEFAULT_SUBSECTION_COUNT, clock);
  }

  public OutputAssembler(
      int maxBodyLength, int refinedTextLength, int subsectionCount, Clock clock) {
    if (maxBodyLength < 1 || refinedTextLength < 1 || subsectionCount < 0) {
      throw new IllegalArgumentException(
          "Invalid output limits: maxBodyLength=%d, refinedTextLength=%d, subsectionCount=%d"
              .formatted(maxBodyLength, refinedTextLength, subsectionCount));
    }
    this.maxBodyLength = maxBodyLength;
    this.refinedTextLength = refinedTextLength;
    this.subsectionCount = subsectionCount;
    this.clock = clock;
  }

  /**
   * Assembles the final result.
   *
   * @param ranked the ranked selection
   * @param context run-level inputs and statistics
   * @return the result, ready for JSON serialisation
   */
  public RankingResult assemble(RankedOutput ranked, AssemblyContext context) {
    List<SectionAnnotator.SectionAnnotation> annotations =
        ranked.sections().stream()
            .map(
                s ->
                    annotator.annotate(
                        s.candidate(),
                        s.relevanceScore(),
                        context.persona(),
                        context.job().taskCategory()))
            .toList();

    List<RankingResult.ExtractedSection> extracted = new ArrayList<>(annotations.size());
    for (int i = 0; i < annotations.size(); i++) {
      extracted.add(toExtractedSection(ranked.sections().get(i), annotations.get(i)));
    }

    List<RankingResult.SubsectionAnalysis> subsections =
        ranked.sections().stream().limit(subsectionCount).map(this::toSubsection).toList();

    RankingResult.Metadata metadata =
        new RankingResult.Metadata(
            context.inputDocuments(),
            context.inputDocuments().size(),
            context.personaText(),
            context.persona().category(),
            context.job().rawText(),
            context.job().taskCategory(),
            context.batch().considered(),
            context.batch().rejected(),
            ranked.size(),
            context.batch().acceptedPerDocument(),
            maxBodyLength,
            Instant.now(clock).toString());

    return new RankingResult(
        null,
        metadata,
        extracted,
        subsections,
        insights(ranked),
        roleAnalysis(ranked, annotations, context));
  }

  private RankingResult.ExtractedSection toExtractedSection(
      ScoredSection section, SectionAnnotator.SectionAnnotation annotation) {
    SectionCandidate candidate = section.candidate();
    return new RankingResult.ExtractedSection(
        candidate.documentId(),
        candidate.title(),
        candidate.pageNumber(),
        truncate(candidate.body(), maxBodyLength),
        round(section.relevanceScore()),
        section.rank(),
        annotation.importanceLevel(),
        annotation.relevantConcepts(),
        annotation.roleObservations());
  }

  private RankingResult.SubsectionAnalysis toSubsection(ScoredSection section) {
    SectionCandidate candidate = section.candidate();
    return new RankingResult.SubsectionAnalysis(
        candidate.documentId(),
        truncate(candidate.body(), refinedTextLength),
        candidate.pageNumber(),
        section.rank());
  }

  private static RankingResult.Insights insights(RankedOutput ranked) {
    List<ScoredSection> sections = ranked.sections();
    int high = 0;
    int medium = 0;
    int low = 0;
    double total = 0.0;
    for (ScoredSection section : sections) {
      double score = section.relevanceScore();
      total += score;
      if (score >= HIGH_RELEVANCE) {
        high++;
      } else if (score >= MEDIUM_RELEVANCE) {
        medium++;
      } else {
        low++;
      }
    }

    List<RankingResult.TopSection> top =
        sections.stream()
            .limit(TOP_SECTIONS_SUMMARY)
            .map(
                s ->
                    new RankingResult.TopSection(
                        s.documentId(), s.candidate().title(), round(s.relevanceScore())))
            .toList();

    String quality = sections.isEmpty() ? "low" : alignmentQuality(total / sections.size());
    return new RankingResult.Insights(
        quality, new RankingResult.ContentDistribution(high, medium, low), top);
  }

  private static RankingResult.RoleAnalysis roleAnalysis(
      RankedOutput ranked,
      List<SectionAnnotator.SectionAnnotation> annotations,
      AssemblyContext context) {
    int high = 0;
    int medium = 0;
    for (SectionAnnotator.SectionAnnotation annotation : annotations) {
      if (annotation.importanceLevel() == ImportanceLevel.HIGH) {
        high++;
      } else if (annotation.importanceLevel() == ImportanceLevel.MEDIUM) {
        medium++;
      }
    }
    double average =
        ranked.sections().stream().mapToDouble(ScoredSection::relevanceScore).average().orElse(0.0);
    return new RankingResult.RoleAnalysis(
        context.persona().category(),
        context.personaText(),
        ranked.size(),
        high,
        medium,
        round(average, AVERAGE_DECIMALS));
  }

  static String alignmentQuality(double averageScore) {
    if (averageScore >= HIGH_RELEVANCE) {
      return "high";
    }
    if (averageScore >= MEDIUM_RELEVANCE) {
      return "medium";
    }
    return "low";
  }

  /**
   * Cuts text to at most {@code maxLength} characters without splitting a surrogate pair.
   *
   * @param text the text to cut
   * @param maxLength the maximum number of UTF-16 chars to keep
   * @return the text itself when short enough, otherwise its prefix
   */
  static String truncate(String text, int maxLength) {
    if (text.length() <= maxLength) {
      return text;
    }
    int end = maxLength;
    if (Character.isHighSurrogate(text.charAt(end - 1))) {
      end--;
    }
    return text.substring(0, end);
  }

  private static double round(double score) {
    return round(score, SCORE_DECIMALS);
  }

  private static double round(double value, int decimals) {
    return BigDecimal.valueOf(value).setScale(decimals, RoundingMode.HALF_UP).doubleValue();
  }
}
