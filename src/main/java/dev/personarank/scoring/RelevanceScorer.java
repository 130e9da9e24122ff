package dev.personarank.scoring;

import dev.personarank.persona.JobContext;
import dev.personarank.persona.PersonaProfile;
import dev.personarank.section.SectionCandidate;
import dev.personarank.text.TextTokenizer;
import java.util.List;
import java.util.Set;

/**
 * Lexical relevance scoring of a section against the run's persona vocabulary and job keywords.
 *
 * <p>Algorithm:
 *
 * <ol>
 *   <li>Tokenize title and body; title tokens count {@code titleWeight} times
 *   <li>Persona density = weighted persona-keyword hits / weighted token total
 *   <li>Job density = weighted job-keyword hits / weighted token total
 *   <li>{@code raw = personaWeight * personaDensity + jobWeight * jobDensity}
 *   <li>Amplify with {@code raw^amplificationExponent}, which maps [0, 1] onto itself and is
 *       strictly increasing, so denser sections always score strictly higher
 *   <li>Clamp to [0.0, 1.0]
 * </ol>
 *
 * <p>Densities are normalised by the section's own token count, so long sections are not favoured
 * for their raw hit count. Scoring is pure and deterministic; a section without tokens scores 0.0.
 */
public class RelevanceScorer {

  private final ScoringWeights weights;

  public RelevanceScorer(ScoringWeights weights) {
    this.weights = weights;
  }

  /**
   * Scores one candidate.
   *
   * @param candidate the validated section (full, untruncated text)
   * @param persona the run's persona profile
   * @param job the run's job context
   * @return the relevance score in [0.0, 1.0]
   */
  public double score(SectionCandidate candidate, PersonaProfile persona, JobContext job) {
    List<String> titleTokens = TextTokenizer.tokenize(candidate.title());
    List<String> bodyTokens = TextTokenizer.tokenize(candidate.body());

    double weightedTotal = weights.titleWeight() * titleTokens.size() + bodyTokens.size();
    if (weightedTotal == 0.0) {
      return 0.0;
    }

    double personaDensity = weightedHits(titleTokens, bodyTokens, persona.keywords()) / weightedTotal;
    double jobDensity = weightedHits(titleTokens, bodyTokens, job.keywords()) / weightedTotal;

    double raw = weights.personaWeight() * personaDensity + weights.jobWeight() * jobDensity;
    return clamp(amplify(raw));
  }

  /**
   * Scores every candidate, preserving input order.
   *
   * @param candidates the validated sections of one collection
   * @param persona the run's persona profile
   * @param job the run's job context
   * @return one unranked {@link ScoredSection} per candidate
   */
  public List<ScoredSection> scoreAll(
      List<SectionCandidate> candidates, PersonaProfile persona, JobContext job) {
    return candidates.stream()
        .map(candidate -> new ScoredSection(candidate, score(candidate, persona, job)))
        .toList();
  }

  private double weightedHits(List<String> titleTokens, List<String> bodyTokens, Set<String> terms) {
    if (terms.isEmpty()) {
      return 0.0;
    }
    return weights.titleWeight() * countHits(titleTokens, terms) + countHits(bodyTokens, terms);
  }

  private static long countHits(List<String> tokens, Set<String> terms) {
    return tokens.stream().filter(terms::contains).count();
  }

  double amplify(double raw) {
    if (raw <= 0.0) {
      return 0.0;
    }
    return Math.pow(raw, weights.amplificationExponent());
  }

  private static double clamp(double value) {
    if (Double.isNaN(value) || value < 0.0) {
      return 0.0;
    }
    return Math.min(value, 1.0);
  }
}
