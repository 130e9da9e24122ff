package dev.personarank.scoring;

import dev.personarank.section.SectionCandidate;

/**
 * A candidate with its relevance score and, once ranked, its 1-based rank.
 *
 * @param candidate the scored section
 * @param relevanceScore score in [0.0, 1.0]
 * @param rank 1-based position in the final output; 0 while unranked
 */
public record ScoredSection(SectionCandidate candidate, double relevanceScore, int rank) {

  public ScoredSection {
    if (relevanceScore < 0.0 || relevanceScore > 1.0 || Double.isNaN(relevanceScore)) {
      throw new IllegalArgumentException("relevanceScore must be in [0.0, 1.0], got: " + relevanceScore);
    }
    if (rank < 0) {
      throw new IllegalArgumentException("rank must not be negative, got: " + rank);
    }
  }

  /** Creates an unranked scored section. */
  public ScoredSection(SectionCandidate candidate, double relevanceScore) {
    this(candidate, relevanceScore, 0);
  }

  /** Returns a copy carrying the given rank. */
  public ScoredSection withRank(int rank) {
    return new ScoredSection(candidate, relevanceScore, rank);
  }

  /** Shortcut for the candidate's document identifier. */
  public String documentId() {
    return candidate.documentId();
  }
}
