package dev.personarank.ranking;

import dev.personarank.scoring.ScoredSection;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Orders scored sections, diversifies across source documents and truncates to the output cap.
 *
 * <p>Sections are sorted by score descending with the candidate ordinal (document/page order) as
 * tie-break. Selection then walks the sorted pool: the best remaining section is taken unless one
 * of the next {@code diversificationWindow} sections comes from a document that currently has
 * fewer selected entries and scores within {@code diversificationTolerance} of it, in which case
 * that section is taken first. Passed-over sections stay in the pool, so this is a bounded swap,
 * not a per-document quota.
 */
public class SectionRanker {

  static final int DEFAULT_CAP = 15;
  static final int DEFAULT_WINDOW = 3;
  static final double DEFAULT_TOLERANCE = 0.05;

  private static final Comparator<ScoredSection> BY_SCORE_THEN_ORDER =
      Comparator.comparingDouble(ScoredSection::relevanceScore)
          .reversed()
          .thenComparingInt(s -> s.candidate().ordinal());

  private final int defaultCap;
  private final int diversificationWindow;
  private final double diversificationTolerance;

  public SectionRanker() {
    this(DEFAULT_CAP, DEFAULT_WINDOW, DEFAULT_TOLERANCE);
  }

  public SectionRanker(int defaultCap, int diversificationWindow, double diversificationTolerance) {
    if (defaultCap < 1) {
      throw new IllegalArgumentException("cap must be at least 1, got: " + defaultCap);
    }
    if (diversificationWindow < 0) {
      throw new IllegalArgumentException(
          "diversificationWindow must not be negative, got: " + diversificationWindow);
    }
    this.defaultCap = defaultCap;
    this.diversificationWindow = diversificationWindow;
    this.diversificationTolerance = diversificationTolerance;
  }

  /** Ranks and selects with the configured cap. */
  public RankedOutput rankAndSelect(List<ScoredSection> scored) {
    return rankAndSelect(scored, defaultCap);
  }

  /**
   * Ranks, diversifies and truncates scored sections.
   *
   * @param scored the scored sections of one collection, in any order
   * @param cap maximum number of sections to keep (at least 1)
   * @return at most {@code cap} sections with ranks 1..n assigned
   */
  public RankedOutput rankAndSelect(List<ScoredSection> scored, int cap) {
    if (cap < 1) {
      throw new IllegalArgumentException("cap must be at least 1, got: " + cap);
    }
    if (scored.isEmpty()) {
      return RankedOutput.empty(cap);
    }

    List<ScoredSection> pool = new ArrayList<>(scored);
    pool.sort(BY_SCORE_THEN_ORDER);

    List<ScoredSection> selected = new ArrayList<>(Math.min(cap, pool.size()));
    Map<String, Integer> selectedPerDocument = new HashMap<>();

    while (selected.size() < cap && !pool.isEmpty()) {
      int pick = nextPick(pool, selectedPerDocument);
      ScoredSection chosen = pool.remove(pick);
      selected.add(chosen.withRank(selected.size() + 1));
      selectedPerDocument.merge(chosen.documentId(), 1, Integer::sum);
    }

    return new RankedOutput(selected, scored.size(), cap);
  }

  private int nextPick(List<ScoredSection> pool, Map<String, Integer> selectedPerDocument) {
    ScoredSection head = pool.get(0);
    int headCount = selectedPerDocument.getOrDefault(head.documentId(), 0);
    if (headCount == 0) {
      return 0;
    }
    int limit = Math.min(diversificationWindow, pool.size() - 1);
    for (int i = 1; i <= limit; i++) {
      ScoredSection alternative = pool.get(i);
      if (alternative.relevanceScore() < head.relevanceScore() - diversificationTolerance) {
        // pool is sorted, nothing further along is comparable
        break;
      }
      if (selectedPerDocument.getOrDefault(alternative.documentId(), 0) < headCount) {
        return i;
      }
    }
    return 0;
  }
}
