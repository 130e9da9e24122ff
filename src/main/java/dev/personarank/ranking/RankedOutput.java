package dev.personarank.ranking;

import dev.personarank.scoring.ScoredSection;
import java.util.List;

/**
 * The ranked, bounded selection of one collection run. Terminal artifact of the ranking core.
 *
 * @param sections selected sections in rank order, ranks 1..n
 * @param candidatesConsidered number of scored candidates the selection was made from
 * @param cap the maximum number of sections the selection was allowed to hold
 */
public record RankedOutput(List<ScoredSection> sections, int candidatesConsidered, int cap) {

  /** Compact constructor enforcing the cap invariant. */
  public RankedOutput {
    sections = List.copyOf(sections);
    if (sections.size() > cap) {
      throw new IllegalArgumentException(
          "RankedOutput holds %d sections but cap is %d".formatted(sections.size(), cap));
    }
  }

  /** An empty output, as produced for a collection without valid candidates. */
  public static RankedOutput empty(int cap) {
    return new RankedOutput(List.of(), 0, cap);
  }

  public int size() {
    return sections.size();
  }

  public boolean isEmpty() {
    return sections.isEmpty();
  }
}
