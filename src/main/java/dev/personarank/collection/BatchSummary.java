package dev.personarank.collection;

import java.util.List;

/**
 * Outcome of a batch run.
 *
 * @param succeeded number of collections ranked and written
 * @param failed names of the collections that failed, in processing order
 */
public record BatchSummary(int succeeded, List<String> failed) {

  public BatchSummary {
    failed = List.copyOf(failed);
  }

  public int total() {
    return succeeded + failed.size();
  }
}
