package dev.personarank.section;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of validating one collection's raw sections.
 *
 * @param accepted the candidates that passed validation, in input order
 * @param rejected number of raw sections dropped by validation
 * @param acceptedPerDocument accepted candidate count per document, in document order (documents
 *     with no accepted candidate map to 0)
 */
public record CandidateBatch(
    List<SectionCandidate> accepted, int rejected, Map<String, Integer> acceptedPerDocument) {

  public CandidateBatch {
    accepted = List.copyOf(accepted);
    acceptedPerDocument = Collections.unmodifiableMap(new LinkedHashMap<>(acceptedPerDocument));
  }

  /** Total raw sections seen: accepted plus rejected. */
  public int considered() {
    return accepted.size() + rejected;
  }
}
