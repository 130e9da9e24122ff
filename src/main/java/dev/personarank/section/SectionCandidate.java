package dev.personarank.section;

/**
 * A validated, normalised document section ready for relevance scoring.
 *
 * <p>Instances are created only by {@link SectionValidator}; every instance therefore satisfies the
 * minimum quality rules (positive page number, non-trivial body, no noise title).
 *
 * @param documentId identifier of the source document
 * @param pageNumber 1-based page number
 * @param title the section title, stripped; empty when the section has none
 * @param body the full, untruncated section text
 * @param ordinal position of this candidate in collection input order, used as the deterministic
 *     tie-break when scores are equal
 */
public record SectionCandidate(
    String documentId, int pageNumber, String title, String body, int ordinal) {

  /** Character count of the body. */
  public int derivedLength() {
    return body.length();
  }
}
