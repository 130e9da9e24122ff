package dev.personarank.section;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * All candidate sections detected in one source document, in document order.
 *
 * <p>This is the structural input contract of the ranking core. A blank document identifier or a
 * missing section list is an upstream contract violation and fails fast with {@link
 * IllegalArgumentException}; individual malformed sections are not (see {@link
 * SectionValidator}).
 *
 * @param documentId identifier of the source document (typically the PDF file name)
 * @param sections the raw sections in document order (may be empty)
 */
public record DocumentSections(
    @JsonProperty("document_id") String documentId,
    @JsonProperty("sections") List<RawSection> sections) {

  /** Compact constructor validating the structural contract. */
  public DocumentSections {
    if (documentId == null || documentId.isBlank()) {
      throw new IllegalArgumentException("documentId must not be blank");
    }
    if (sections == null) {
      throw new IllegalArgumentException("sections must not be null for document " + documentId);
    }
    for (RawSection section : sections) {
      if (section == null) {
        throw new IllegalArgumentException("null section in document " + documentId);
      }
    }
    sections = List.copyOf(sections);
  }
}
