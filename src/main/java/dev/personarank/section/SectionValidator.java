package dev.personarank.section;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the minimum-quality rules that separate scorable sections from detector noise.
 *
 * <p>A raw section is rejected when its page number is not positive, its stripped body is shorter
 * than the minimum length, or it carries a title that is whitespace only or contains no letter or
 * digit. Rejections are counted, never thrown: they are an expected outcome of heuristic section
 * detection.
 */
public class SectionValidator {

  private static final Logger log = LoggerFactory.getLogger(SectionValidator.class);

  static final int DEFAULT_MIN_BODY_LENGTH = 30;

  private final int minBodyLength;

  public SectionValidator() {
    this(DEFAULT_MIN_BODY_LENGTH);
  }

  public SectionValidator(int minBodyLength) {
    if (minBodyLength < 1) {
      throw new IllegalArgumentException("minBodyLength must be at least 1, got: " + minBodyLength);
    }
    this.minBodyLength = minBodyLength;
  }

  /**
   * Validates every raw section of a collection and normalises the survivors.
   *
   * <p>Ordinals are assigned to accepted candidates in input order (documents in list order,
   * sections in document order), so downstream tie-breaks follow document/page order.
   *
   * @param documents the collection's documents with their raw sections
   * @return accepted candidates plus rejection statistics
   */
  public CandidateBatch validate(List<DocumentSections> documents) {
    List<SectionCandidate> accepted = new ArrayList<>();
    Map<String, Integer> perDocument = new LinkedHashMap<>();
    int rejected = 0;

    for (DocumentSections document : documents) {
      perDocument.putIfAbsent(document.documentId(), 0);
      for (RawSection section : document.sections()) {
        Optional<String> reason = rejectionReason(section);
        if (reason.isPresent()) {
          rejected++;
          log.debug(
              "Rejected section '{}' of {} (page {}): {}",
              section.title(),
              document.documentId(),
              section.pageNumber(),
              reason.get());
          continue;
        }
        accepted.add(
            new SectionCandidate(
                document.documentId(),
                section.pageNumber(),
                normaliseTitle(section.title()),
                section.body().strip(),
                accepted.size()));
        perDocument.merge(document.documentId(), 1, Integer::sum);
      }
    }

    return new CandidateBatch(accepted, rejected, perDocument);
  }

  /**
   * Explains why a raw section fails validation.
   *
   * @param section the raw section
   * @return the rejection reason, or empty when the section is acceptable
   */
  Optional<String> rejectionReason(RawSection section) {
    if (section.pageNumber() < 1) {
      return Optional.of("non-positive page number");
    }
    String body = section.body();
    if (body == null || body.isBlank()) {
      return Optional.of("empty body");
    }
    if (body.strip().length() < minBodyLength) {
      return Optional.of("body shorter than " + minBodyLength + " characters");
    }
    String title = section.title();
    if (title != null && !title.isEmpty() && isNoise(title)) {
      return Optional.of("noise title");
    }
    return Optional.empty();
  }

  private static boolean isNoise(String title) {
    return title.codePoints().noneMatch(Character::isLetterOrDigit);
  }

  private static String normaliseTitle(String title) {
    return title == null ? "" : title.strip();
  }
}
