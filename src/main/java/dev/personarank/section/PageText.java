package dev.personarank.section;

/**
 * Raw text of one PDF page as emitted by the extraction collaborator.
 *
 * @param pageNumber 1-based page number
 * @param text the page text, line breaks preserved
 */
public record PageText(int pageNumber, String text) {

  public PageText {
    text = text == null ? "" : text;
  }
}
