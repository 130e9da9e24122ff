package dev.personarank.extraction;

import dev.personarank.section.PageText;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Extracts the text of a document page by page. */
public interface PageTextExtractor {

  /**
   * Reads a document and returns its pages in order.
   *
   * @param document path of the document to read
   * @return one entry per page, numbered from 1
   * @throws IOException if the document cannot be read or parsed
   */
  List<PageText> extract(Path document) throws IOException;
}
