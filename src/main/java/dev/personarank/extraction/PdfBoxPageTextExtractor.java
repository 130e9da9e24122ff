package dev.personarank.extraction;

import dev.personarank.section.PageText;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link PageTextExtractor} backed by Apache PDFBox.
 *
 * <p>Each page is stripped separately in reading (position) order with {@code \n} line separators.
 * Paragraph ends get an extra line break, which section detection reads as a paragraph boundary.
 */
@Component
public class PdfBoxPageTextExtractor implements PageTextExtractor {

  private static final Logger log = LoggerFactory.getLogger(PdfBoxPageTextExtractor.class);

  @Override
  public List<PageText> extract(Path document) throws IOException {
    try (PDDocument pdf = Loader.loadPDF(document.toFile())) {
      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setSortByPosition(true);
      stripper.setLineSeparator("\n");
      stripper.setParagraphEnd("\n");

      int pageCount = pdf.getNumberOfPages();
      List<PageText> pages = new ArrayList<>(pageCount);
      for (int page = 1; page <= pageCount; page++) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        pages.add(new PageText(page, stripper.getText(pdf)));
      }
      log.debug("Extracted {} pages from {}", pageCount, document.getFileName());
      return pages;
    }
  }
}
