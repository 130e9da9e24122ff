package dev.personarank.section;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Heuristic section boundary detection over page text.
 *
 * <p>Three independent passes run over every page:
 *
 * <ol>
 *   <li><b>Headers</b> - lines matching a heading pattern (all-caps line, numbered heading, title
 *       case ending in a colon); the content is the text that follows, up to the first blank line
 *       after some content, the next all-caps line, or {@value #MAX_HEADER_CONTENT_LINES} lines
 *   <li><b>Paragraphs</b> - blank-line separated blocks, titled with their first five words
 *   <li><b>Lists</b> - runs of at least two lines starting with a bullet, dash, {@code 1.} or
 *       {@code a)} marker plus their continuation lines
 * </ol>
 *
 * <p>Detected sections outside the configured length bounds are dropped, titles are deduplicated
 * case-insensitively (first occurrence wins), the per-document limit is applied and the survivors
 * are ordered by page.
 */
public class SectionDetector {

  private static final Logger log = LoggerFactory.getLogger(SectionDetector.class);

  static final int DEFAULT_MIN_SECTION_LENGTH = 30;
  static final int DEFAULT_MAX_SECTION_LENGTH = 2000;
  static final int DEFAULT_MAX_SECTIONS = 50;

  private static final int MAX_HEADER_LINE_LENGTH = 100;
  private static final int MAX_HEADER_CONTENT_LINES = 20;
  private static final int PARAGRAPH_TITLE_WORDS = 5;

  private static final List<Pattern> HEADER_PATTERNS =
      List.of(
          Pattern.compile("([A-Z][A-Z\\s&]+)"),
          Pattern.compile("(\\d+\\.\\s+[A-Z][A-Za-z\\s]+)"),
          Pattern.compile("([A-Z][a-z]+(?:\\s+[A-Z][a-z]+)*\\s*:)"));

  private static final Pattern ALL_CAPS_LINE = Pattern.compile("[A-Z][A-Z\\s]+");
  private static final Pattern PARAGRAPH_BREAK = Pattern.compile("\\n\\s*\\n");
  private static final Pattern NUMBERED_ITEM = Pattern.compile("^\\d+\\..*");
  private static final Pattern LETTERED_ITEM = Pattern.compile("^[a-z]\\).*");

  private final int minSectionLength;
  private final int maxSectionLength;
  private final int maxSections;

  public SectionDetector() {
    this(DEFAULT_MIN_SECTION_LENGTH, DEFAULT_MAX_SECTION_LENGTH, DEFAULT_MAX_SECTIONS);
  }

  public SectionDetector(int minSectionLength, int maxSectionLength, int maxSections) {
    if (minSectionLength < 1 || maxSectionLength < minSectionLength || maxSections < 1) {
      throw new IllegalArgumentException(
          "Invalid detector bounds: min=%d, max=%d, maxSections=%d"
              .formatted(minSectionLength, maxSectionLength, maxSections));
    }
    this.minSectionLength = minSectionLength;
    this.maxSectionLength = maxSectionLength;
    this.maxSections = maxSections;
  }

  /**
   * Detects candidate sections in one document.
   *
   * @param documentId identifier of the document (typically its file name)
   * @param pages the document's pages in order
   * @return the detected sections, ordered by page
   */
  public DocumentSections detect(String documentId, List<PageText> pages) {
    List<RawSection> detected = new ArrayList<>();
    for (PageText page : pages) {
      detected.addAll(detectHeaders(page));
    }
    for (PageText page : pages) {
      detected.addAll(detectParagraphs(page));
    }
    for (PageText page : pages) {
      detected.addAll(detectLists(page));
    }

    List<RawSection> kept = new ArrayList<>();
    Set<String> seenTitles = new HashSet<>();
    for (RawSection section : detected) {
      if (kept.size() >= maxSections) {
        break;
      }
      int length = section.body() == null ? 0 : section.body().length();
      String titleKey = section.title() == null ? "" : section.title().toLowerCase(Locale.ROOT);
      if (length >= minSectionLength && length <= maxSectionLength && seenTitles.add(titleKey)) {
        kept.add(section);
      }
    }
    kept.sort(Comparator.comparingInt(RawSection::pageNumber));

    log.debug(
        "Detected {} sections in {} ({} raw matches over {} pages)",
        kept.size(),
        documentId,
        detected.size(),
        pages.size());
    return new DocumentSections(documentId, kept);
  }

  private List<RawSection> detectHeaders(PageText page) {
    List<RawSection> sections = new ArrayList<>();
    String[] lines = page.text().split("\n", -1);
    for (String line : lines) {
      String stripped = line.strip();
      if (stripped.isEmpty() || stripped.length() >= MAX_HEADER_LINE_LENGTH) {
        continue;
      }
      String title = matchHeader(stripped);
      if (title.isEmpty()) {
        continue;
      }
      String content = contentAfterHeader(lines, stripped);
      if (!content.isEmpty()) {
        sections.add(new RawSection(title, truncate(content), page.pageNumber()));
      }
    }
    return sections;
  }

  private static String matchHeader(String line) {
    for (Pattern pattern : HEADER_PATTERNS) {
      Matcher matcher = pattern.matcher(line);
      if (matcher.matches()) {
        String title = matcher.group(1).strip();
        return title.endsWith(":") ? title.substring(0, title.length() - 1).strip() : title;
      }
    }
    return "";
  }

  private String contentAfterHeader(String[] lines, String header) {
    List<String> content = new ArrayList<>();
    boolean headerFound = false;
    for (String line : lines) {
      if (!headerFound) {
        headerFound = line.strip().equals(header);
        continue;
      }
      if (shouldStop(line, content)) {
        break;
      }
      content.add(line);
    }
    String text = String.join("\n", content).strip();
    return text.length() >= minSectionLength ? text : "";
  }

  private static boolean shouldStop(String line, List<String> content) {
    String stripped = line.strip();
    if (stripped.isEmpty()) {
      return !content.isEmpty();
    }
    if (content.size() > MAX_HEADER_CONTENT_LINES) {
      return true;
    }
    return ALL_CAPS_LINE.matcher(stripped).matches();
  }

  private List<RawSection> detectParagraphs(PageText page) {
    List<RawSection> sections = new ArrayList<>();
    for (String block : PARAGRAPH_BREAK.split(page.text())) {
      String paragraph = block.strip();
      if (paragraph.length() >= minSectionLength && paragraph.length() <= maxSectionLength) {
        sections.add(new RawSection(paragraphTitle(paragraph), paragraph, page.pageNumber()));
      }
    }
    return sections;
  }

  private static String paragraphTitle(String paragraph) {
    String[] words = paragraph.split("\\s+");
    int count = Math.min(PARAGRAPH_TITLE_WORDS, words.length);
    return String.join(" ", List.of(words).subList(0, count)) + "...";
  }

  private List<RawSection> detectLists(PageText page) {
    List<RawSection> sections = new ArrayList<>();
    String[] lines = page.text().split("\n", -1);
    int i = 0;
    while (i < lines.length) {
      if (!isListItem(lines[i])) {
        i++;
        continue;
      }
      int start = i;
      List<String> items = new ArrayList<>();
      while (i < lines.length && (isListItem(lines[i]) || isContinuation(lines[i]))) {
        items.add(lines[i].strip());
        i++;
      }
      if (items.size() >= 2) {
        sections.add(
            new RawSection(
                "List Section " + (start + 1),
                truncate(String.join("\n", items)),
                page.pageNumber()));
      }
    }
    return sections;
  }

  private static boolean isListItem(String line) {
    String stripped = line.strip();
    return stripped.startsWith("•")
        || stripped.startsWith("-")
        || NUMBERED_ITEM.matcher(stripped).matches()
        || LETTERED_ITEM.matcher(stripped).matches();
  }

  private static boolean isContinuation(String line) {
    String stripped = line.strip();
    return !stripped.isEmpty()
        && !stripped.startsWith("•")
        && !stripped.startsWith("-")
        && !NUMBERED_ITEM.matcher(stripped).matches();
  }

  private String truncate(String text) {
    return text.length() <= maxSectionLength ? text : text.substring(0, maxSectionLength);
  }
}
