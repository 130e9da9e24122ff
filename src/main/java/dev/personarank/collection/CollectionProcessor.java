package dev.personarank.collection;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.personarank.extraction.PageTextExtractor;
import dev.personarank.output.RankingResult;
import dev.personarank.pipeline.RankingPipeline;
import dev.personarank.section.DocumentSections;
import dev.personarank.section.PageText;
import dev.personarank.section.SectionDetector;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Processes one collection directory end to end: reads and validates the descriptor, extracts and
 * segments each referenced PDF, ranks the sections and writes the result JSON.
 *
 * <p>A document listed in the descriptor but absent from the PDF directory is skipped with a
 * warning. A document that exists but cannot be read fails the whole collection.
 */
@Service
public class CollectionProcessor {

  private static final Logger log = LoggerFactory.getLogger(CollectionProcessor.class);

  private final ObjectMapper objectMapper;
  private final Validator validator;
  private final PageTextExtractor extractor;
  private final SectionDetector detector;
  private final RankingPipeline pipeline;
  private final CollectionProperties properties;

  public CollectionProcessor(
      ObjectMapper objectMapper,
      Validator validator,
      PageTextExtractor extractor,
      SectionDetector detector,
      RankingPipeline pipeline,
      CollectionProperties properties) {
    this.objectMapper = objectMapper;
    this.validator = validator;
    this.extractor = extractor;
    this.detector = detector;
    this.pipeline = pipeline;
    this.properties = properties;
  }

  /**
   * Ranks one collection and writes its result file.
   *
   * @param collectionDir the collection directory
   * @return the result that was written
   * @throws CollectionProcessingException if the descriptor is missing, malformed or invalid, a
   *     document name points outside the documents directory, a document cannot be read, or the
   *     result cannot be written
   */
  public RankingResult process(Path collectionDir) {
    String name = collectionDir.getFileName().toString();
    CollectionInput input = readInput(collectionDir.resolve(properties.inputFileName()));

    List<DocumentSections> documents = new ArrayList<>();
    Path pdfDir = collectionDir.resolve(properties.documentsDir()).normalize();
    for (CollectionInput.DocumentRef ref : input.documents()) {
      Path pdf = resolveDocument(pdfDir, ref.filename());
      if (!Files.isRegularFile(pdf)) {
        log.warn("Skipping missing document {} in collection {}", ref.filename(), name);
        continue;
      }
      documents.add(detector.detect(ref.filename(), extract(pdf)));
    }

    RankingResult result =
        pipeline
            .rank(input.persona().role(), input.jobToBeDone().task(), documents)
            .withChallengeInfo(input.challengeInfo());

    Path outputFile = properties.outputFile(collectionDir);
    write(outputFile, result);
    log.info(
        "Collection {}: {} documents, {} sections written to {}",
        name,
        documents.size(),
        result.extractedSections().size(),
        outputFile);
    return result;
  }

  private static Path resolveDocument(Path pdfDir, String filename) {
    Path pdf = pdfDir.resolve(filename).normalize();
    if (!pdf.startsWith(pdfDir) || pdf.equals(pdfDir)) {
      throw new CollectionProcessingException(
          "Document " + filename + " resolves outside " + pdfDir);
    }
    return pdf;
  }

  private CollectionInput readInput(Path inputFile) {
    if (!Files.isRegularFile(inputFile)) {
      throw new CollectionProcessingException("Input file not found: " + inputFile);
    }
    CollectionInput input;
    try {
      input = objectMapper.readValue(inputFile.toFile(), CollectionInput.class);
    } catch (IOException e) {
      throw new CollectionProcessingException("Cannot read input file " + inputFile, e);
    }
    Set<ConstraintViolation<CollectionInput>> violations = validator.validate(input);
    if (!violations.isEmpty()) {
      String details =
          violations.stream()
              .map(v -> v.getPropertyPath() + ": " + v.getMessage())
              .sorted()
              .collect(Collectors.joining(", "));
      throw new CollectionProcessingException("Invalid input file " + inputFile + ": " + details);
    }
    return input;
  }

  private List<PageText> extract(Path pdf) {
    try {
      return extractor.extract(pdf);
    } catch (IOException e) {
      throw new CollectionProcessingException("Cannot extract text from " + pdf, e);
    }
  }

  private void write(Path outputFile, RankingResult result) {
    try {
      Path parent = outputFile.getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(outputFile.toFile(), result);
    } catch (IOException e) {
      throw new CollectionProcessingException("Cannot write result to " + outputFile, e);
    }
  }
}
