package dev.personarank.collection;

import java.nio.file.Path;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Batch mode settings, bound from {@code personarank.collections.*}.
 *
 * @param inputDir directory scanned for collection sub-directories
 * @param outputDir directory receiving one sub-directory per collection; blank writes the result
 *     into the collection directory itself
 * @param namePrefix only sub-directories whose name starts with this prefix are collections
 * @param parallelism number of collections processed concurrently (at least 1)
 * @param inputFileName name of the collection descriptor file
 * @param outputFileName name of the result file
 * @param documentsDir name of the sub-directory holding the collection's PDFs
 */
@ConfigurationProperties(prefix = "personarank.collections")
public record CollectionProperties(
    @DefaultValue("input") Path inputDir,
    @DefaultValue("") String outputDir,
    @DefaultValue("Collection") String namePrefix,
    @DefaultValue("2") int parallelism,
    @DefaultValue("challenge1b_input.json") String inputFileName,
    @DefaultValue("challenge1b_output.json") String outputFileName,
    @DefaultValue("PDFs") String documentsDir) {

  public CollectionProperties {
    if (parallelism < 1) {
      throw new IllegalStateException(
          "personarank.collections.parallelism must be at least 1, got: " + parallelism);
    }
    outputDir = outputDir == null ? "" : outputDir;
  }

  /** Resolves where the result of a collection is written. */
  public Path outputFile(Path collectionDir) {
    if (outputDir.isBlank()) {
      return collectionDir.resolve(outputFileName);
    }
    return Path.of(outputDir).resolve(collectionDir.getFileName()).resolve(outputFileName);
  }
}
