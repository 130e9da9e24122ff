package dev.personarank.collection;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Batch entry point: ranks every collection directory found under the input directory.
 *
 * <p>Collections are independent and run on a fixed pool of {@code parallelism} threads. A failed
 * collection is logged and counted; the others still complete. The first program argument, when
 * present, overrides the configured input directory.
 */
@Component
@Profile("batch")
public class CollectionRunner implements CommandLineRunner {

  private static final Logger log = LoggerFactory.getLogger(CollectionRunner.class);

  private final CollectionProcessor processor;
  private final CollectionProperties properties;

  public CollectionRunner(CollectionProcessor processor, CollectionProperties properties) {
    this.processor = processor;
    this.properties = properties;
  }

  @Override
  public void run(String... args) {
    Path inputDir = args.length > 0 ? Path.of(args[0]) : properties.inputDir();
    BatchSummary summary = runAll(inputDir);
    log.info(
        "Batch finished: {} of {} collections succeeded", summary.succeeded(), summary.total());
    if (!summary.failed().isEmpty()) {
      log.warn("Failed collections: {}", summary.failed());
    }
  }

  /**
   * Processes all collections under a directory.
   *
   * @param inputDir the directory to scan
   * @return how many collections succeeded and which failed
   * @throws IllegalStateException if the directory does not exist or cannot be listed
   */
  public BatchSummary runAll(Path inputDir) {
    List<Path> collections = findCollections(inputDir);
    if (collections.isEmpty()) {
      log.warn(
          "No collection directories starting with '{}' in {}", properties.namePrefix(), inputDir);
      return new BatchSummary(0, List.of());
    }

    ExecutorService pool =
        Executors.newFixedThreadPool(Math.min(properties.parallelism(), collections.size()));
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (Path collection : collections) {
        futures.add(pool.submit(() -> processor.process(collection)));
      }
      return collect(collections, futures);
    } finally {
      pool.shutdownNow();
    }
  }

  private BatchSummary collect(List<Path> collections, List<Future<?>> futures) {
    int succeeded = 0;
    List<String> failed = new ArrayList<>();
    for (int i = 0; i < collections.size(); i++) {
      String name = collections.get(i).getFileName().toString();
      try {
        futures.get(i).get();
        succeeded++;
      } catch (ExecutionException e) {
        log.error("Collection {} failed: {}", name, e.getCause().getMessage(), e.getCause());
        failed.add(name);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("Interrupted while processing collections", e);
      }
    }
    return new BatchSummary(succeeded, failed);
  }

  private List<Path> findCollections(Path inputDir) {
    if (!Files.isDirectory(inputDir)) {
      throw new IllegalStateException("Input directory does not exist: " + inputDir);
    }
    try (Stream<Path> children = Files.list(inputDir)) {
      return children
          .filter(Files::isDirectory)
          .filter(p -> p.getFileName().toString().startsWith(properties.namePrefix()))
          .sorted(Comparator.comparing(p -> p.getFileName().toString()))
          .toList();
    } catch (IOException e) {
      throw new IllegalStateException("Cannot list input directory " + inputDir, e);
    }
  }
}
