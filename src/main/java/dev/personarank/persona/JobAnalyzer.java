package dev.personarank.persona;

import dev.personarank.text.TextTokenizer;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/** Derives a {@link JobContext} from a free-text job-to-be-done description. */
public class JobAnalyzer {

  /**
   * Extracts the job's keywords (stopword-filtered tokens of at least three characters) and its
   * task category.
   *
   * @param jobText the job description, possibly empty or null
   * @return the job context, never null
   */
  public JobContext analyze(@Nullable String jobText) {
    Set<String> keywords = TextTokenizer.keywords(jobText);
    return new JobContext(jobText, keywords, TaskCategory.of(jobText));
  }
}
