package dev.personarank.persona;

import java.util.Set;

/**
 * The job-to-be-done of one collection run, analysed once and shared read-only by all scoring
 * calls.
 *
 * @param rawText the job description as given
 * @param keywords folded content keywords of the description
 * @param taskCategory the recognised task intent
 */
public record JobContext(String rawText, Set<String> keywords, TaskCategory taskCategory) {

  public JobContext {
    rawText = rawText == null ? "" : rawText;
    keywords = keywords == null ? Set.of() : Set.copyOf(keywords);
    taskCategory = taskCategory == null ? TaskCategory.GENERAL : taskCategory;
  }
}
