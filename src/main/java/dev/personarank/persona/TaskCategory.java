package dev.personarank.persona;

import com.fasterxml.jackson.annotation.JsonValue;
import dev.personarank.text.TextTokenizer;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Coarse intent of a job-to-be-done, recognised from trigger words in declaration order. A trigger
 * matches any word of the job text that starts with it ("planning" is a PREPARE job). Reported in
 * run metadata and used for task-specific section observations; it does not influence scoring.
 */
public enum TaskCategory {
  REVIEW(
      "review", List.of("review", "summary", "overview", "evaluation", "assessment", "analysis")),
  LEARN("learn", List.of("learn", "understand", "study", "master", "practice", "acquire")),
  ANALYZE(
      "analyze",
      List.of("analyze", "analyse", "examine", "investigate", "evaluate", "assess", "compare")),
  PREPARE("prepare", List.of("prepare", "plan", "organize", "design", "develop", "create")),
  SUMMARIZE(
      "summarize",
      List.of("summarize", "condense", "extract", "highlight", "synthesize", "distill")),
  GENERAL("general", List.of());

  private final String value;
  private final List<String> triggers;

  TaskCategory(String value, List<String> triggers) {
    this.value = value;
    this.triggers = triggers;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /**
   * Resolves the category of a job description.
   *
   * @param jobText the job description, possibly null
   * @return the first category with a matching trigger, or {@link #GENERAL}
   */
  static TaskCategory of(@Nullable String jobText) {
    for (TaskCategory category : values()) {
      for (String trigger : category.triggers) {
        if (TextTokenizer.containsWordStart(jobText, trigger)) {
          return category;
        }
      }
    }
    return GENERAL;
  }
}
