package dev.personarank.output;

import dev.personarank.persona.PersonaCategory;
import dev.personarank.persona.PersonaProfile;
import dev.personarank.persona.TaskCategory;
import dev.personarank.section.SectionCandidate;
import dev.personarank.text.TextTokenizer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Describes a selected section from the persona's point of view: which vocabulary terms it
 * mentions, which role and task cues it carries, and how important it is overall.
 *
 * <p>Cues are matched against the start of words in the section's title and full body, so
 * "datasets" carries the "data" cue. Pure and deterministic.
 */
public class SectionAnnotator {

  static final int MAX_CONCEPTS = 5;

  static final double HIGH_IMPORTANCE_SCORE = 0.6;
  static final double MEDIUM_IMPORTANCE_SCORE = 0.3;

  private static final Map<PersonaCategory, List<Cue>> ROLE_CUES =
      Map.of(
          PersonaCategory.RESEARCHER,
          List.of(
              cue("Research methodology identified", "methodology", "method", "approach"),
              cue("Data sources and datasets mentioned", "data", "dataset", "sample"),
              cue("Research findings and results presented", "result", "finding", "conclusion")),
          PersonaCategory.STUDENT,
          List.of(
              cue("Key concepts for learning identified", "concept", "principle", "theory"),
              cue("Examples and illustrations available", "example", "illustration", "case"),
              cue("Practice materials and exercises found", "exercise", "problem", "practice")),
          PersonaCategory.ANALYST,
          List.of(
              cue("Analytical insights and trends identified", "trend", "pattern", "analysis"),
              cue("Performance metrics and KPIs mentioned", "metric", "kpi", "performance"),
              cue(
                  "Forecasting and predictive information",
                  "forecast",
                  "prediction",
                  "projection")));

  private static final Map<TaskCategory, List<Cue>> TASK_CUES =
      Map.of(
          TaskCategory.REVIEW,
          List.of(cue("Summary content suitable for review", "summary", "overview", "abstract")),
          TaskCategory.ANALYZE,
          List.of(cue("Comparative analysis opportunities", "comparison", "contrast", "versus")));

  /**
   * Annotates one selected section.
   *
   * @param candidate the section, with its full body
   * @param score the section's relevance score
   * @param persona the run's persona profile
   * @param task the run's task category
   * @return the section's concepts, observations and importance level
   */
  public SectionAnnotation annotate(
      SectionCandidate candidate, double score, PersonaProfile persona, TaskCategory task) {
    String text = candidate.title() + " " + candidate.body();
    List<String> concepts = concepts(text, persona.keywords());

    List<String> observations = new ArrayList<>();
    collect(text, ROLE_CUES.getOrDefault(persona.category(), List.of()), observations);
    collect(text, TASK_CUES.getOrDefault(task, List.of()), observations);

    return new SectionAnnotation(concepts, observations, importance(score, observations, concepts));
  }

  static ImportanceLevel importance(
      double score, List<String> observations, List<String> concepts) {
    if (score >= HIGH_IMPORTANCE_SCORE && observations.size() >= 2) {
      return ImportanceLevel.HIGH;
    }
    if (score >= MEDIUM_IMPORTANCE_SCORE && (!observations.isEmpty() || concepts.size() >= 3)) {
      return ImportanceLevel.MEDIUM;
    }
    return ImportanceLevel.LOW;
  }

  // in first-occurrence order
  private static List<String> concepts(String text, Set<String> vocabulary) {
    Set<String> found = new LinkedHashSet<>();
    for (String token : TextTokenizer.tokenize(text)) {
      if (vocabulary.contains(token)) {
        found.add(token);
        if (found.size() == MAX_CONCEPTS) {
          break;
        }
      }
    }
    return List.copyOf(found);
  }

  private static void collect(String text, List<Cue> cues, List<String> observations) {
    for (Cue cue : cues) {
      if (cue.terms().stream().anyMatch(term -> TextTokenizer.containsWordStart(text, term))) {
        observations.add(cue.observation());
      }
    }
  }

  private static Cue cue(String observation, String... terms) {
    return new Cue(List.of(terms), observation);
  }

  private record Cue(List<String> terms, String observation) {}

  /**
   * Persona-specific view of one section.
   *
   * @param relevantConcepts up to five persona vocabulary terms found in the section
   * @param roleObservations role and task cues the section carries
   * @param importanceLevel the derived importance
   */
  public record SectionAnnotation(
      List<String> relevantConcepts,
      List<String> roleObservations,
      ImportanceLevel importanceLevel) {

    public SectionAnnotation {
      relevantConcepts = List.copyOf(relevantConcepts);
      roleObservations = List.copyOf(roleObservations);
    }
  }
}
