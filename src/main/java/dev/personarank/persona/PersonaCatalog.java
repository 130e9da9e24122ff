package dev.personarank.persona;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, ordered lookup table of persona definitions.
 *
 * <p>Declaration order is priority order: when a role description matches the triggers of several
 * definitions, the first one wins. The catalog is built once at startup (see {@link #builtIn()})
 * and passed explicitly to {@link PersonaClassifier}.
 */
public final class PersonaCatalog {

  private final List<PersonaDefinition> definitions;

  public PersonaCatalog(List<PersonaDefinition> definitions) {
    Set<PersonaCategory> seen = EnumSet.noneOf(PersonaCategory.class);
    for (PersonaDefinition definition : definitions) {
      if (!seen.add(definition.category())) {
        throw new IllegalArgumentException(
            "Duplicate persona definition for " + definition.category());
      }
    }
    this.definitions = List.copyOf(definitions);
  }

  /** Definitions in priority order. */
  public List<PersonaDefinition> definitions() {
    return definitions;
  }

  /**
   * Looks up the definition of a category.
   *
   * @param category the category
   * @return the definition, or empty for {@link PersonaCategory#GENERIC} or unknown categories
   */
  public Optional<PersonaDefinition> find(PersonaCategory category) {
    return definitions.stream().filter(d -> d.category() == category).findFirst();
  }

  /** The built-in persona table. */
  public static PersonaCatalog builtIn() {
    return new PersonaCatalog(
        List.of(
            PersonaDefinition.of(
                PersonaCategory.TRAVEL_PLANNER,
                List.of("travel", "trip", "vacation", "tourism", "tourist", "tour guide"),
                List.of(
                    "travel", "trip", "itinerary", "destination", "hotel", "accommodation",
                    "budget", "restaurant", "cuisine", "beach", "city", "tour", "attraction",
                    "sightseeing", "transport", "train", "nightlife", "activity", "group",
                    "booking", "guide", "museum", "tip", "packing", "culture", "festival",
                    "adventure", "coastal", "excursion", "day")),
            PersonaDefinition.of(
                PersonaCategory.HR_PROFESSIONAL,
                List.of("hr", "human resource", "human resources", "employee", "onboarding",
                    "recruiter", "people operations"),
                List.of(
                    "form", "fillable", "onboarding", "compliance", "employee", "signature",
                    "sign", "document", "pdf", "field", "policy", "training", "hiring", "record",
                    "workflow", "request", "approval", "share", "create", "convert", "export",
                    "template", "checklist", "benefit")),
            PersonaDefinition.of(
                PersonaCategory.FOOD_CONTRACTOR,
                List.of("food", "catering", "caterer", "chef", "restaurant", "cook"),
                List.of(
                    "recipe", "ingredient", "menu", "dish", "vegetarian", "vegan", "gluten",
                    "buffet", "dinner", "lunch", "breakfast", "side", "serve", "cook", "bake",
                    "salad", "sauce", "meal", "portion", "kitchen", "flavor", "spice", "protein",
                    "catering")),
            PersonaDefinition.of(
                PersonaCategory.RESEARCHER,
                List.of("researcher", "research", "scientist", "phd", "postdoc", "scholar"),
                List.of(
                    "research", "study", "analysis", "methodology", "data", "dataset",
                    "experiment", "hypothesis", "literature", "publication", "finding",
                    "result", "conclusion", "benchmark", "evaluation", "method")),
            PersonaDefinition.of(
                PersonaCategory.STUDENT,
                List.of("student", "undergraduate", "learner", "pupil"),
                List.of(
                    "learn", "study", "understand", "concept", "theory", "practice", "example",
                    "exercise", "exam", "assignment", "knowledge", "skill", "definition",
                    "principle", "mechanism", "key")),
            PersonaDefinition.of(
                PersonaCategory.ANALYST,
                List.of("analyst", "investment", "financial", "consultant"),
                List.of(
                    "analyze", "evaluate", "assess", "trend", "pattern", "metric", "performance",
                    "comparison", "forecast", "strategy", "insight", "recommendation", "revenue",
                    "growth", "market", "investment", "kpi")),
            PersonaDefinition.of(
                PersonaCategory.TEACHER,
                List.of("teacher", "educator", "instructor", "professor", "trainer", "tutor"),
                List.of(
                    "teach", "explain", "instruction", "curriculum", "lesson", "education",
                    "training", "guidance", "demonstration", "assessment", "learning",
                    "development", "classroom", "activity")),
            PersonaDefinition.of(
                PersonaCategory.MANAGER,
                List.of("manager", "director", "lead", "supervisor", "executive", "head of"),
                List.of(
                    "manage", "plan", "organize", "control", "strategy", "decision", "resource",
                    "team", "process", "objective", "performance", "leadership", "budget",
                    "schedule", "risk", "stakeholder")),
            PersonaDefinition.of(
                PersonaCategory.ENTREPRENEUR,
                List.of("entrepreneur", "founder", "startup", "business owner"),
                List.of(
                    "business", "opportunity", "market", "innovation", "startup", "venture",
                    "revenue", "growth", "investment", "competition", "strategy", "scalability",
                    "customer", "funding", "product"))));
  }
}
