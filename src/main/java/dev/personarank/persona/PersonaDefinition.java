package dev.personarank.persona;

import dev.personarank.text.TextTokenizer;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * One row of the persona table: the terms that identify a role and the vocabulary associated with
 * it.
 *
 * <p>Both lists are given in natural form. Triggers are lowercased and matched against the start
 * of role words; the vocabulary is plural-folded like document tokens.
 *
 * @param category the category this row resolves to
 * @param triggers lowercase trigger terms or phrases
 * @param vocabulary the scoring vocabulary, folded to single tokens
 */
public record PersonaDefinition(
    PersonaCategory category, List<String> triggers, Set<String> vocabulary) {

  public PersonaDefinition {
    if (category == null || category == PersonaCategory.GENERIC) {
      throw new IllegalArgumentException("A persona definition needs a non-generic category");
    }
    if (triggers == null || triggers.isEmpty()) {
      throw new IllegalArgumentException("Persona " + category + " needs at least one trigger");
    }
    triggers =
        triggers.stream()
            .map(t -> t.strip().toLowerCase(Locale.ROOT))
            .filter(t -> !t.isEmpty())
            .distinct()
            .toList();
    vocabulary = TextTokenizer.foldAll(vocabulary == null ? Set.of() : vocabulary);
  }

  /** Creates a definition from natural-language trigger and vocabulary lists. */
  public static PersonaDefinition of(
      PersonaCategory category, List<String> triggers, List<String> vocabulary) {
    return new PersonaDefinition(category, triggers, Set.copyOf(vocabulary));
  }

  /** Builds the scoring profile for this definition. */
  public PersonaProfile toProfile() {
    return new PersonaProfile(category, vocabulary);
  }
}
