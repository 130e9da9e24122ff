package dev.personarank.persona;

import java.util.Set;

/**
 * The persona resolved for one collection run: its category and the keyword vocabulary that
 * biases relevance scoring.
 *
 * @param category the resolved category ({@link PersonaCategory#GENERIC} when nothing matched)
 * @param keywords lowercase, plural-folded vocabulary; empty for the generic profile
 */
public record PersonaProfile(PersonaCategory category, Set<String> keywords) {

  private static final PersonaProfile GENERIC = new PersonaProfile(PersonaCategory.GENERIC, Set.of());

  public PersonaProfile {
    if (category == null) {
      throw new IllegalArgumentException("category must not be null");
    }
    keywords = keywords == null ? Set.of() : Set.copyOf(keywords);
  }

  /** The fallback profile for unrecognised roles: generic category, empty vocabulary. */
  public static PersonaProfile generic() {
    return GENERIC;
  }
}
