package dev.personarank.persona;

import dev.personarank.text.TextTokenizer;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a free-text role description to a {@link PersonaProfile}.
 *
 * <p>Each catalog definition's triggers are tested, in catalog order, against the lowercased role
 * text: a trigger matches when some word of the role starts with it, so "Travelling consultant"
 * hits "travel" and "Foodservice contractor" hits "food", but "chrome" never hits "hr". The first
 * matching definition wins; a role that matches nothing
 * (including an empty or null role) resolves to {@link PersonaProfile#generic()}. This is a total,
 * side-effect-free function.
 */
public class PersonaClassifier {

  private static final Logger log = LoggerFactory.getLogger(PersonaClassifier.class);

  private final PersonaCatalog catalog;

  public PersonaClassifier(PersonaCatalog catalog) {
    this.catalog = catalog;
  }

  /**
   * Classifies a role description.
   *
   * @param roleText the persona/role description, possibly empty or null
   * @return the matching profile, never null
   */
  public PersonaProfile classify(@Nullable String roleText) {
    for (PersonaDefinition definition : catalog.definitions()) {
      for (String trigger : definition.triggers()) {
        if (TextTokenizer.containsWordStart(roleText, trigger)) {
          return definition.toProfile();
        }
      }
    }
    log.debug("No persona matched role '{}', using generic profile", roleText);
    return PersonaProfile.generic();
  }
}
