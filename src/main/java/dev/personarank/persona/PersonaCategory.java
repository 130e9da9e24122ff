package dev.personarank.persona;

import com.fasterxml.jackson.annotation.JsonValue;

/** The fixed set of persona categories a role description can resolve to. */
public enum PersonaCategory {
  TRAVEL_PLANNER("travel_planner"),
  HR_PROFESSIONAL("hr_professional"),
  FOOD_CONTRACTOR("food_contractor"),
  RESEARCHER("researcher"),
  STUDENT("student"),
  ANALYST("analyst"),
  TEACHER("teacher"),
  MANAGER("manager"),
  ENTREPRENEUR("entrepreneur"),
  GENERIC("generic");

  private final String value;

  PersonaCategory(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
