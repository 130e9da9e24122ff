package dev.personarank.output;

import com.fasterxml.jackson.annotation.JsonValue;

/** How much a selected section matters to the persona, from its score and the cues it carries. */
public enum ImportanceLevel {
  HIGH("high"),
  MEDIUM("medium"),
  LOW("low");

  private final String value;

  ImportanceLevel(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
