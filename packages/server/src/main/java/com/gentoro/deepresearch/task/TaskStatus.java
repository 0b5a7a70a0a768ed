package com.gentoro.deepresearch.task;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Vocabulary of research task states. The usual order is planning, searching, writing and then
 * one of the terminal states, but {@link TaskManager} does not enforce any transition.
 */
public enum TaskStatus {
  PLANNING,
  SEARCHING,
  WRITING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static TaskStatus fromWireName(String value) {
    return TaskStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
