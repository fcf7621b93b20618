package dev.compass.search;

import com.fasterxml.jackson.annotation.JsonValue;

/** Whether a result is a synthesised direct answer or an ordinary web hit. */
public enum ResultKind {
  ANSWER("answer"),
  WEB("web");

  private final String value;

  ResultKind(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }
}
