package dev.compass.retrieval;

import com.fasterxml.jackson.annotation.JsonValue;

/** Retrieval path that actually ran for a query. */
public enum RetrievalType {
  LOCAL("local_rag"),
  WEB("web_search"),
  HYBRID("hybrid"),
  /** Nothing ran, the call failed before dispatch. */
  NONE("none");

  private final String label;

  RetrievalType(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }
}
