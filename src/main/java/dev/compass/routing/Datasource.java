package dev.compass.routing;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Retrieval path chosen for a query. The label is the token the external classifier is asked to
 * answer with.
 */
public enum Datasource {
  LOCAL("local_rag"),
  WEB("web_search"),
  HYBRID("hybrid");

  private final String label;

  Datasource(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  /**
   * Resolves a classifier label to a datasource. Only the labels match, ignoring case and
   * surrounding whitespace. Anything else, including null and the enum constant names, is coerced
   * to {@link #WEB}.
   *
   * @param value the label returned by the classifier
   * @return the matching datasource, or {@code WEB}
   */
  @JsonCreator
  public static Datasource fromLabel(@Nullable String value) {
    if (value == null) {
      return WEB;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (Datasource datasource : values()) {
      if (datasource.label.equals(normalized)) {
        return datasource;
      }
    }
    return WEB;
  }
}
