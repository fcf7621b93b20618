package dev.compass.routing;

import org.jspecify.annotations.Nullable;

/**
 * Immutable routing decision for one query.
 *
 * @param datasource the chosen retrieval path, never null
 * @param reasoning short human-readable justification
 * @param confidence confidence in [0, 1]
 */
public record RoutingDecision(Datasource datasource, String reasoning, double confidence) {

  /** Confidence used when the classifier omits one or returns an unparsable value. */
  public static final double DEFAULT_CONFIDENCE = 0.7;

  public RoutingDecision {
    datasource = datasource == null ? Datasource.WEB : datasource;
    reasoning = reasoning == null ? "" : reasoning;
  }

  /** Decision used when classification could not run at all. */
  public static RoutingDecision defaultWeb(@Nullable String reasoning) {
    return new RoutingDecision(
        Datasource.WEB, reasoning != null ? reasoning : "Default routing", 0.5);
  }
}
