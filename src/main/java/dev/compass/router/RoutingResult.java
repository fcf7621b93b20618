package dev.compass.router;

import dev.compass.retrieval.RetrievalOutcome;
import dev.compass.routing.RoutingDecision;

/** A routed query: the decision taken and what retrieval produced. */
public record RoutingResult(String query, RoutingDecision routing, RetrievalOutcome outcome) {

  public boolean hasError() {
    return outcome.hasError();
  }
}
