package dev.compass.router;

import dev.compass.retrieval.RetrievalType;
import dev.compass.routing.Datasource;
import java.time.Instant;
import org.jspecify.annotations.Nullable;

/** One routed query as recorded in the routing history. Never changed after it is appended. */
public record RoutingHistoryEntry(
    String query,
    Datasource datasource,
    String reasoning,
    double confidence,
    RetrievalType retrievalType,
    int sourceCount,
    @Nullable String error,
    Instant timestamp) {

  public boolean hasError() {
    return error != null && !error.isBlank();
  }
}
