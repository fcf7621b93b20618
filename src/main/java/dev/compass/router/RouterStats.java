package dev.compass.router;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate view of the routing history. Derived on demand and never stored.
 *
 * @param totalQueries number of entries aggregated
 * @param bySource entry count per datasource label
 * @param byRetrievalType entry count per retrieval type label
 * @param avgConfidence mean decision confidence, 0 when there are no entries
 * @param errorCount entries carrying an error
 * @param successRate share of entries without an error, 0 when there are no entries
 */
public record RouterStats(
    int totalQueries,
    Map<String, Integer> bySource,
    Map<String, Integer> byRetrievalType,
    double avgConfidence,
    int errorCount,
    double successRate) {

  private static final RouterStats EMPTY = new RouterStats(0, Map.of(), Map.of(), 0.0, 0, 0.0);

  public static RouterStats empty() {
    return EMPTY;
  }

  public static RouterStats from(List<RoutingHistoryEntry> entries) {
    if (entries.isEmpty()) {
      return EMPTY;
    }

    Map<String, Integer> bySource = new LinkedHashMap<>();
    Map<String, Integer> byRetrievalType = new LinkedHashMap<>();
    double confidenceSum = 0.0;
    int errors = 0;

    for (RoutingHistoryEntry entry : entries) {
      bySource.merge(entry.datasource().label(), 1, Integer::sum);
      byRetrievalType.merge(entry.retrievalType().label(), 1, Integer::sum);
      confidenceSum += entry.confidence();
      if (entry.hasError()) {
        errors++;
      }
    }

    int total = entries.size();
    return new RouterStats(
        total,
        Collections.unmodifiableMap(bySource),
        Collections.unmodifiableMap(byRetrievalType),
        confidenceSum / total,
        errors,
        (double) (total - errors) / total);
  }
}
