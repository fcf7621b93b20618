package dev.compass.mcp;

import dev.compass.retrieval.LocalRetriever;
import dev.compass.retrieval.RetrievalOutcome;
import dev.compass.router.RouterStats;
import dev.compass.router.RoutingResult;
import dev.compass.router.SourceRouter;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing the router as tool methods.
 *
 * <p>Tool methods never throw: exceptions come back as {@code Error: ...} strings.
 *
 * @see McpToolConfig
 */
@Service
public class RouteToolService {

  private final SourceRouter router;
  private final ObjectProvider<LocalRetriever> localRetriever;

  public RouteToolService(SourceRouter router, ObjectProvider<LocalRetriever> localRetriever) {
    this.router = router;
    this.localRetriever = localRetriever;
  }

  /** Routes a query and returns the routing header followed by the context document. */
  @Tool(
      name = "route_query",
      description =
          "Decide whether a question should be answered from the user's uploaded documents, "
              + "from web search, or both, then retrieve the context. Returns the routing decision "
              + "followed by a context document with numbered, citable sources.")
  public String routeQuery(
      @ToolParam(description = "The user's question") @Nullable String query,
      @ToolParam(description = "Whether the user has uploaded documents", required = false)
          @Nullable Boolean hasLocalDocuments) {
    try {
      if (query == null || query.isBlank()) {
        return "Error: Query must not be empty. Provide the user's question.";
      }
      RoutingResult result =
          router.route(
              query, localRetriever.getIfAvailable(), Boolean.TRUE.equals(hasLocalDocuments));
      return formatResult(result);
    } catch (Exception e) {
      return "Error routing query: " + e.getMessage();
    }
  }

  /** Summarises routing decisions made since startup. */
  @Tool(
      name = "routing_statistics",
      description =
          "View routing statistics: number of routed queries, counts per datasource and "
              + "retrieval type, average confidence, and success rate.")
  public String routingStatistics() {
    try {
      RouterStats stats = router.getStats();
      return """
          Routing Statistics:
          - Total queries: %d
          - By source: %s
          - By retrieval type: %s
          - Average confidence: %s
          - Errors: %d
          - Success rate: %s"""
          .formatted(
              stats.totalQueries(),
              formatCounts(stats.bySource()),
              formatCounts(stats.byRetrievalType()),
              percent(stats.avgConfidence()),
              stats.errorCount(),
              percent(stats.successRate()));
    } catch (Exception e) {
      return "Error retrieving routing statistics: " + e.getMessage();
    }
  }

  private static String formatResult(RoutingResult result) {
    RetrievalOutcome outcome = result.outcome();
    StringBuilder text = new StringBuilder();
    text.append("Routing: ")
        .append(result.routing().datasource().label())
        .append(" (confidence ")
        .append(percent(result.routing().confidence()))
        .append(")\n");
    text.append("Reasoning: ").append(result.routing().reasoning()).append('\n');
    text.append("Sources: ").append(outcome.sources().size());
    if (outcome.webProvider() != null) {
      text.append(" (web results from ").append(outcome.webProvider()).append(')');
    }
    text.append('\n');
    if (outcome.hasError()) {
      text.append("Error: ").append(outcome.error()).append('\n');
    }
    text.append('\n').append(outcome.contextText());
    return text.toString();
  }

  private static String formatCounts(Map<String, Integer> counts) {
    if (counts.isEmpty()) {
      return "none";
    }
    return counts.entrySet().stream()
        .map(entry -> entry.getKey() + "=" + entry.getValue())
        .collect(Collectors.joining(", "));
  }

  private static String percent(double value) {
    return String.format(Locale.ROOT, "%.0f%%", value * 100);
  }
}
