package dev.compass.routing;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a query plus the availability of local documents to a {@link RoutingDecision}.
 *
 * <p>The external {@link ClassifierClient} is consulted first and its answer is parsed leniently,
 * then two deterministic overrides are applied:
 *
 * <ol>
 *   <li>without local documents, {@code LOCAL} and {@code HYBRID} become {@code WEB} (0.9)
 *   <li>with local documents, a {@code LOCAL} answer for a general-knowledge query that carries no
 *       explicit document reference becomes {@code WEB} (0.85)
 * </ol>
 *
 * <p>When no client is configured or the client throws, {@link HeuristicClassifier} decides
 * instead. {@link #classify} never throws.
 */
public class QueryClassifier {

  private static final Logger log = LoggerFactory.getLogger(QueryClassifier.class);

  static final String GENERAL_KNOWLEDGE = "General knowledge question - using web search";

  private final @Nullable ClassifierClient client;
  private final ClassificationResponseParser parser;
  private final HeuristicClassifier heuristic;

  public QueryClassifier(
      @Nullable ClassifierClient client,
      ClassificationResponseParser parser,
      HeuristicClassifier heuristic) {
    this.client = client;
    this.parser = parser;
    this.heuristic = heuristic;
  }

  /**
   * Classifies a query.
   *
   * @param query the user query; null is treated as empty text
   * @param hasLocalDocuments whether the caller has local documents to search
   * @return the final decision after overrides, or the heuristic decision on failure
   */
  public RoutingDecision classify(@Nullable String query, boolean hasLocalDocuments) {
    String text = query == null ? "" : query;

    if (client == null) {
      RoutingDecision fallback = heuristic.classify(text, hasLocalDocuments);
      log.debug("No classifier client configured, heuristic chose {}", fallback.datasource());
      return fallback;
    }

    String response;
    try {
      response = client.classify(text, contextHint(hasLocalDocuments));
    } catch (RuntimeException e) {
      log.warn("Classification error: {}. Using fallback logic.", e.getMessage());
      return heuristic.classify(text, hasLocalDocuments);
    }

    RoutingDecision decision = applyOverrides(text, parser.parse(response), hasLocalDocuments);
    log.info("Classified '{}' -> {}", abbreviate(text), decision.datasource().label());
    return decision;
  }

  static String contextHint(boolean hasLocalDocuments) {
    return hasLocalDocuments
        ? "User has uploaded documents available"
        : "User has NO uploaded documents";
  }

  static RoutingDecision applyOverrides(
      String query, RoutingDecision decision, boolean hasLocalDocuments) {
    Datasource datasource = decision.datasource();

    if (!hasLocalDocuments && datasource != Datasource.WEB) {
      log.info("No documents available, overriding {} -> web_search", datasource.label());
      return new RoutingDecision(Datasource.WEB, HeuristicClassifier.NO_DOCUMENTS, 0.9);
    }

    if (hasLocalDocuments
        && datasource == Datasource.LOCAL
        && QueryPatterns.isGeneralKnowledge(query)
        && !QueryPatterns.hasExplicitDocumentReference(query)) {
      log.info("General knowledge question detected, overriding local_rag -> web_search");
      return new RoutingDecision(Datasource.WEB, GENERAL_KNOWLEDGE, 0.85);
    }

    return decision;
  }

  static String abbreviate(String query) {
    return query.length() <= 50 ? query : query.substring(0, 50) + "...";
  }
}
