package dev.compass.routing;

import org.springframework.stereotype.Component;

/**
 * Keyword-only classifier used when the external classifier is missing or unreachable.
 *
 * <p>Decision order: no documents means web search; an explicit document reference means local
 * retrieval, or hybrid when the query also carries web intent; everything else is web search.
 */
@Component
public class HeuristicClassifier {

  static final String NO_DOCUMENTS = "No local documents available - using web search";

  public RoutingDecision classify(String query, boolean hasLocalDocuments) {
    if (!hasLocalDocuments) {
      return new RoutingDecision(Datasource.WEB, NO_DOCUMENTS, 0.9);
    }

    boolean documentReference = QueryPatterns.hasExplicitDocumentReference(query);
    boolean webIntent = QueryPatterns.hasWebIntent(query);

    if (documentReference && webIntent) {
      return new RoutingDecision(
          Datasource.HYBRID,
          "Query mentions both uploaded documents and external information",
          0.75);
    }
    if (documentReference) {
      return new RoutingDecision(
          Datasource.LOCAL, "Query explicitly references uploaded documents", 0.85);
    }
    if (webIntent || QueryPatterns.isGeneralKnowledge(query)) {
      return new RoutingDecision(
          Datasource.WEB, "General knowledge or external information query", 0.8);
    }
    return new RoutingDecision(
        Datasource.WEB, "General query - using web search by default", 0.7);
  }
}
