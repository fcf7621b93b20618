package dev.compass.router;

import dev.compass.retrieval.LocalRetriever;
import dev.compass.retrieval.RetrievalDispatcher;
import dev.compass.retrieval.RetrievalOutcome;
import dev.compass.retrieval.RetrievalType;
import dev.compass.routing.QueryClassifier;
import dev.compass.routing.RoutingDecision;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for query routing: classify, dispatch, record.
 *
 * <p>Every call appends exactly one {@link RoutingHistoryEntry}, including calls that fail. A
 * failure that escapes classification is replaced by a default web decision and retrieval still
 * runs; a failure that escapes dispatch becomes an outcome with {@code error} set. Nothing is
 * thrown to the caller.
 */
@Service
public class SourceRouter {

  private static final Logger log = LoggerFactory.getLogger(SourceRouter.class);

  static final String DEFAULT_REASONING = "Default routing (classifier unavailable)";

  private final QueryClassifier classifier;
  private final RetrievalDispatcher dispatcher;
  private final RoutingHistory history;
  private final Clock clock;

  public SourceRouter(
      QueryClassifier classifier,
      RetrievalDispatcher dispatcher,
      RouterProperties properties,
      Clock clock) {
    this.classifier = classifier;
    this.dispatcher = dispatcher;
    this.history = new RoutingHistory(properties.historyCapacity());
    this.clock = clock;
  }

  /**
   * Routes one query.
   *
   * @param query the user query; null is treated as empty
   * @param localRetriever retriever over the user's documents, or null when there is none
   * @param hasLocalDocuments whether the user has uploaded documents
   * @return the decision and retrieval outcome, never null
   */
  public RoutingResult route(
      @Nullable String query, @Nullable LocalRetriever localRetriever, boolean hasLocalDocuments) {
    String text = query == null ? "" : query;
    log.info("Routing query: {}", abbreviate(text));

    RoutingDecision decision;
    String classificationError = null;
    try {
      decision = classifier.classify(text, hasLocalDocuments);
    } catch (RuntimeException e) {
      log.error("Classification failed, using default routing", e);
      decision = RoutingDecision.defaultWeb(DEFAULT_REASONING);
      classificationError = "Classification failed: " + e.getMessage();
    }

    RetrievalOutcome outcome;
    try {
      outcome = dispatcher.retrieve(text, decision, localRetriever);
    } catch (RuntimeException e) {
      log.error("Routing error", e);
      outcome =
          RetrievalOutcome.failed(
              RetrievalType.NONE, "Error during routing: " + e.getMessage(), String.valueOf(e));
    }
    if (classificationError != null) {
      outcome = outcome.withError(classificationError);
    }

    history.append(
        new RoutingHistoryEntry(
            text,
            decision.datasource(),
            decision.reasoning(),
            decision.confidence(),
            outcome.retrievalType(),
            outcome.sources().size(),
            outcome.error(),
            Instant.now(clock)));

    log.info(
        "Routed to {} ({} sources{})",
        decision.datasource().label(),
        outcome.sources().size(),
        outcome.hasError() ? ", error: " + outcome.error() : "");
    return new RoutingResult(text, decision, outcome);
  }

  /** Statistics over the retained history. Stable between calls to {@link #route}. */
  public RouterStats getStats() {
    return RouterStats.from(history.snapshot());
  }

  public List<RoutingHistoryEntry> history() {
    return history.snapshot();
  }

  private static String abbreviate(String query) {
    return query.length() <= 50 ? query : query.substring(0, 50) + "...";
  }
}
