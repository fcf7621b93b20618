package dev.compass.retrieval;

import dev.compass.fetch.FetchProperties;
import dev.compass.fetch.WebResultEnricher;
import dev.compass.routing.Datasource;
import dev.compass.routing.RoutingDecision;
import dev.compass.search.ChainResult;
import dev.compass.search.SearchChain;
import dev.compass.search.SearchProperties;
import dev.compass.search.SearchResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs the retrieval path named by a {@link RoutingDecision} and formats the outcome.
 *
 * <ul>
 *   <li>{@code LOCAL} asks the local retriever; no retriever or no passages is reported as an
 *       error.
 *   <li>{@code WEB} runs the {@link SearchChain}, then enriches results with page text when
 *       fetching is enabled.
 *   <li>{@code HYBRID} runs both; the local side on the retrieval executor, the web side on the
 *       calling thread. Either side may fail without hiding the other.
 * </ul>
 *
 * <p>No path throws. Failures become a {@link RetrievalOutcome} with {@code error} set.
 */
@Service
public class RetrievalDispatcher {

  private static final Logger log = LoggerFactory.getLogger(RetrievalDispatcher.class);

  static final String NO_RETRIEVER_CONTEXT = "No local documents available.";
  static final String NO_RETRIEVER_ERROR = "No local retriever configured";
  static final String NO_LOCAL_RESULTS_CONTEXT = "No relevant documents found in uploaded files.";
  static final String NO_LOCAL_RESULTS_ERROR = "No relevant local documents found";
  static final String WEB_DISABLED_CONTEXT = "Web search is not enabled.";
  static final String WEB_DISABLED_ERROR = "Web search not enabled";

  private final SearchChain searchChain;
  private final WebResultEnricher enricher;
  private final ContextFormatter formatter;
  private final ExecutorService retrievalExecutor;
  private final boolean webEnabled;
  private final boolean fetchEnabled;
  private final int webResults;
  private final int hybridWebResults;

  public RetrievalDispatcher(
      SearchChain searchChain,
      WebResultEnricher enricher,
      ContextFormatter formatter,
      SearchProperties searchProperties,
      FetchProperties fetchProperties,
      @Qualifier("retrievalExecutor") ExecutorService retrievalExecutor) {
    this.searchChain = searchChain;
    this.enricher = enricher;
    this.formatter = formatter;
    this.retrievalExecutor = retrievalExecutor;
    this.webEnabled = searchProperties.enabled();
    this.fetchEnabled = fetchProperties.enabled();
    this.webResults = searchProperties.maxResults();
    this.hybridWebResults = searchProperties.hybridWebResults();
  }

  /**
   * Retrieves context for {@code query} along the path chosen by {@code decision}.
   *
   * @param query the user query
   * @param decision routing decision; a missing decision or datasource means web search
   * @param localRetriever the user's document retriever, if any
   * @return a well-formed outcome, never null
   */
  public RetrievalOutcome retrieve(
      String query, @Nullable RoutingDecision decision, @Nullable LocalRetriever localRetriever) {
    Datasource datasource =
        decision == null || decision.datasource() == null ? Datasource.WEB : decision.datasource();
    return switch (datasource) {
      case LOCAL -> retrieveLocal(query, localRetriever);
      case WEB -> retrieveWeb(query);
      case HYBRID -> retrieveHybrid(query, localRetriever);
    };
  }

  RetrievalOutcome retrieveLocal(String query, @Nullable LocalRetriever localRetriever) {
    log.info("Retrieving from local documents");
    if (localRetriever == null) {
      log.warn("No local retriever configured");
      return RetrievalOutcome.failed(RetrievalType.LOCAL, NO_RETRIEVER_CONTEXT, NO_RETRIEVER_ERROR);
    }

    try {
      List<LocalChunk> chunks = presentChunks(localRetriever.getRelevantDocuments(query));
      if (chunks.isEmpty()) {
        log.info("No relevant local documents found");
        return RetrievalOutcome.failed(
            RetrievalType.LOCAL, NO_LOCAL_RESULTS_CONTEXT, NO_LOCAL_RESULTS_ERROR);
      }

      log.info("Retrieved {} local documents", chunks.size());
      return new RetrievalOutcome(
          formatter.formatLocal(chunks),
          chunks.stream().map(SourceRef::local).toList(),
          RetrievalType.LOCAL,
          new ResultCounts(chunks.size(), 0),
          null,
          List.of(),
          null);
    } catch (RuntimeException e) {
      log.warn("Local retrieval failed: {}", e.getMessage(), e);
      return RetrievalOutcome.failed(
          RetrievalType.LOCAL, "Error retrieving local documents: " + e.getMessage(), message(e));
    }
  }

  RetrievalOutcome retrieveWeb(String query) {
    log.info("Performing web search");
    if (!webEnabled) {
      log.warn("Web search not enabled");
      return RetrievalOutcome.failed(RetrievalType.WEB, WEB_DISABLED_CONTEXT, WEB_DISABLED_ERROR);
    }

    WebSide web;
    try {
      web = searchWeb(query, webResults);
    } catch (RuntimeException e) {
      log.warn("Web search failed: {}", e.getMessage(), e);
      return RetrievalOutcome.failed(
          RetrievalType.WEB, "Error performing web search: " + e.getMessage(), message(e));
    }

    if (web.results().isEmpty()) {
      return new RetrievalOutcome(
          "No web search results found for your query.",
          List.of(),
          RetrievalType.WEB,
          ResultCounts.none(),
          null,
          List.of(),
          web.provider());
    }

    log.info("Retrieved {} web results from {}", web.results().size(), web.provider());
    return new RetrievalOutcome(
        formatter.formatWeb(query, web.results()),
        web.results().stream().map(SourceRef::web).toList(),
        RetrievalType.WEB,
        new ResultCounts(0, web.results().size()),
        null,
        web.results(),
        web.provider());
  }

  RetrievalOutcome retrieveHybrid(String query, @Nullable LocalRetriever localRetriever) {
    log.info("Performing hybrid retrieval");
    CompletableFuture<LocalSide> localFuture = startLocal(query, localRetriever);

    WebSide web;
    if (!webEnabled) {
      web = WebSide.failed(WEB_DISABLED_CONTEXT);
    } else {
      try {
        web = searchWeb(query, hybridWebResults);
      } catch (RuntimeException e) {
        log.warn("Web side of hybrid retrieval failed: {}", e.getMessage());
        web = WebSide.failed("Web search failed: " + e.getMessage());
      }
    }

    LocalSide local = localFuture.join();

    List<SourceRef> sources = new ArrayList<>();
    local.chunks().forEach(chunk -> sources.add(SourceRef.local(chunk)));
    web.results().forEach(result -> sources.add(SourceRef.web(result)));

    String error = null;
    if (local.failure() != null && web.failure() != null) {
      error = "Local: " + local.failure() + "; Web: " + web.failure();
    }

    log.info("Hybrid retrieval: {} local + {} web", local.chunks().size(), web.results().size());
    return new RetrievalOutcome(
        formatter.formatHybrid(local.chunks(), web.results(), local.failure(), web.failure()),
        sources,
        RetrievalType.HYBRID,
        new ResultCounts(local.chunks().size(), web.results().size()),
        error,
        web.results(),
        web.provider());
  }

  private CompletableFuture<LocalSide> startLocal(
      String query, @Nullable LocalRetriever localRetriever) {
    if (localRetriever == null) {
      return CompletableFuture.completedFuture(LocalSide.failed(NO_RETRIEVER_CONTEXT));
    }
    try {
      return CompletableFuture.supplyAsync(
              () -> LocalSide.of(presentChunks(localRetriever.getRelevantDocuments(query))),
              retrievalExecutor)
          .exceptionally(
              e -> {
                Throwable cause = e instanceof CompletionException && e.getCause() != null
                    ? e.getCause()
                    : e;
                log.warn("Local side of hybrid retrieval failed: {}", cause.getMessage());
                return LocalSide.failed("Local retrieval failed: " + cause.getMessage());
              });
    } catch (RejectedExecutionException e) {
      log.warn("Local side of hybrid retrieval rejected: {}", e.getMessage());
      return CompletableFuture.completedFuture(
          LocalSide.failed("Local retrieval failed: " + e.getMessage()));
    }
  }

  private WebSide searchWeb(String query, int limit) {
    ChainResult chain = searchChain.execute(query, limit);
    List<SearchResult> results = chain.resultSet().results();
    if (fetchEnabled && !results.isEmpty()) {
      results = enricher.enrich(results);
    }
    return new WebSide(results, chain.resultSet().provider(), null);
  }

  /** Retrievers may hand back null lists or null entries; both are treated as absent. */
  private static List<LocalChunk> presentChunks(@Nullable List<LocalChunk> chunks) {
    if (chunks == null) {
      return List.of();
    }
    return chunks.stream().filter(Objects::nonNull).toList();
  }

  private static String message(Throwable e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }

  private record LocalSide(List<LocalChunk> chunks, @Nullable String failure) {

    static LocalSide of(List<LocalChunk> chunks) {
      return new LocalSide(List.copyOf(chunks), null);
    }

    static LocalSide failed(String failure) {
      return new LocalSide(List.of(), failure);
    }
  }

  private record WebSide(
      List<SearchResult> results, @Nullable String provider, @Nullable String failure) {

    static WebSide failed(String failure) {
      return new WebSide(List.of(), null, failure);
    }
  }
}
