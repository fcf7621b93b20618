package dev.compass.retrieval;

import dev.compass.search.SearchResult;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Result of one dispatch: the formatted context document, its citations and what went wrong, if
 * anything. Always well formed, even when retrieval failed.
 *
 * @param contextText context document for the caller, or a readable failure description
 * @param sources citations in context order, local before web
 * @param retrievalType the path that ran
 * @param counts sources per side
 * @param error failure description, null on success
 * @param rawWebResults web results as returned by the search chain, after enrichment
 * @param webProvider provider that answered the web search, null when no web search ran
 */
public record RetrievalOutcome(
    String contextText,
    List<SourceRef> sources,
    RetrievalType retrievalType,
    ResultCounts counts,
    @Nullable String error,
    List<SearchResult> rawWebResults,
    @Nullable String webProvider) {

  public RetrievalOutcome {
    contextText = contextText == null ? "" : contextText;
    sources = sources == null ? List.of() : List.copyOf(sources);
    rawWebResults = rawWebResults == null ? List.of() : List.copyOf(rawWebResults);
    counts = counts == null ? ResultCounts.none() : counts;
  }

  /** An outcome with no sources and the given error. */
  public static RetrievalOutcome failed(RetrievalType type, String contextText, String error) {
    return new RetrievalOutcome(
        contextText, List.of(), type, ResultCounts.none(), error, List.of(), null);
  }

  /** Returns a copy with {@code problem} recorded ahead of any existing error. */
  public RetrievalOutcome withError(String problem) {
    String combined = hasError() ? problem + "; " + error : problem;
    return new RetrievalOutcome(
        contextText, sources, retrievalType, counts, combined, rawWebResults, webProvider);
  }

  public boolean hasError() {
    return error != null && !error.isBlank();
  }
}
