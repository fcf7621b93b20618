package dev.compass.retrieval;

import dev.compass.search.SearchResult;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Renders retrieved content as the plain-text context document handed to the answering model.
 *
 * <p>Web and hybrid documents are headed with today's date so the model can judge recency.
 */
@Component
public class ContextFormatter {

  static final String RULE = "-".repeat(70);
  static final String DOUBLE_RULE = "=".repeat(70);

  static final String NO_LOCAL_DOCUMENTS = "No local documents found.";
  static final String NO_WEB_RESULTS = "No web results found.";

  private static final DateTimeFormatter HEADER_DATE =
      DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH);

  private final Clock clock;

  public ContextFormatter(Clock clock) {
    this.clock = clock;
  }

  public String formatLocal(List<LocalChunk> chunks) {
    StringBuilder context = new StringBuilder("=== LOCAL DOCUMENT RESULTS ===\n\n");
    for (int i = 0; i < chunks.size(); i++) {
      LocalChunk chunk = chunks.get(i);
      context.append("[Document ").append(i + 1).append("] ").append(chunk.sourceId()).append('\n');
      appendLocator(context, chunk);
      context.append("Content: ").append(chunk.content()).append("\n\n");
    }
    return context.toString();
  }

  public String formatWeb(String query, List<SearchResult> results) {
    StringBuilder context =
        new StringBuilder("=== WEB SEARCH RESULTS (As of ").append(today()).append(") ===\n\n");
    context.append("Search Query: ").append(query).append('\n');
    context.append(DOUBLE_RULE).append("\n\n");
    for (int i = 0; i < results.size(); i++) {
      SearchResult result = results.get(i);
      context
          .append("[Result ")
          .append(i + 1)
          .append("] (")
          .append(result.providerName())
          .append(" - ")
          .append(result.kind().value())
          .append(")\n");
      context.append("Title: ").append(result.title()).append('\n');
      if (result.url() != null) {
        context.append("URL: ").append(result.url()).append('\n');
      }
      context.append("Content:\n").append(result.content()).append('\n');
      context.append(RULE).append("\n\n");
    }
    return context.toString();
  }

  /**
   * Renders both sides of a hybrid retrieval. A side that failed shows its failure note in place
   * of the empty-section placeholder.
   */
  public String formatHybrid(
      List<LocalChunk> chunks,
      List<SearchResult> results,
      @Nullable String localFailure,
      @Nullable String webFailure) {
    StringBuilder context =
        new StringBuilder("=== HYBRID RETRIEVAL RESULTS (As of ")
            .append(today())
            .append(") ===\n\n");

    context.append("LOCAL DOCUMENTS:\n").append(RULE).append('\n');
    if (chunks.isEmpty()) {
      context.append(localFailure != null ? localFailure : NO_LOCAL_DOCUMENTS).append("\n\n");
    }
    for (int i = 0; i < chunks.size(); i++) {
      LocalChunk chunk = chunks.get(i);
      context.append("[Local ").append(i + 1).append("] ").append(chunk.sourceId()).append('\n');
      appendLocator(context, chunk);
      context.append("Content: ").append(chunk.content()).append("\n\n");
    }

    context.append("\nWEB SEARCH RESULTS:\n").append(RULE).append('\n');
    if (results.isEmpty()) {
      context.append(webFailure != null ? webFailure : NO_WEB_RESULTS).append("\n\n");
    }
    for (int i = 0; i < results.size(); i++) {
      SearchResult result = results.get(i);
      context
          .append("[Web ")
          .append(i + 1)
          .append("] ")
          .append(result.title())
          .append(" (")
          .append(result.providerName())
          .append(")\n");
      if (result.url() != null) {
        context.append("URL: ").append(result.url()).append('\n');
      }
      context.append("Content: ").append(result.content()).append("\n\n");
    }
    return context.toString();
  }

  String today() {
    return HEADER_DATE.format(LocalDate.now(clock));
  }

  private static void appendLocator(StringBuilder context, LocalChunk chunk) {
    if (chunk.page() != null && chunk.chunk() != null) {
      context.append("Page: ").append(chunk.page()).append(" | Chunk: ").append(chunk.chunk());
      context.append('\n');
    } else if (chunk.page() != null) {
      context.append("Page: ").append(chunk.page()).append('\n');
    } else if (chunk.chunk() != null) {
      context.append("Chunk: ").append(chunk.chunk()).append('\n');
    }
  }
}
