package dev.compass.retrieval;

import static org.assertj.core.api.Assertions.assertThat;

import dev.compass.fixture.SearchResultBuilder;
import dev.compass.search.SearchResult;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class ContextFormatterTest {

  private final ContextFormatter formatter =
      new ContextFormatter(Clock.fixed(Instant.parse("2026-10-17T08:00:00Z"), ZoneOffset.UTC));

  @Test
  void localContextNumbersDocumentsAndShowsLocators() {
    String context =
        formatter.formatLocal(
            List.of(
                new LocalChunk("Revenue grew 12%.", "report.pdf", "4", "2"),
                new LocalChunk("Appendix text.", "report.pdf", "9", null),
                new LocalChunk("Notes.", "notes.txt", null, "7"),
                LocalChunk.of("Bare.", "misc.md")));

    assertThat(context)
        .startsWith("=== LOCAL DOCUMENT RESULTS ===\n\n")
        .contains("[Document 1] report.pdf\nPage: 4 | Chunk: 2\nContent: Revenue grew 12%.\n")
        .contains("[Document 2] report.pdf\nPage: 9\nContent: Appendix text.\n")
        .contains("[Document 3] notes.txt\nChunk: 7\nContent: Notes.\n")
        .contains("[Document 4] misc.md\nContent: Bare.\n");
  }

  @Test
  void webContextIsDatedAndLabelsProviderAndKind() {
    List<SearchResult> results =
        List.of(
            new SearchResultBuilder()
                .answer()
                .title("Direct Answer")
                .snippet("22C")
                .provider("Tavily")
                .build(),
            new SearchResultBuilder()
                .title("Tokyo forecast")
                .url("https://weather.example/tokyo")
                .snippet("snippet")
                .fullContent("Full page text")
                .provider("Tavily")
                .build());

    String context = formatter.formatWeb("weather in Tokyo", results);

    assertThat(context)
        .startsWith("=== WEB SEARCH RESULTS (As of October 17, 2026) ===\n\n")
        .contains("Search Query: weather in Tokyo\n" + ContextFormatter.DOUBLE_RULE)
        .contains("[Result 1] (Tavily - answer)\nTitle: Direct Answer\nContent:\n22C\n")
        .contains(
            "[Result 2] (Tavily - web)\nTitle: Tokyo forecast\nURL: https://weather.example/tokyo\n"
                + "Content:\nFull page text\n"
                + ContextFormatter.RULE);
    assertThat(context).doesNotContain("URL: null");
  }

  @Test
  void hybridContextListsLocalBeforeWeb() {
    String context =
        formatter.formatHybrid(
            List.of(new LocalChunk("Q3 numbers", "q3.pdf", "1", null)),
            List.of(new SearchResultBuilder().title("Market news").provider("Bing").build()),
            null,
            null);

    assertThat(context).startsWith("=== HYBRID RETRIEVAL RESULTS (As of October 17, 2026) ===");
    assertThat(context.indexOf("[Local 1] q3.pdf"))
        .isLessThan(context.indexOf("[Web 1] Market news (Bing)"));
    assertThat(context).contains("LOCAL DOCUMENTS:\n" + ContextFormatter.RULE);
    assertThat(context).contains("WEB SEARCH RESULTS:\n" + ContextFormatter.RULE);
  }

  @Test
  void emptyHybridSidesShowPlaceholderOrFailure() {
    assertThat(formatter.formatHybrid(List.of(), List.of(), null, null))
        .contains(ContextFormatter.NO_LOCAL_DOCUMENTS)
        .contains(ContextFormatter.NO_WEB_RESULTS);

    assertThat(formatter.formatHybrid(List.of(), List.of(), "Local retrieval failed: boom", null))
        .contains("Local retrieval failed: boom")
        .doesNotContain(ContextFormatter.NO_LOCAL_DOCUMENTS);
  }
}
