package dev.compass.fetch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import dev.compass.fixture.SearchResultBuilder;
import dev.compass.fixture.TestProperties;
import dev.compass.search.SearchResult;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class WebResultEnricherTest {

  private final ContentFetcher fetcher = mock(ContentFetcher.class);
  private final WebResultEnricher enricher =
      new WebResultEnricher(fetcher, TestProperties.fetch(true));

  @Test
  void fetchedTextBecomesFullContent() {
    given(fetcher.fetchText("https://a.example/1")).willReturn(Optional.of("page one text"));

    List<SearchResult> enriched =
        enricher.enrich(
            List.of(new SearchResultBuilder().url("https://a.example/1").snippet("one").build()));

    assertThat(enriched)
        .singleElement()
        .extracting(SearchResult::fullContent)
        .isEqualTo("page one text");
  }

  @Test
  void failedFetchKeepsSnippetAndBatchContinues() {
    given(fetcher.fetchText("https://a.example/1")).willReturn(Optional.empty());
    given(fetcher.fetchText("https://a.example/2")).willReturn(Optional.of("page two text"));

    List<SearchResult> enriched =
        enricher.enrich(
            List.of(
                new SearchResultBuilder().url("https://a.example/1").snippet("one").build(),
                new SearchResultBuilder().url("https://a.example/2").snippet("two").build()));

    assertThat(enriched)
        .extracting(SearchResult::fullContent)
        .containsExactly("one", "page two text");
  }

  @Test
  void directAnswersAreNotFetched() {
    SearchResult answer = new SearchResultBuilder().answer().snippet("42").build();

    List<SearchResult> enriched = enricher.enrich(List.of(answer));

    assertThat(enriched.get(0).fullContent()).isEqualTo("42");
    verify(fetcher, never()).fetchText(anyString());
  }

  @Test
  void orderIsPreserved() {
    given(fetcher.fetchText(anyString())).willReturn(Optional.empty());

    List<SearchResult> enriched =
        enricher.enrich(
            List.of(
                new SearchResultBuilder().title("first").url("https://a.example/1").build(),
                new SearchResultBuilder().title("second").answer().build(),
                new SearchResultBuilder().title("third").url("https://a.example/3").build()));

    assertThat(enriched).extracting(SearchResult::title).containsExactly("first", "second", "third");
  }
}
