package dev.compass.search;

import org.jspecify.annotations.Nullable;

/**
 * One hit returned by a search provider.
 *
 * @param title result title
 * @param url link to the page, absent for direct answers
 * @param snippet short extract supplied by the provider
 * @param fullContent page text fetched after the search, absent until enrichment
 * @param providerName name of the provider that produced the hit
 * @param kind answer or web hit
 */
public record SearchResult(
    String title,
    @Nullable String url,
    String snippet,
    @Nullable String fullContent,
    String providerName,
    ResultKind kind) {

  public SearchResult {
    title = title == null || title.isBlank() ? "No title" : title;
    snippet = snippet == null ? "" : snippet;
    url = url == null || url.isBlank() ? null : url;
  }

  /** Creates a web hit without fetched content. */
  public static SearchResult web(
      String title, @Nullable String url, String snippet, String providerName) {
    return new SearchResult(title, url, snippet, null, providerName, ResultKind.WEB);
  }

  /** Returns a copy carrying the given page text. */
  public SearchResult withFullContent(@Nullable String content) {
    return new SearchResult(title, url, snippet, content, providerName, kind);
  }

  /** Fetched page text when present, otherwise the snippet. */
  public String content() {
    return fullContent != null && !fullContent.isBlank() ? fullContent : snippet;
  }

  public boolean hasHttpUrl() {
    return url != null && url.startsWith("http");
  }
}
