package dev.compass.retrieval;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import dev.compass.search.ResultKind;
import dev.compass.search.SearchResult;
import org.jspecify.annotations.Nullable;

/**
 * Caller-facing citation for one piece of retrieved content, from either the user's documents or
 * the web.
 *
 * @param origin where the content came from
 * @param source document id for local content, provider name for web content
 * @param title result title, web only
 * @param url result link, web only and optional
 * @param page page locator, local only and optional
 * @param chunk chunk locator, local only and optional
 * @param content the text used in the context document
 * @param resultKind answer or web hit, web only
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SourceRef(
    Origin origin,
    String source,
    @Nullable String title,
    @Nullable String url,
    @Nullable String page,
    @Nullable String chunk,
    String content,
    @Nullable ResultKind resultKind) {

  public static SourceRef local(LocalChunk chunk) {
    return new SourceRef(
        Origin.LOCAL,
        chunk.sourceId(),
        null,
        null,
        chunk.page(),
        chunk.chunk(),
        chunk.content(),
        null);
  }

  public static SourceRef web(SearchResult result) {
    return new SourceRef(
        Origin.WEB,
        result.providerName(),
        result.title(),
        result.url(),
        null,
        null,
        result.content(),
        result.kind());
  }

  /** Side of a retrieval a source belongs to. */
  public enum Origin {
    LOCAL("local"),
    WEB("web");

    private final String label;

    Origin(String label) {
      this.label = label;
    }

    @JsonValue
    public String label() {
      return label;
    }
  }
}
