package dev.compass.retrieval;

import org.jspecify.annotations.Nullable;

/**
 * One ranked passage returned by a {@link LocalRetriever}.
 *
 * @param content passage text
 * @param sourceId identifier of the document it came from, usually a file name
 * @param page page locator, if the document has pages
 * @param chunk chunk locator within the document
 */
public record LocalChunk(
    String content, String sourceId, @Nullable String page, @Nullable String chunk) {

  public LocalChunk {
    content = content == null ? "" : content;
    sourceId = sourceId == null || sourceId.isBlank() ? "Unknown" : sourceId;
    page = page == null || page.isBlank() ? null : page;
    chunk = chunk == null || chunk.isBlank() ? null : chunk;
  }

  public static LocalChunk of(String content, String sourceId) {
    return new LocalChunk(content, sourceId, null, null);
  }
}
