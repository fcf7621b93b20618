package dev.compass.retrieval;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.rag.content.Content;
import dev.langchain4j.rag.content.retriever.ContentRetriever;
import dev.langchain4j.rag.query.Query;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Serves a LangChain4j {@link ContentRetriever} as the local retriever.
 *
 * <p>Segment metadata keys {@code source}, {@code page} and {@code chunk} become the chunk's source
 * id and locators. Numeric metadata values are rendered as text.
 */
public class ContentRetrieverLocalRetriever implements LocalRetriever {

  static final String SOURCE_KEY = "source";
  static final String PAGE_KEY = "page";
  static final String CHUNK_KEY = "chunk";

  private final ContentRetriever contentRetriever;

  public ContentRetrieverLocalRetriever(ContentRetriever contentRetriever) {
    this.contentRetriever = contentRetriever;
  }

  @Override
  public List<LocalChunk> getRelevantDocuments(String query) {
    List<Content> contents = contentRetriever.retrieve(Query.from(query));
    if (contents == null) {
      return List.of();
    }
    return contents.stream().map(ContentRetrieverLocalRetriever::toChunk).toList();
  }

  private static LocalChunk toChunk(Content content) {
    TextSegment segment = content.textSegment();
    Map<String, Object> metadata = metadataOf(segment.metadata());
    return new LocalChunk(
        segment.text(),
        stringValue(metadata.get(SOURCE_KEY)),
        stringValue(metadata.get(PAGE_KEY)),
        stringValue(metadata.get(CHUNK_KEY)));
  }

  private static Map<String, Object> metadataOf(@Nullable Metadata metadata) {
    return metadata == null ? Map.of() : metadata.toMap();
  }

  private static @Nullable String stringValue(@Nullable Object value) {
    return value == null ? null : String.valueOf(value);
  }
}
