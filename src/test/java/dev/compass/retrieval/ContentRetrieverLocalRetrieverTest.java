package dev.compass.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.rag.content.Content;
import dev.langchain4j.rag.content.retriever.ContentRetriever;
import dev.langchain4j.rag.query.Query;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class ContentRetrieverLocalRetrieverTest {

  private final ContentRetriever contentRetriever = mock(ContentRetriever.class);
  private final ContentRetrieverLocalRetriever retriever =
      new ContentRetrieverLocalRetriever(contentRetriever);

  @Test
  void mapsSegmentMetadataToChunkLocators() {
    given(contentRetriever.retrieve(any(Query.class)))
        .willReturn(
            List.of(
                Content.from(
                    TextSegment.from(
                        "Quarterly revenue",
                        Metadata.from(Map.of("source", "q3.pdf", "page", 4, "chunk", "12")))),
                Content.from(TextSegment.from("No metadata"))));

    List<LocalChunk> chunks = retriever.getRelevantDocuments("revenue");

    assertThat(chunks)
        .containsExactly(
            new LocalChunk("Quarterly revenue", "q3.pdf", "4", "12"),
            new LocalChunk("No metadata", "Unknown", null, null));
  }

  @Test
  void passesQueryTextThrough() {
    given(contentRetriever.retrieve(any(Query.class))).willReturn(List.of());

    retriever.getRelevantDocuments("what does my contract say");

    ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
    verify(contentRetriever).retrieve(query.capture());
    assertThat(query.getValue().text()).isEqualTo("what does my contract say");
  }

  @Test
  void nullContentListIsEmpty() {
    given(contentRetriever.retrieve(any(Query.class))).willReturn(null);

    assertThat(retriever.getRelevantDocuments("anything")).isEmpty();
  }
}
