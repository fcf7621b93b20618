package dev.compass.routing;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class QueryPatternsTest {

  @ParameterizedTest
  @ValueSource(
      strings = {
        "What is machine learning?",
        "Explain neural networks",
        "Latest AI news",
        "Tell me a joke",
        ""
      })
  void queriesWithoutDocumentIndicatorsAreGeneralKnowledge(String query) {
    assertThat(QueryPatterns.isGeneralKnowledge(query)).isTrue();
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "What does my document say about AI?",
        "Summarize the PDF I UPLOADED",
        "What is in the attachment?",
        "According to my notes, when is the deadline?"
      })
  void documentIndicatorsVetoGeneralKnowledge(String query) {
    assertThat(QueryPatterns.isGeneralKnowledge(query)).isFalse();
  }

  @Test
  void nullQueryMatchesNothingButCountsAsGeneralKnowledge() {
    assertThat(QueryPatterns.isGeneralKnowledge(null)).isTrue();
    assertThat(QueryPatterns.hasExplicitDocumentReference(null)).isFalse();
    assertThat(QueryPatterns.hasWebIntent(null)).isFalse();
    assertThat(QueryPatterns.matchesQuestionPattern(null)).isFalse();
  }

  @Test
  void explicitDocumentReferenceIsCaseInsensitivePhraseMembership() {
    assertThat(QueryPatterns.hasExplicitDocumentReference("SUMMARIZE MY notes")).isTrue();
    assertThat(QueryPatterns.hasExplicitDocumentReference("what does my contract say")).isTrue();
    assertThat(QueryPatterns.hasExplicitDocumentReference("documents about history")).isFalse();
  }

  @Test
  void webIntentRecognisesRecencyAndDefinitions() {
    assertThat(QueryPatterns.hasWebIntent("Python releases this year")).isTrue();
    assertThat(QueryPatterns.hasWebIntent("define entropy")).isTrue();
    assertThat(QueryPatterns.hasWebIntent("summarize my uploaded pdf")).isFalse();
  }

  @Test
  void questionPatternsIncludeTemporalWords() {
    assertThat(QueryPatterns.matchesQuestionPattern("recent developments in fusion")).isTrue();
    assertThat(QueryPatterns.matchesQuestionPattern("banana bread recipe")).isFalse();
  }
}
