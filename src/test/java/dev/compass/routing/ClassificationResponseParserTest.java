package dev.compass.routing;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class ClassificationResponseParserTest {

  private final ClassificationResponseParser parser =
      new ClassificationResponseParser(new ObjectMapper());

  @Test
  void parsesWellFormedJson() {
    RoutingDecision decision =
        parser.parse(
            """
            {"datasource": "local_rag", "reasoning": "mentions my file", "confidence": 0.92}
            """);

    assertThat(decision.datasource()).isEqualTo(Datasource.LOCAL);
    assertThat(decision.reasoning()).isEqualTo("mentions my file");
    assertThat(decision.confidence()).isEqualTo(0.92);
  }

  @Test
  void extractsObjectEmbeddedInProse() {
    RoutingDecision decision =
        parser.parse(
            "Sure! Here is my answer: {\"datasource\": \"hybrid\", \"reasoning\": \"needs {both}\","
                + " \"confidence\": 0.6} Hope that helps.");

    assertThat(decision.datasource()).isEqualTo(Datasource.HYBRID);
    assertThat(decision.reasoning()).isEqualTo("needs {both}");
    assertThat(decision.confidence()).isEqualTo(0.6);
  }

  @Test
  void unknownDatasourceIsCoercedToWeb() {
    RoutingDecision decision =
        parser.parse("{\"datasource\": \"database\", \"reasoning\": \"r\", \"confidence\": 0.8}");

    assertThat(decision.datasource()).isEqualTo(Datasource.WEB);
    assertThat(decision.confidence()).isEqualTo(0.8);
  }

  @Test
  void missingFieldsFallBackToDefaults() {
    RoutingDecision decision = parser.parse("{\"datasource\": \"web_search\"}");

    assertThat(decision.datasource()).isEqualTo(Datasource.WEB);
    assertThat(decision.reasoning()).isEqualTo(ClassificationResponseParser.DEFAULT_REASONING);
    assertThat(decision.confidence()).isEqualTo(RoutingDecision.DEFAULT_CONFIDENCE);
  }

  @Test
  void unparsableConfidenceDefaults() {
    RoutingDecision decision =
        parser.parse("{\"datasource\": \"local_rag\", \"confidence\": \"very high\"}");

    assertThat(decision.confidence()).isEqualTo(RoutingDecision.DEFAULT_CONFIDENCE);
  }

  @Test
  void numericStringConfidenceIsAccepted() {
    RoutingDecision decision =
        parser.parse("{\"datasource\": \"local_rag\", \"confidence\": \"0.55\"}");

    assertThat(decision.confidence()).isEqualTo(0.55);
  }

  @Test
  void sniffsLabelsFromFreeText() {
    RoutingDecision decision = parser.parse("I would route this to local_rag, definitely");

    assertThat(decision.datasource()).isEqualTo(Datasource.LOCAL);
    assertThat(decision.reasoning()).isEqualTo(ClassificationResponseParser.SNIFFED_REASONING);
    assertThat(decision.confidence()).isEqualTo(RoutingDecision.DEFAULT_CONFIDENCE);
  }

  @Test
  void sniffingPicksUpReasoningAndConfidenceFromBrokenJson() {
    RoutingDecision decision =
        parser.parse("{\"datasource\": \"hybrid\", \"reasoning\": \"both\", \"confidence\": 0.65");

    assertThat(decision.datasource()).isEqualTo(Datasource.HYBRID);
    assertThat(decision.reasoning()).isEqualTo("both");
    assertThat(decision.confidence()).isEqualTo(0.65);
  }

  @Test
  void nullOrBlankResponseDefaultsToWeb() {
    assertThat(parser.parse(null).datasource()).isEqualTo(Datasource.WEB);
    assertThat(parser.parse("   ").datasource()).isEqualTo(Datasource.WEB);
  }

  @Test
  void extractFirstObjectIgnoresBracesInsideStrings() {
    String text = "prefix {\"a\": \"}{\", \"b\": {\"c\": 1}} suffix {\"d\": 2}";

    assertThat(ClassificationResponseParser.extractFirstObject(text))
        .isEqualTo("{\"a\": \"}{\", \"b\": {\"c\": 1}}");
  }

  @Test
  void extractFirstObjectReturnsNullWhenNothingCloses() {
    assertThat(ClassificationResponseParser.extractFirstObject("{ never closed")).isNull();
    assertThat(ClassificationResponseParser.extractFirstObject("no braces")).isNull();
  }
}
