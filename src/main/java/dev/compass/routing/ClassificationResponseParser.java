package dev.compass.routing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns the raw text returned by the external classifier into a {@link RoutingDecision}.
 *
 * <p>Three strategies are tried in order:
 *
 * <ol>
 *   <li>the whole response parsed as a JSON object
 *   <li>the first balanced {@code {...}} object embedded in surrounding prose
 *   <li>keyword sniffing of the raw text for the datasource labels, defaulting to web search
 * </ol>
 *
 * <p>Parsing never fails: the last strategy always produces a decision.
 */
@Component
public class ClassificationResponseParser {

  private static final Logger log = LoggerFactory.getLogger(ClassificationResponseParser.class);

  private static final Pattern REASONING = Pattern.compile("\"reasoning\"\\s*:\\s*\"([^\"]+)\"");
  private static final Pattern CONFIDENCE = Pattern.compile("\"confidence\"\\s*:\\s*([0-9.]+)");

  static final String DEFAULT_REASONING = "Default routing";
  static final String SNIFFED_REASONING = "Classification based on query content";

  private final ObjectMapper objectMapper;

  public ClassificationResponseParser(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Parses a classifier response.
   *
   * @param content raw classifier output, may be null or blank
   * @return a decision; unrecognised datasources become {@link Datasource#WEB} and a missing
   *     confidence becomes {@link RoutingDecision#DEFAULT_CONFIDENCE}
   */
  public RoutingDecision parse(@Nullable String content) {
    String text = content == null ? "" : content.strip();

    JsonNode whole = readObject(text);
    if (whole != null) {
      return fromNode(whole);
    }

    String embedded = extractFirstObject(text);
    if (embedded != null) {
      JsonNode node = readObject(embedded);
      if (node != null) {
        return fromNode(node);
      }
    }

    log.debug("Classifier response is not JSON, sniffing keywords");
    return sniff(text);
  }

  private @Nullable JsonNode readObject(String text) {
    if (text.isEmpty()) {
      return null;
    }
    try {
      JsonNode node = objectMapper.readTree(text);
      return node != null && node.isObject() ? node : null;
    } catch (JsonProcessingException e) {
      return null;
    }
  }

  private RoutingDecision fromNode(JsonNode node) {
    JsonNode datasourceNode = node.get("datasource");
    Datasource datasource =
        Datasource.fromLabel(
            datasourceNode != null && datasourceNode.isTextual() ? datasourceNode.asText() : null);

    JsonNode reasoningNode = node.get("reasoning");
    String reasoning =
        reasoningNode != null && reasoningNode.isTextual() && !reasoningNode.asText().isBlank()
            ? reasoningNode.asText()
            : DEFAULT_REASONING;

    return new RoutingDecision(datasource, reasoning, confidenceOf(node.get("confidence")));
  }

  private static double confidenceOf(@Nullable JsonNode node) {
    if (node == null) {
      return RoutingDecision.DEFAULT_CONFIDENCE;
    }
    if (node.isNumber()) {
      return node.doubleValue();
    }
    if (node.isTextual()) {
      return parseDouble(node.asText());
    }
    return RoutingDecision.DEFAULT_CONFIDENCE;
  }

  private static RoutingDecision sniff(String text) {
    String lower = text.toLowerCase(Locale.ROOT);
    Datasource datasource;
    if (lower.contains(Datasource.LOCAL.label())) {
      datasource = Datasource.LOCAL;
    } else if (lower.contains(Datasource.HYBRID.label())) {
      datasource = Datasource.HYBRID;
    } else {
      datasource = Datasource.WEB;
    }

    Matcher reasoningMatch = REASONING.matcher(text);
    String reasoning = reasoningMatch.find() ? reasoningMatch.group(1) : SNIFFED_REASONING;

    Matcher confidenceMatch = CONFIDENCE.matcher(text);
    double confidence =
        confidenceMatch.find()
            ? parseDouble(confidenceMatch.group(1))
            : RoutingDecision.DEFAULT_CONFIDENCE;

    return new RoutingDecision(datasource, reasoning, confidence);
  }

  private static double parseDouble(String value) {
    try {
      return Double.parseDouble(value.trim());
    } catch (NumberFormatException e) {
      return RoutingDecision.DEFAULT_CONFIDENCE;
    }
  }

  /**
   * Returns the first balanced JSON object in {@code text}, honouring braces inside string
   * literals, or null when none closes.
   */
  static @Nullable String extractFirstObject(String text) {
    int start = text.indexOf('{');
    while (start >= 0) {
      int depth = 0;
      boolean inString = false;
      boolean escaped = false;
      for (int i = start; i < text.length(); i++) {
        char c = text.charAt(i);
        if (inString) {
          if (escaped) {
            escaped = false;
          } else if (c == '\\') {
            escaped = true;
          } else if (c == '"') {
            inString = false;
          }
          continue;
        }
        if (c == '"') {
          inString = true;
        } else if (c == '{') {
          depth++;
        } else if (c == '}') {
          depth--;
          if (depth == 0) {
            return text.substring(start, i + 1);
          }
        }
      }
      start = text.indexOf('{', start + 1);
    }
    return null;
  }
}
