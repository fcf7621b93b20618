package dev.compass.routing;

import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;

/**
 * Keyword predicates shared by the override rules and the heuristic classifier. All matching is
 * case-insensitive substring membership against fixed phrase lists.
 */
public final class QueryPatterns {

  /** Phrases that mark a question as general knowledge. */
  static final List<String> GENERAL_KNOWLEDGE_PATTERNS =
      List.of(
          "what is", "what are", "who is", "who are",
          "explain", "how does", "how do", "how to",
          "define", "definition of",
          "tell me about", "describe",
          "why", "when", "where",
          "weather", "temperature", "forecast",
          "news", "latest", "current", "recent",
          "history of", "background on");

  /** Phrases that tie a question to the user's own material and veto general knowledge. */
  static final List<String> DOCUMENT_INDICATORS =
      List.of(
          "my document", "my file", "my pdf", "my paper",
          "the document", "the file", "the pdf", "the paper",
          "uploaded", "attachment",
          "according to my", "based on my",
          "in my file", "in the document");

  /** Explicit document references used by the override rule and the heuristic. */
  static final List<String> EXPLICIT_DOCUMENT_REFERENCES =
      List.of(
          "my document", "my file", "my pdf", "my paper",
          "the document", "the file", "the pdf", "uploaded file",
          "in my document", "according to my document",
          "what does my", "summarize my", "analyze my");

  static final List<String> WEB_INTENT_KEYWORDS =
      List.of(
          "latest", "current", "recent", "news", "today", "now",
          "what is", "what are", "explain", "define", "how does",
          "weather", "temperature", "forecast",
          "2025", "2024", "this year");

  private QueryPatterns() {
    // utility class
  }

  /**
   * True unless the query names the user's documents. Queries that mention no document are treated
   * as general knowledge whether or not they match a question pattern.
   */
  public static boolean isGeneralKnowledge(@Nullable String query) {
    return !containsAny(normalize(query), DOCUMENT_INDICATORS);
  }

  /** True when the query contains a common question or recency pattern. */
  public static boolean matchesQuestionPattern(@Nullable String query) {
    return containsAny(normalize(query), GENERAL_KNOWLEDGE_PATTERNS);
  }

  public static boolean hasExplicitDocumentReference(@Nullable String query) {
    return containsAny(normalize(query), EXPLICIT_DOCUMENT_REFERENCES);
  }

  public static boolean hasWebIntent(@Nullable String query) {
    return containsAny(normalize(query), WEB_INTENT_KEYWORDS);
  }

  private static String normalize(@Nullable String query) {
    return query == null ? "" : query.toLowerCase(Locale.ROOT);
  }

  private static boolean containsAny(String text, List<String> phrases) {
    for (String phrase : phrases) {
      if (text.contains(phrase)) {
        return true;
      }
    }
    return false;
  }
}
