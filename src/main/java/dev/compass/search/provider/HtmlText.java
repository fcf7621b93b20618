package dev.compass.search.provider;

import org.jsoup.Jsoup;
import org.jspecify.annotations.Nullable;

/** Reduces provider snippets that carry highlight markup to plain text. */
final class HtmlText {

  private HtmlText() {}

  static String plain(@Nullable String html) {
    if (html == null || html.isBlank()) {
      return "";
    }
    return Jsoup.parse(html).text();
  }

  static boolean hasText(@Nullable String value) {
    return value != null && !value.isBlank();
  }
}
