package dev.compass.search.provider;

import dev.compass.search.ResultSet;
import dev.compass.search.SearchProvider;
import dev.compass.search.SearchResult;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Last resort of the search chain. Builds two placeholder results from the query text and the
 * current time so the chain always has something to return. Never fails and never does I/O.
 */
public class SyntheticSearchProvider implements SearchProvider {

  public static final String NAME = "Synthetic Fallback";

  private static final DateTimeFormatter DATE =
      DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH);
  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ENGLISH);

  private final Clock clock;

  public SyntheticSearchProvider(Clock clock) {
    this.clock = clock;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public int priority() {
    return Integer.MAX_VALUE;
  }

  @Override
  public ResultSet search(String query, int limit) {
    String text = query == null ? "" : query.strip();
    LocalDateTime now = LocalDateTime.now(clock);
    String encoded = text.replace(' ', '+');

    List<SearchResult> results =
        List.of(
            SearchResult.web(
                "Information about " + text,
                "https://local.search/results?q=" + encoded,
                "Based on available knowledge about "
                    + text
                    + " as of "
                    + DATE.format(now)
                    + ". This is a local cached result.",
                NAME),
            SearchResult.web(
                "Related: " + titleCase(text) + " Overview",
                "https://local.search/related?q=" + encoded,
                "General information and context related to "
                    + text
                    + ". Updated: "
                    + TIMESTAMP.format(now)
                    + ".",
                NAME));
    return ResultSet.of(NAME, results.subList(0, Math.min(Math.max(1, limit), results.size())));
  }

  /** Upper-cases the first letter of every run of letters and lower-cases the rest. */
  static String titleCase(String text) {
    StringBuilder out = new StringBuilder(text.length());
    boolean previousLetter = false;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      boolean letter = Character.isLetter(c);
      out.append(letter && !previousLetter ? Character.toUpperCase(c) : Character.toLowerCase(c));
      previousLetter = letter;
    }
    return out.toString();
  }
}
