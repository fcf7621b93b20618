package dev.compass.search;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Ordered results from a single provider. An empty set means the provider declined; it is never
 * represented by null.
 *
 * @param results the hits in provider order
 * @param provider name of the provider that answered, null for the empty set
 */
public record ResultSet(List<SearchResult> results, @Nullable String provider) {

  private static final ResultSet EMPTY = new ResultSet(List.of(), null);

  public ResultSet {
    results = results == null ? List.of() : List.copyOf(results);
  }

  public static ResultSet empty() {
    return EMPTY;
  }

  public static ResultSet of(String provider, List<SearchResult> results) {
    if (results == null || results.isEmpty()) {
      return EMPTY;
    }
    return new ResultSet(results, provider);
  }

  public boolean isEmpty() {
    return results.isEmpty();
  }

  public int size() {
    return results.size();
  }
}
