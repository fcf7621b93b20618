package dev.compass.search;

import java.util.List;

/**
 * Outcome of a chain run: the winning result set plus every attempt made to obtain it.
 *
 * @param resultSet the non-empty results of the first provider that answered
 * @param attempts attempts in the order they were made, ending with the winner
 */
public record ChainResult(ResultSet resultSet, List<ProviderAttempt> attempts) {

  public ChainResult {
    attempts = List.copyOf(attempts);
  }
}
