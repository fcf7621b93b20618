package dev.compass.search;

/**
 * Uniform contract for one external search backend.
 *
 * <p>Implementations return {@link ResultSet#empty()} when they have nothing to offer, including
 * when a required credential is missing, in which case no network call may be made. They may also
 * throw; {@link SearchChain} treats an exception exactly like an empty result.
 */
public interface SearchProvider {

  /** Display name, also stamped on every result the provider produces. */
  String name();

  /** Position in the fallback chain; lower values are tried first. */
  int priority();

  ResultSet search(String query, int limit);
}
