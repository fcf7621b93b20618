package dev.compass.routing;

/**
 * External classification capability. Given a query and a context hint it returns text that is
 * expected, but not guaranteed, to contain a JSON routing decision.
 *
 * <p>Implementations may throw any runtime exception when the capability is unreachable; {@link
 * QueryClassifier} treats that as a signal to fall back to the keyword heuristic.
 */
@FunctionalInterface
public interface ClassifierClient {

  String classify(String query, String contextHint);
}
