package dev.compass.retrieval;

import java.util.List;

/**
 * Boundary to the local document retrieval engine. Implementations return ranked passages for a
 * query and may throw; the dispatcher converts failures into an outcome error.
 */
@FunctionalInterface
public interface LocalRetriever {

  List<LocalChunk> getRelevantDocuments(String query);
}
