package dev.compass.api;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of {@code POST /api/route}.
 *
 * @param query the user query
 * @param hasLocalDocuments whether the user has uploaded documents
 */
public record RouteRequest(@NotBlank String query, boolean hasLocalDocuments) {}
