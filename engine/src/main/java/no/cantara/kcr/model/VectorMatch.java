package no.cantara.kcr.model;

/**
 * One row returned by a vector-store similarity search.
 *
 * @param document the matched document
 * @param score    raw similarity in [0, 1]
 */
public record VectorMatch(StoredDocument document, double score) {}
