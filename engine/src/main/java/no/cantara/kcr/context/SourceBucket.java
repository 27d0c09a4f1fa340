package no.cantara.kcr.context;

/**
 * Where a context document came from. Declaration order is dedup precedence:
 * a path found in several buckets is kept only in the earliest.
 */
public enum SourceBucket {
    /** Critical-promotion document injected regardless of relevance. */
    CRITICAL,
    /** Returned by relevance retrieval. */
    DIRECT,
    /** Reached by following links from a direct match. */
    LINKED
}
