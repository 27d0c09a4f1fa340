package no.cantara.kcr.graph;

/**
 * A vertex reached by a bounded traversal.
 *
 * @param path          the reached document path
 * @param depth         level of first discovery, starting at 1
 * @param referringPath the vertex whose outgoing edge discovered {@code path}
 */
public record TraversalHit(String path, int depth, String referringPath) {}
