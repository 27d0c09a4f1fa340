package no.cantara.kcr.graph;

import no.cantara.kcr.concurrent.CancellationSignal;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph of document paths (vertices) and links (edges).
 *
 * <p>Vertices may be dangling: a link target that has not been indexed yet is a
 * legal vertex. Cycles are permitted; every traversal terminates regardless.
 * Implementations must make each mutating call atomic with respect to readers.
 */
public interface LinkGraph {

    void addVertex(String path);

    /** Removes the vertex together with every incoming and outgoing edge. */
    void removeVertex(String path);

    /**
     * Drops the outgoing edges of {@code path}, then removes the vertex only if
     * nothing links to it. Check and removal happen in one step.
     *
     * @return true if the vertex was removed, false if it stays as a dangling vertex
     */
    boolean removeOrOrphanVertex(String path);

    /**
     * Replaces every outgoing edge of {@code path} in one step, adding the vertex
     * and any unknown targets. Self-links are ignored.
     *
     * @return targets whose new edge closes a cycle
     */
    Set<String> replaceOutgoingEdges(String path, Collection<String> targets);

    /** Replaces the whole graph with {@code outgoingByPath} in one step. */
    void rebuild(Map<String, ? extends Collection<String>> outgoingByPath);

    /** True if adding {@code source -> target} would close a cycle. */
    boolean wouldCreateCycle(String source, String target);

    /**
     * Breadth-first expansion from {@code startPaths}. Start paths are never emitted;
     * each other vertex is emitted at most once, at the level it was first reached.
     *
     * @param maxDepth number of levels to expand
     * @param maxCount maximum number of vertices to emit
     */
    List<TraversalHit> traverse(Collection<String> startPaths, int maxDepth, int maxCount,
                                CancellationSignal cancellation);

    boolean containsVertex(String path);

    Set<String> outgoing(String path);

    Set<String> incoming(String path);

    /** Strongly connected components with more than one vertex. */
    List<List<String>> enumerateCycles();

    boolean isAcyclic();

    int vertexCount();

    int edgeCount();

    Set<String> vertices();
}
