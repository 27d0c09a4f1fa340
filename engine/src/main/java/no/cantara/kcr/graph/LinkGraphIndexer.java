package no.cantara.kcr.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Hooks the indexing pipeline calls to keep the link graph in step with the corpus.
 * Links are supplied already extracted; nothing here parses document content.
 */
public class LinkGraphIndexer {

    private static final Logger logger = LoggerFactory.getLogger(LinkGraphIndexer.class);

    private final LinkGraph graph;

    public LinkGraphIndexer(LinkGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    /**
     * A document was created or updated.
     *
     * @return link targets that closed a cycle (kept, only reported)
     */
    public Set<String> onDocumentIndexed(String path, Collection<String> outgoingLinks) {
        Set<String> cycles = graph.replaceOutgoingEdges(path, outgoingLinks != null ? outgoingLinks : List.of());
        logger.debug("Indexed links for '{}': {} outgoing", path, graph.outgoing(path).size());
        return cycles;
    }

    /**
     * A document was deleted. Its outgoing links go; if other documents still link
     * to it, the path stays as a dangling vertex so those links survive re-indexing.
     */
    public void onDocumentDeleted(String path) {
        if (!graph.removeOrOrphanVertex(path) && graph.containsVertex(path)) {
            logger.debug("'{}' deleted but still referenced; kept as dangling vertex", path);
        }
    }

    /** Startup reconciliation: replaces the in-memory graph with the durable link set. */
    public void onFullRebuild(Map<String, ? extends Collection<String>> allDocumentsWithLinks) {
        graph.rebuild(allDocumentsWithLinks);
        List<List<String>> cycles = graph.enumerateCycles();
        if (!cycles.isEmpty()) {
            logger.warn("Link graph contains {} cycle(s) after rebuild: {}", cycles.size(), cycles);
        }
    }
}
