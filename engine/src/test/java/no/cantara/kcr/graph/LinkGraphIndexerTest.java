package no.cantara.kcr.graph;

import no.cantara.kcr.LogCapture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LinkGraphIndexerTest {

    private InMemoryLinkGraph graph;
    private LinkGraphIndexer indexer;

    @BeforeEach
    void setUp() {
        graph = new InMemoryLinkGraph();
        indexer = new LinkGraphIndexer(graph);
    }

    @Test
    void reindexingReplacesOutgoingLinks() {
        indexer.onDocumentIndexed("a.md", List.of("b.md"));
        indexer.onDocumentIndexed("a.md", List.of("c.md"));

        assertEquals(Set.of("c.md"), graph.outgoing("a.md"));
        assertTrue(graph.incoming("b.md").isEmpty());
    }

    @Test
    void nullLinksMeanNoOutgoingEdges() {
        indexer.onDocumentIndexed("a.md", List.of("b.md"));
        indexer.onDocumentIndexed("a.md", null);

        assertTrue(graph.outgoing("a.md").isEmpty());
        assertTrue(graph.containsVertex("a.md"));
    }

    @Test
    void indexingReportsCycleClosingLinks() {
        indexer.onDocumentIndexed("a.md", List.of("b.md"));

        assertEquals(Set.of("a.md"), indexer.onDocumentIndexed("b.md", List.of("a.md")));
    }

    @Test
    void deletedUnreferencedDocumentLeavesTheGraph() {
        indexer.onDocumentIndexed("a.md", List.of("b.md"));

        indexer.onDocumentDeleted("a.md");

        assertFalse(graph.containsVertex("a.md"));
        assertTrue(graph.incoming("b.md").isEmpty());
    }

    @Test
    void deletedReferencedDocumentStaysAsDanglingVertex() {
        indexer.onDocumentIndexed("a.md", List.of("b.md"));
        indexer.onDocumentIndexed("b.md", List.of("c.md"));

        indexer.onDocumentDeleted("b.md");

        assertTrue(graph.containsVertex("b.md"));
        assertTrue(graph.outgoing("b.md").isEmpty());
        assertEquals(Set.of("a.md"), graph.incoming("b.md"));
        assertTrue(graph.incoming("c.md").isEmpty());
    }

    @Test
    void linkCommittedJustBeforeDeletionKeepsTheDeletedPathAsDanglingVertex() {
        InMemoryLinkGraph racing = new InMemoryLinkGraph() {
            @Override
            public boolean removeOrOrphanVertex(String path) {
                replaceOutgoingEdges("docs/b.md", List.of("docs/a.md"));
                return super.removeOrOrphanVertex(path);
            }
        };
        LinkGraphIndexer racingIndexer = new LinkGraphIndexer(racing);
        racingIndexer.onDocumentIndexed("docs/a.md", List.of("docs/c.md"));

        racingIndexer.onDocumentDeleted("docs/a.md");

        assertEquals(Set.of("docs/a.md"), racing.outgoing("docs/b.md"));
        assertTrue(racing.containsVertex("docs/a.md"));
        assertTrue(racing.outgoing("docs/a.md").isEmpty());
        assertTrue(racing.incoming("docs/c.md").isEmpty());
    }

    @Test
    void repeatedFullRebuildGivesTheSameGraph() {
        Map<String, List<String>> links = Map.of("a.md", List.of("b.md", "c.md"), "c.md", List.of("a.md"));

        indexer.onFullRebuild(links);
        Set<String> vertices = graph.vertices();
        Set<String> fromA = graph.outgoing("a.md");
        Set<String> intoA = graph.incoming("a.md");
        indexer.onFullRebuild(links);

        assertEquals(vertices, graph.vertices());
        assertEquals(fromA, graph.outgoing("a.md"));
        assertEquals(intoA, graph.incoming("a.md"));
        assertEquals(3, graph.edgeCount());
    }

    @Test
    void fullRebuildWarnsAboutCycles() {
        try (LogCapture log = LogCapture.of(LinkGraphIndexer.class)) {
            indexer.onFullRebuild(Map.of("a.md", List.of("b.md"), "b.md", List.of("a.md")));

            assertEquals(2, graph.edgeCount());
            assertEquals(1, log.warnings().size());
        }
    }
}
