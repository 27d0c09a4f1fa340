package no.cantara.kcr.context;

import no.cantara.kcr.FakeCorpus;
import no.cantara.kcr.concurrent.CancellationSignal;
import no.cantara.kcr.config.EngineConfig;
import no.cantara.kcr.error.InvalidOptionsException;
import no.cantara.kcr.error.RetrievalBackendException;
import no.cantara.kcr.graph.InMemoryLinkGraph;
import no.cantara.kcr.model.RetrievalOptions;
import no.cantara.kcr.retrieval.RelevanceRetriever;
import no.cantara.kcr.retrieval.VectorStore;
import no.cantara.kcr.supersession.InMemorySupersessionRepository;
import no.cantara.kcr.supersession.SupersessionTracker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static no.cantara.kcr.FakeCorpus.TENANT;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContextAssemblerTest {

    private static final float[] QUERY = {1f, 0f};

    @Mock
    VectorStore failingStore;

    // a single worker proves the pipeline never blocks on its own stages
    private ExecutorService executor;
    private FakeCorpus corpus;
    private InMemoryLinkGraph graph;
    private SupersessionTracker tracker;
    private ContextAssembler assembler;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
        corpus = new FakeCorpus();
        graph = new InMemoryLinkGraph();
        tracker = new SupersessionTracker(new InMemorySupersessionRepository(), corpus, TENANT, EngineConfig.defaults());
        assembler = assemblerWith(corpus);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private ContextAssembler assemblerWith(VectorStore store) {
        return new ContextAssembler(new RelevanceRetriever(store, TENANT, EngineConfig.defaults()),
                graph, tracker, corpus, TENANT, executor);
    }

    private RagContext assemble(RetrievalOptions options) {
        return assembler.assemble(QUERY, options, CancellationSignal.NONE);
    }

    // -----------------------------------------------------------------------
    // Buckets and ordering
    // -----------------------------------------------------------------------

    @Test
    void ordersCriticalThenDirectThenLinkedByDepth() {
        corpus.add("crit", "rules.md", "critical");
        corpus.scored("a", "a.md", "standard", 0.9);
        corpus.scored("b", "b.md", "standard", 0.8);
        corpus.add("c", "c.md", "standard");
        corpus.add("d", "d.md", "standard");
        corpus.add("e", "e.md", "standard");
        graph.rebuild(Map.of("a.md", List.of("c.md"), "c.md", List.of("d.md"), "b.md", List.of("e.md")));

        RagContext context = assemble(RetrievalOptions.defaults());

        assertEquals(List.of("rules.md", "a.md", "b.md", "c.md", "e.md", "d.md"), context.paths());
        assertEquals(SourceBucket.CRITICAL, context.entries().get(0).bucket());
        assertEquals(1.0, context.entries().get(0).finalScore());

        ContextEntry d = context.entries().get(5);
        assertEquals(SourceBucket.LINKED, d.bucket());
        assertEquals("c.md", d.linkedFrom());
        assertEquals(2, d.linkDepth());
        assertEquals(2, context.totalMatches());
    }

    @Test
    void eachPathAppearsOnceWithHighestPrecedenceBucket() {
        corpus.scored("crit", "rules.md", "critical", 0.8);
        corpus.scored("a", "a.md", "standard", 0.9);
        graph.rebuild(Map.of("a.md", List.of("rules.md", "x.md"), "x.md", List.of("a.md")));
        corpus.add("x", "x.md", "standard");

        RagContext context = assemble(RetrievalOptions.defaults());

        assertEquals(List.of("rules.md", "a.md", "x.md"), context.paths());
        ContextEntry critical = context.entries().get(0);
        assertEquals(SourceBucket.CRITICAL, critical.bucket());
        assertEquals(0.8, critical.document().rawScore(), 1e-9);
        assertEquals(0.95, critical.finalScore(), 1e-9);
        assertTrue(context.bucket(SourceBucket.DIRECT).stream().noneMatch(e -> e.path().equals("rules.md")));
    }

    @Test
    void criticalDocumentBelowThresholdIsStillInjectedFirst() {
        corpus.scored("x", "x.md", "standard", 0.9);
        corpus.scored("y", "y.md", "critical", 0.65);

        RagContext context = assemble(RetrievalOptions.defaults());

        assertEquals(List.of("y.md", "x.md"), context.paths());
        assertEquals(SourceBucket.CRITICAL, context.entries().get(0).bucket());
        assertEquals(SourceBucket.DIRECT, context.entries().get(1).bucket());
        assertEquals(0.9, context.entries().get(1).finalScore(), 1e-9);
        assertEquals(1, context.totalMatches());
    }

    @Test
    void directMatchReachedByLinkStaysDirect() {
        corpus.scored("a", "a.md", "standard", 0.9);
        corpus.scored("b", "b.md", "standard", 0.8);
        graph.rebuild(Map.of("a.md", List.of("b.md")));

        RagContext context = assemble(RetrievalOptions.defaults());

        assertEquals(List.of("a.md", "b.md"), context.paths());
        assertTrue(context.bucket(SourceBucket.LINKED).isEmpty());
    }

    @Test
    void supersededDocumentIsDemotedByItsMultiplier() {
        corpus.scored("old", "old.md", "standard", 0.9);
        corpus.scored("new", "new.md", "standard", 0.8);
        tracker.register("new", "old.md");

        RagContext context = assemble(RetrievalOptions.defaults());

        assertEquals(List.of("new.md", "old.md"), context.paths());
        ContextEntry old = context.entries().get(1);
        assertEquals(0.45, old.finalScore(), 1e-9);
        assertTrue(old.supersession().isSuperseded());
        assertEquals("new", old.supersession().currentVersionId());
        assertTrue(context.render().contains("superseded by new"));
    }

    @Test
    void linkToUnindexedPathIsSkipped() {
        corpus.scored("a", "a.md", "standard", 0.9);
        corpus.add("b", "b.md", "standard");
        graph.rebuild(Map.of("a.md", List.of("deleted.md", "b.md")));

        RagContext context = assemble(RetrievalOptions.defaults());

        assertEquals(List.of("a.md", "b.md"), context.paths());
    }

    @Test
    void linkLimitsBoundTheLinkedBucket() {
        corpus.scored("a", "a.md", "standard", 0.9);
        corpus.add("b", "b.md", "standard");
        corpus.add("c", "c.md", "standard");
        corpus.add("d", "d.md", "standard");
        graph.rebuild(Map.of("a.md", List.of("b.md", "c.md"), "b.md", List.of("d.md")));

        assertEquals(List.of("a.md", "b.md"), assemble(RetrievalOptions.defaults().withLinkLimits(2, 1)).paths());
        assertEquals(List.of("a.md", "b.md", "c.md"), assemble(RetrievalOptions.defaults().withLinkLimits(1, 5)).paths());
        assertEquals(List.of("a.md"), assemble(RetrievalOptions.defaults().withLinkLimits(0, 5)).paths());
    }

    @Test
    void criticalInjectionCanBeTurnedOff() {
        corpus.add("crit", "rules.md", "critical");
        corpus.scored("a", "a.md", "standard", 0.9);

        RagContext context = assemble(RetrievalOptions.defaults().withIncludeCritical(false));

        assertEquals(List.of("a.md"), context.paths());
    }

    @Test
    void totalCharactersCoverEveryEntry() {
        corpus.add("crit", "rules.md", "critical", "doc", "12345");
        corpus.add("a", "a.md", "standard", "doc", "1234567890");
        corpus.score("a.md", 0.9);

        RagContext context = assemble(RetrievalOptions.defaults());

        assertEquals(15, context.totalCharacters());
    }

    @Test
    void emptyCorpusGivesEmptyContext() {
        RagContext context = assemble(RetrievalOptions.defaults());

        assertTrue(context.isEmpty());
        assertEquals(0, context.totalCharacters());
        assertEquals("", context.render());
    }

    // -----------------------------------------------------------------------
    // Failures and cancellation
    // -----------------------------------------------------------------------

    @Test
    void cancelledRequestFailsWithCancellation() {
        corpus.scored("a", "a.md", "standard", 0.9);
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();

        assertThrows(CancellationException.class, () -> assembler.assemble(QUERY, RetrievalOptions.defaults(), signal));
    }

    @Test
    void asyncFailureCarriesTheBackendError() throws Exception {
        when(failingStore.search(any(), anyInt(), any())).thenThrow(new IllegalStateException("down"));
        ContextAssembler broken = assemblerWith(failingStore);

        CompletableFuture<RagContext> future = broken.assembleAsync(QUERY, RetrievalOptions.defaults(), CancellationSignal.NONE);

        ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(10, TimeUnit.SECONDS));
        assertInstanceOf(RetrievalBackendException.class, e.getCause());
        assertThrows(RetrievalBackendException.class,
                () -> broken.assemble(QUERY, RetrievalOptions.defaults(), CancellationSignal.NONE));
    }

    @Test
    void invalidOptionsAreRejectedBeforeAnyWorkIsScheduled() {
        assertThrows(InvalidOptionsException.class,
                () -> assembler.assembleAsync(QUERY, RetrievalOptions.defaults().withLinkLimits(-1, 5), CancellationSignal.NONE));
        assertEquals(0, corpus.searchCalls.get());
    }
}
