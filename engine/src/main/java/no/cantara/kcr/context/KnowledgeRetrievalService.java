package no.cantara.kcr.context;

import no.cantara.kcr.concurrent.CancellationSignal;
import no.cantara.kcr.config.EngineConfig;
import no.cantara.kcr.graph.InMemoryLinkGraph;
import no.cantara.kcr.graph.LinkGraph;
import no.cantara.kcr.graph.LinkGraphIndexer;
import no.cantara.kcr.model.RetrievalOptions;
import no.cantara.kcr.model.TenantScope;
import no.cantara.kcr.repository.DocumentRepository;
import no.cantara.kcr.retrieval.RelevanceRetriever;
import no.cantara.kcr.retrieval.RetrievalResult;
import no.cantara.kcr.retrieval.VectorStore;
import no.cantara.kcr.supersession.SupersessionIndexer;
import no.cantara.kcr.supersession.SupersessionRepository;
import no.cantara.kcr.supersession.SupersessionTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for one tenant's corpus: query-time retrieval and assembly, plus
 * the hooks the indexing pipeline calls to keep the link graph and supersession
 * store current.
 *
 * <p>When created through {@link #create}, the service owns a fixed pool of
 * {@code assembly.parallelism} daemon threads, released by {@link #close()}.
 * An executor passed to the constructor is never shut down by the service.
 */
public class KnowledgeRetrievalService implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(KnowledgeRetrievalService.class);

    private final TenantScope tenant;
    private final RelevanceRetriever retriever;
    private final LinkGraph graph;
    private final SupersessionTracker tracker;
    private final ContextAssembler assembler;
    private final LinkGraphIndexer linkGraphIndexer;
    private final SupersessionIndexer supersessionIndexer;
    private final ExecutorService ownedExecutor;

    public KnowledgeRetrievalService(TenantScope tenant,
                                     VectorStore vectorStore,
                                     DocumentRepository documents,
                                     SupersessionRepository supersessions,
                                     LinkGraph graph,
                                     EngineConfig config,
                                     Executor executor) {
        this(tenant, vectorStore, documents, supersessions, graph, config, executor, null);
    }

    private KnowledgeRetrievalService(TenantScope tenant,
                                      VectorStore vectorStore,
                                      DocumentRepository documents,
                                      SupersessionRepository supersessions,
                                      LinkGraph graph,
                                      EngineConfig config,
                                      Executor executor,
                                      ExecutorService ownedExecutor) {
        this.tenant = Objects.requireNonNull(tenant, "tenant");
        Objects.requireNonNull(config, "config");
        this.graph = Objects.requireNonNull(graph, "graph");
        this.retriever = new RelevanceRetriever(vectorStore, tenant, config);
        this.tracker = new SupersessionTracker(supersessions, documents, tenant, config);
        this.assembler = new ContextAssembler(retriever, graph, tracker, documents, tenant, executor);
        this.linkGraphIndexer = new LinkGraphIndexer(graph);
        this.supersessionIndexer = new SupersessionIndexer(tracker);
        this.ownedExecutor = ownedExecutor;
    }

    /** A service with an in-memory link graph and its own worker pool. */
    public static KnowledgeRetrievalService create(TenantScope tenant,
                                                   VectorStore vectorStore,
                                                   DocumentRepository documents,
                                                   SupersessionRepository supersessions,
                                                   EngineConfig config) {
        ExecutorService pool = Executors.newFixedThreadPool(config.parallelism(), daemonThreads(tenant));
        logger.info("Knowledge retrieval service for '{}' started with {} worker(s)",
                tenant.key(), config.parallelism());
        return new KnowledgeRetrievalService(tenant, vectorStore, documents, supersessions,
                new InMemoryLinkGraph(), config, pool, pool);
    }

    // ── Query side ────────────────────────────────────────────────────────────────

    public CompletableFuture<RagContext> assembleContext(float[] queryEmbedding, RetrievalOptions options) {
        return assembleContext(queryEmbedding, options, CancellationSignal.NONE);
    }

    public CompletableFuture<RagContext> assembleContext(float[] queryEmbedding,
                                                         RetrievalOptions options,
                                                         CancellationSignal cancellation) {
        return assembler.assembleAsync(queryEmbedding, options, cancellation);
    }

    public RagContext assemble(float[] queryEmbedding, RetrievalOptions options) {
        return assemble(queryEmbedding, options, CancellationSignal.NONE);
    }

    public RagContext assemble(float[] queryEmbedding, RetrievalOptions options, CancellationSignal cancellation) {
        return assembler.assemble(queryEmbedding, options, cancellation);
    }

    public RetrievalResult retrieveRelevantDocuments(float[] queryEmbedding, RetrievalOptions options) {
        return retriever.retrieve(queryEmbedding, options);
    }

    /** Direct matches and their link expansion, without critical injection. */
    public RagContext retrieveWithLinkedDocuments(float[] queryEmbedding, RetrievalOptions options) {
        Objects.requireNonNull(options, "options");
        return assembler.assemble(queryEmbedding, options.withIncludeCritical(false), CancellationSignal.NONE);
    }

    // ── Index side ────────────────────────────────────────────────────────────────

    public LinkGraphIndexer linkGraphIndexer() {
        return linkGraphIndexer;
    }

    public SupersessionIndexer supersessionIndexer() {
        return supersessionIndexer;
    }

    public LinkGraph linkGraph() {
        return graph;
    }

    public SupersessionTracker supersessionTracker() {
        return tracker;
    }

    public TenantScope tenant() {
        return tenant;
    }

    @Override
    public void close() {
        if (ownedExecutor == null) return;
        ownedExecutor.shutdown();
        try {
            if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Worker pool for '{}' did not stop in time; interrupting", tenant.key());
                ownedExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            ownedExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads(TenantScope tenant) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "kcr-" + tenant.project() + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
