package no.cantara.kcr.context;

import no.cantara.kcr.concurrent.CancellationSignal;
import no.cantara.kcr.config.RetrievalOptionsValidator;
import no.cantara.kcr.error.KnowledgeRetrievalException;
import no.cantara.kcr.error.RetrievalBackendException;
import no.cantara.kcr.graph.LinkGraph;
import no.cantara.kcr.graph.TraversalHit;
import no.cantara.kcr.model.LinkedDocument;
import no.cantara.kcr.model.PromotionLevel;
import no.cantara.kcr.model.RetrievalOptions;
import no.cantara.kcr.model.RetrievedDocument;
import no.cantara.kcr.model.StoredDocument;
import no.cantara.kcr.model.SupersessionInfo;
import no.cantara.kcr.model.TenantScope;
import no.cantara.kcr.repository.DocumentRepository;
import no.cantara.kcr.retrieval.RelevanceRetriever;
import no.cantara.kcr.retrieval.RetrievalResult;
import no.cantara.kcr.supersession.SupersessionTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Builds a {@link RagContext} from critical injection, relevance retrieval and
 * link expansion, adjusted for supersession.
 *
 * <p>Steps: critical fetch and direct retrieval run concurrently; link traversal
 * is seeded with the direct paths; paths are deduplicated with precedence
 * critical &gt; direct &gt; linked; each surviving candidate gets one supersession
 * lookup (fanned out); entries are ordered critical, direct by final score,
 * linked by depth. No size budget is applied here.
 *
 * <p>Stages never block on one another; a single-thread executor is enough.
 */
public class ContextAssembler {

    private static final Logger logger = LoggerFactory.getLogger(ContextAssembler.class);

    private static final Comparator<ContextEntry> BY_FINAL_SCORE =
            Comparator.comparingDouble(ContextEntry::finalScore).reversed()
                    .thenComparing(ContextEntry::path);

    private final RelevanceRetriever retriever;
    private final LinkGraph graph;
    private final SupersessionTracker tracker;
    private final DocumentRepository documents;
    private final TenantScope tenant;
    private final Executor executor;

    public ContextAssembler(RelevanceRetriever retriever,
                            LinkGraph graph,
                            SupersessionTracker tracker,
                            DocumentRepository documents,
                            TenantScope tenant,
                            Executor executor) {
        this.retriever = Objects.requireNonNull(retriever, "retriever");
        this.graph = Objects.requireNonNull(graph, "graph");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.documents = Objects.requireNonNull(documents, "documents");
        this.tenant = Objects.requireNonNull(tenant, "tenant");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Assembles the context without blocking the caller. Options are validated
     * before anything is scheduled. Failures complete the future exceptionally with
     * a {@link RetrievalBackendException} or {@link java.util.concurrent.CancellationException} cause.
     */
    public CompletableFuture<RagContext> assembleAsync(float[] queryEmbedding,
                                                       RetrievalOptions options,
                                                       CancellationSignal cancellation) {
        Objects.requireNonNull(queryEmbedding, "queryEmbedding");
        Objects.requireNonNull(cancellation, "cancellation");
        RetrievalOptionsValidator.requireValid(options);

        CompletableFuture<List<RetrievedDocument>> critical = options.includeCritical()
                ? CompletableFuture.supplyAsync(() -> fetchCritical(cancellation), executor)
                : CompletableFuture.completedFuture(List.of());
        CompletableFuture<RetrievalResult> direct = CompletableFuture.supplyAsync(() -> {
            cancellation.throwIfCancelled();
            return retriever.retrieve(queryEmbedding, options);
        }, executor);

        return critical
                .thenCombineAsync(direct, (c, d) -> expand(c, d, options, cancellation), executor)
                .thenCompose(candidates -> applySupersession(candidates, cancellation));
    }

    /** Blocking form of {@link #assembleAsync}; rethrows the underlying failure unwrapped. */
    public RagContext assemble(float[] queryEmbedding, RetrievalOptions options, CancellationSignal cancellation) {
        return await(assembleAsync(queryEmbedding, options, cancellation));
    }

    // ── Steps ─────────────────────────────────────────────────────────────────────

    private List<RetrievedDocument> fetchCritical(CancellationSignal cancellation) {
        cancellation.throwIfCancelled();
        List<StoredDocument> stored = repositoryCall(
                () -> documents.findByPromotionLevel(tenant, PromotionLevel.CRITICAL));
        return stored.stream()
                .map(d -> RetrievedDocument.of(d, PromotionLevel.CRITICAL, 0.0, 0.0))
                .toList();
    }

    /** One candidate per path, already in its winning bucket. */
    private record Candidate(RetrievedDocument document, SourceBucket bucket, String linkedFrom, int linkDepth) {}

    private record Candidates(List<Candidate> entries, int totalMatches) {}

    private Candidates expand(List<RetrievedDocument> critical, RetrievalResult direct,
                              RetrievalOptions options, CancellationSignal cancellation) {
        cancellation.throwIfCancelled();

        List<String> seeds = direct.documents().stream().map(RetrievedDocument::path).toList();
        List<LinkedDocument> linked = hydrate(
                graph.traverse(seeds, options.maxLinkDepth(), options.maxLinkedDocs(), cancellation));

        Map<String, Candidate> byPath = new LinkedHashMap<>();
        for (RetrievedDocument doc : critical) {
            byPath.putIfAbsent(doc.path(), new Candidate(doc, SourceBucket.CRITICAL, null, 0));
        }
        for (RetrievedDocument doc : direct.documents()) {
            Candidate existing = byPath.get(doc.path());
            if (existing == null) {
                byPath.put(doc.path(), new Candidate(doc, SourceBucket.DIRECT, null, 0));
            } else {
                // keep the match scores on the critical entry
                byPath.put(doc.path(), new Candidate(doc, SourceBucket.CRITICAL, null, 0));
            }
        }
        for (LinkedDocument doc : linked) {
            byPath.putIfAbsent(doc.path(),
                    new Candidate(doc.document(), SourceBucket.LINKED, doc.linkedFrom(), doc.linkDepth()));
        }
        return new Candidates(List.copyOf(byPath.values()), direct.totalMatches());
    }

    private List<LinkedDocument> hydrate(List<TraversalHit> hits) {
        if (hits.isEmpty()) return List.of();
        List<String> paths = hits.stream().map(TraversalHit::path).toList();
        Map<String, StoredDocument> stored = repositoryCall(() -> documents.getByPaths(tenant, paths));

        List<LinkedDocument> linked = new ArrayList<>();
        for (TraversalHit hit : hits) {
            StoredDocument doc = stored.get(hit.path());
            if (doc == null) {
                logger.debug("Linked path '{}' is not indexed; skipping", hit.path());
                continue;
            }
            RetrievedDocument retrieved = RetrievedDocument.of(doc, RelevanceRetriever.promotionOf(doc), 0.0, 0.0);
            linked.add(new LinkedDocument(retrieved, hit.referringPath(), hit.depth()));
        }
        return linked;
    }

    private CompletableFuture<RagContext> applySupersession(Candidates candidates, CancellationSignal cancellation) {
        List<CompletableFuture<SupersessionInfo>> lookups = candidates.entries().stream()
                .map(c -> CompletableFuture.supplyAsync(() -> {
                    cancellation.throwIfCancelled();
                    return tracker.getInfo(c.document().id());
                }, executor))
                .toList();

        return CompletableFuture.allOf(lookups.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> {
                    List<ContextEntry> entries = new ArrayList<>();
                    for (int i = 0; i < lookups.size(); i++) {
                        entries.add(toEntry(candidates.entries().get(i), lookups.get(i).join()));
                    }
                    return order(entries, candidates.totalMatches());
                });
    }

    private static ContextEntry toEntry(Candidate c, SupersessionInfo info) {
        double finalScore = switch (c.bucket()) {
            case CRITICAL -> (c.document().boostedScore() > 0 ? c.document().boostedScore() : 1.0) * info.multiplier();
            case DIRECT   -> c.document().boostedScore() * info.multiplier();
            case LINKED   -> 0.0;
        };
        return new ContextEntry(c.document(), c.bucket(), finalScore, c.linkedFrom(), c.linkDepth(), info);
    }

    private static RagContext order(List<ContextEntry> entries, int totalMatches) {
        List<ContextEntry> ordered = new ArrayList<>();
        entries.stream().filter(e -> e.bucket() == SourceBucket.CRITICAL).sorted(BY_FINAL_SCORE).forEach(ordered::add);
        entries.stream().filter(e -> e.bucket() == SourceBucket.DIRECT).sorted(BY_FINAL_SCORE).forEach(ordered::add);
        entries.stream().filter(e -> e.bucket() == SourceBucket.LINKED)
                .sorted(Comparator.comparingInt(ContextEntry::linkDepth))
                .forEach(ordered::add);

        long chars = ordered.stream().mapToLong(e -> e.document().charCount()).sum();
        RagContext context = new RagContext(ordered, totalMatches, chars);
        logger.info("Assembled context: {} critical, {} direct, {} linked, {} characters",
                context.bucket(SourceBucket.CRITICAL).size(),
                context.bucket(SourceBucket.DIRECT).size(),
                context.bucket(SourceBucket.LINKED).size(),
                chars);
        return context;
    }

    // ── helpers ───────────────────────────────────────────────────────────────────

    private static <T> T repositoryCall(Supplier<T> call) {
        try {
            return call.get();
        } catch (RetrievalBackendException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RetrievalBackendException("document repository", e.getMessage(), e);
        }
    }

    static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new KnowledgeRetrievalException("Context assembly failed", cause);
        }
    }
}
