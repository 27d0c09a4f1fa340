package no.cantara.kcr;

import no.cantara.kcr.model.PromotionLevel;
import no.cantara.kcr.model.StoredDocument;
import no.cantara.kcr.model.TenantScope;
import no.cantara.kcr.model.VectorMatch;
import no.cantara.kcr.repository.DocumentRepository;
import no.cantara.kcr.retrieval.VectorSearchFilter;
import no.cantara.kcr.retrieval.VectorStore;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted vector store and document repository for one tenant. Similarity is
 * set per path instead of computed from embeddings.
 */
public class FakeCorpus implements VectorStore, DocumentRepository {

    public static final TenantScope TENANT = new TenantScope("acme", "main", "h1");

    private final Map<String, StoredDocument> byId = new LinkedHashMap<>();
    private final Map<String, Double> scores = new LinkedHashMap<>();
    public final AtomicInteger searchCalls = new AtomicInteger();
    public volatile int lastTopN;
    public volatile VectorSearchFilter lastFilter;

    public StoredDocument add(String id, String path, String promotion) {
        return add(id, path, promotion, "doc", "content of " + path);
    }

    public StoredDocument add(String id, String path, String promotion, String docType, String content) {
        StoredDocument doc = new StoredDocument(id, path, "Title " + id, null, content, docType, promotion, null);
        byId.put(id, doc);
        return doc;
    }

    /** Adds a document that the vector store will return with {@code score}. */
    public StoredDocument scored(String id, String path, String promotion, double score) {
        StoredDocument doc = add(id, path, promotion);
        scores.put(path, score);
        return doc;
    }

    public void score(String path, double score) {
        scores.put(path, score);
    }

    public StoredDocument doc(String id) {
        return byId.get(id);
    }

    public void remove(String id) {
        StoredDocument removed = byId.remove(id);
        if (removed != null) scores.remove(removed.path());
    }

    // ── VectorStore ───────────────────────────────────────────────────────────────

    @Override
    public List<VectorMatch> search(float[] embedding, int topN, VectorSearchFilter filter) {
        searchCalls.incrementAndGet();
        lastTopN = topN;
        lastFilter = filter;
        if (!TENANT.equals(filter.tenant())) return List.of();
        return byId.values().stream()
                .filter(d -> scores.containsKey(d.path()))
                .filter(d -> filter.promotionTags().isEmpty() || filter.promotionTags().contains(d.promotion()))
                .filter(d -> filter.docTypes().isEmpty() || filter.docTypes().contains(d.docType()))
                .map(d -> new VectorMatch(d, scores.get(d.path())))
                .sorted(Comparator.comparingDouble(VectorMatch::score).reversed())
                .limit(topN)
                .toList();
    }

    // ── DocumentRepository ────────────────────────────────────────────────────────

    @Override
    public Optional<StoredDocument> getByPath(TenantScope tenant, String path) {
        if (!TENANT.equals(tenant)) return Optional.empty();
        return byId.values().stream().filter(d -> d.path().equals(path)).findFirst();
    }

    @Override
    public Optional<StoredDocument> getById(String documentId) {
        return Optional.ofNullable(byId.get(documentId));
    }

    @Override
    public Map<String, StoredDocument> getByPaths(TenantScope tenant, Collection<String> paths) {
        Map<String, StoredDocument> found = new LinkedHashMap<>();
        for (String path : paths) {
            getByPath(tenant, path).ifPresent(d -> found.put(path, d));
        }
        return found;
    }

    @Override
    public boolean exists(TenantScope tenant, String path) {
        return getByPath(tenant, path).isPresent();
    }

    @Override
    public List<StoredDocument> findByPromotionLevel(TenantScope tenant, PromotionLevel level) {
        if (!TENANT.equals(tenant)) return List.of();
        return byId.values().stream()
                .filter(d -> PromotionLevel.fromTag(d.promotion()).orElse(PromotionLevel.STANDARD) == level)
                .toList();
    }

    @Override
    public void updatePromotionLevel(String documentId, PromotionLevel level) {
        byId.computeIfPresent(documentId, (id, d) -> d.withPromotion(level));
    }
}
