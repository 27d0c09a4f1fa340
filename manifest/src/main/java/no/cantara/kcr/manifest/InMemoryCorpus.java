package no.cantara.kcr.manifest;

import no.cantara.kcr.manifest.model.CorpusManifest;
import no.cantara.kcr.manifest.model.ManifestDocument;
import no.cantara.kcr.model.PromotionLevel;
import no.cantara.kcr.model.StoredDocument;
import no.cantara.kcr.model.TenantScope;
import no.cantara.kcr.model.VectorMatch;
import no.cantara.kcr.repository.DocumentRepository;
import no.cantara.kcr.retrieval.VectorSearchFilter;
import no.cantara.kcr.retrieval.VectorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Vector store and document repository over the documents of one manifest,
 * scored by cosine similarity. Negative similarities are reported as 0.
 */
public class InMemoryCorpus implements VectorStore, DocumentRepository {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryCorpus.class);

    private final TenantScope tenant;
    private final Map<String, StoredDocument> byId = new ConcurrentHashMap<>();
    private final Map<String, String> idByPath = new ConcurrentHashMap<>();
    private final Map<String, float[]> embeddings = new ConcurrentHashMap<>();

    public InMemoryCorpus(TenantScope tenant) {
        this.tenant = Objects.requireNonNull(tenant, "tenant");
    }

    public static InMemoryCorpus of(CorpusManifest manifest, TenantScope tenant) {
        InMemoryCorpus corpus = new InMemoryCorpus(tenant);
        manifest.documents().forEach(corpus::put);
        logger.info("Loaded {} document(s) for '{}', {} with embeddings",
                corpus.byId.size(), tenant.key(), corpus.embeddings.size());
        return corpus;
    }

    public void put(ManifestDocument doc) {
        StoredDocument previous = byId.put(doc.id(), doc.toStored());
        if (previous != null) idByPath.remove(previous.path());
        idByPath.put(doc.path(), doc.id());
        if (doc.embedding().isEmpty()) {
            embeddings.remove(doc.id());
        } else {
            embeddings.put(doc.id(), doc.embeddingVector());
        }
    }

    public void remove(String documentId) {
        StoredDocument removed = byId.remove(documentId);
        if (removed != null) idByPath.remove(removed.path());
        embeddings.remove(documentId);
    }

    public int size() {
        return byId.size();
    }

    // ── VectorStore ───────────────────────────────────────────────────────────────

    @Override
    public List<VectorMatch> search(float[] embedding, int topN, VectorSearchFilter filter) {
        if (!tenant.equals(filter.tenant())) return List.of();
        return byId.values().stream()
                .filter(doc -> embeddings.containsKey(doc.id()) && accepts(filter, doc))
                .map(doc -> new VectorMatch(doc, Math.max(0.0, cosine(embedding, embeddings.getOrDefault(doc.id(), new float[0])))))
                .sorted(Comparator.comparingDouble(VectorMatch::score).reversed()
                        .thenComparing(m -> m.document().path()))
                .limit(topN)
                .toList();
    }

    private static boolean accepts(VectorSearchFilter filter, StoredDocument doc) {
        if (!filter.promotionTags().isEmpty()) {
            String tag = PromotionLevel.fromTag(doc.promotion()).orElse(PromotionLevel.STANDARD).tag();
            if (!filter.promotionTags().contains(tag)) return false;
        }
        return filter.docTypes().isEmpty()
                || filter.docTypes().stream().anyMatch(t -> t.equalsIgnoreCase(doc.docType()));
    }

    static double cosine(float[] a, float[] b) {
        if (a.length != b.length || a.length == 0) return 0.0;
        double dot = 0, normA = 0, normB = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) return 0.0;
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    // ── DocumentRepository ────────────────────────────────────────────────────────

    @Override
    public Optional<StoredDocument> getByPath(TenantScope scope, String path) {
        if (!tenant.equals(scope)) return Optional.empty();
        String id = idByPath.get(path);
        return id == null ? Optional.empty() : Optional.ofNullable(byId.get(id));
    }

    @Override
    public Optional<StoredDocument> getById(String documentId) {
        return Optional.ofNullable(byId.get(documentId));
    }

    @Override
    public Map<String, StoredDocument> getByPaths(TenantScope scope, Collection<String> paths) {
        Map<String, StoredDocument> found = new LinkedHashMap<>();
        for (String path : paths) {
            getByPath(scope, path).ifPresent(doc -> found.put(path, doc));
        }
        return found;
    }

    @Override
    public boolean exists(TenantScope scope, String path) {
        return getByPath(scope, path).isPresent();
    }

    @Override
    public List<StoredDocument> findByPromotionLevel(TenantScope scope, PromotionLevel level) {
        if (!tenant.equals(scope)) return List.of();
        return byId.values().stream()
                .filter(d -> PromotionLevel.fromTag(d.promotion()).orElse(PromotionLevel.STANDARD) == level)
                .sorted(Comparator.comparing(StoredDocument::path))
                .toList();
    }

    @Override
    public void updatePromotionLevel(String documentId, PromotionLevel level) {
        byId.computeIfPresent(documentId, (id, doc) -> doc.withPromotion(level));
    }
}
