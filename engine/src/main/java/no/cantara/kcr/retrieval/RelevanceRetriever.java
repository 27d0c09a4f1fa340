package no.cantara.kcr.retrieval;

import no.cantara.kcr.config.EngineConfig;
import no.cantara.kcr.config.RetrievalOptionsValidator;
import no.cantara.kcr.error.RetrievalBackendException;
import no.cantara.kcr.model.PromotionLevel;
import no.cantara.kcr.model.RetrievalOptions;
import no.cantara.kcr.model.RetrievedDocument;
import no.cantara.kcr.model.StoredDocument;
import no.cantara.kcr.model.TenantScope;
import no.cantara.kcr.model.VectorMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Relevance-filtered vector retrieval with promotion boosting.
 *
 * <p>Over-fetches from the vector store, drops rows whose raw score is below
 * {@code min_relevance_score}, optionally adds the promotion boost, re-sorts and
 * truncates to {@code max_results}. Stateless; one vector-store call per invocation.
 */
public class RelevanceRetriever {

    private static final Logger logger = LoggerFactory.getLogger(RelevanceRetriever.class);

    static final Comparator<RetrievedDocument> BY_SCORE =
            Comparator.comparingDouble(RetrievedDocument::boostedScore).reversed()
                    .thenComparing(RetrievedDocument::path);

    private final VectorStore vectorStore;
    private final TenantScope tenant;
    private final PromotionBoosts boosts;
    private final int overFetchFactor;

    public RelevanceRetriever(VectorStore vectorStore, TenantScope tenant, EngineConfig config) {
        this.vectorStore = Objects.requireNonNull(vectorStore, "vectorStore");
        this.tenant = Objects.requireNonNull(tenant, "tenant");
        this.boosts = config.boosts();
        this.overFetchFactor = config.overFetchFactor();
    }

    /**
     * @throws no.cantara.kcr.error.InvalidOptionsException if the options are out of range
     * @throws RetrievalBackendException                  if the vector store fails
     */
    public RetrievalResult retrieve(float[] queryEmbedding, RetrievalOptions options) {
        Objects.requireNonNull(queryEmbedding, "queryEmbedding");
        RetrievalOptionsValidator.requireValid(options);

        int topN = (int) Math.min((long) options.maxResults() * overFetchFactor, Integer.MAX_VALUE);
        VectorSearchFilter filter = VectorSearchFilter.of(tenant, options.minPromotionLevel(), options.docTypes());

        List<VectorMatch> matches;
        try {
            matches = vectorStore.search(queryEmbedding, topN, filter);
        } catch (RetrievalBackendException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RetrievalBackendException("vector store", e.getMessage(), e);
        }
        if (matches == null) {
            throw new RetrievalBackendException("vector store", "search returned no result set", null);
        }

        List<RetrievedDocument> accepted = new ArrayList<>();
        for (VectorMatch match : matches) {
            if (match.score() < options.minRelevanceScore()) continue;

            StoredDocument stored = match.document();
            PromotionLevel level = promotionOf(stored);
            // stores are not trusted to honour the pushed-down filter
            if (!level.isAtLeast(options.minPromotionLevel())) continue;
            if (!options.allowsDocType(stored.docType())) continue;

            double boosted = options.applyRelevanceBoosting()
                    ? boosts.apply(match.score(), level)
                    : match.score();
            accepted.add(RetrievedDocument.of(stored, level, match.score(), boosted));
        }

        int total = accepted.size();
        List<RetrievedDocument> ranked = accepted.stream()
                .sorted(BY_SCORE)
                .limit(options.maxResults())
                .toList();

        logger.debug("Retrieved {} of {} matches above {} (fetched {})",
                ranked.size(), total, options.minRelevanceScore(), matches.size());
        return new RetrievalResult(ranked, total);
    }

    /** Parses a stored promotion tag, defaulting to standard with a warning. */
    public static PromotionLevel promotionOf(StoredDocument stored) {
        return PromotionLevel.fromTag(stored.promotion()).orElseGet(() -> {
            logger.warn("Document '{}' has missing or unknown promotion level '{}'; treating as standard",
                    stored.path(), stored.promotion());
            return PromotionLevel.STANDARD;
        });
    }
}
