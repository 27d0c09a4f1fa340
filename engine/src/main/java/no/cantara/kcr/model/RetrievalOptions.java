package no.cantara.kcr.model;

import java.util.List;

/**
 * Per-call retrieval settings, already resolved from project and global configuration.
 *
 * @param docTypes allow-list of document types; empty means every type
 */
public record RetrievalOptions(
        double minRelevanceScore,
        int maxResults,
        int maxLinkedDocs,
        int maxLinkDepth,
        boolean includeCritical,
        PromotionLevel minPromotionLevel,
        List<String> docTypes,
        boolean applyRelevanceBoosting
) {
    public RetrievalOptions {
        docTypes = docTypes != null ? List.copyOf(docTypes) : List.of();
    }

    public static RetrievalOptions defaults() {
        return new RetrievalOptions(0.7, 10, 5, 2, true, PromotionLevel.STANDARD, List.of(), true);
    }

    public RetrievalOptions withMinRelevanceScore(double value) {
        return new RetrievalOptions(value, maxResults, maxLinkedDocs, maxLinkDepth,
                includeCritical, minPromotionLevel, docTypes, applyRelevanceBoosting);
    }

    public RetrievalOptions withMaxResults(int value) {
        return new RetrievalOptions(minRelevanceScore, value, maxLinkedDocs, maxLinkDepth,
                includeCritical, minPromotionLevel, docTypes, applyRelevanceBoosting);
    }

    public RetrievalOptions withLinkLimits(int maxDepth, int maxDocs) {
        return new RetrievalOptions(minRelevanceScore, maxResults, maxDocs, maxDepth,
                includeCritical, minPromotionLevel, docTypes, applyRelevanceBoosting);
    }

    public RetrievalOptions withIncludeCritical(boolean value) {
        return new RetrievalOptions(minRelevanceScore, maxResults, maxLinkedDocs, maxLinkDepth,
                value, minPromotionLevel, docTypes, applyRelevanceBoosting);
    }

    public RetrievalOptions withMinPromotionLevel(PromotionLevel value) {
        return new RetrievalOptions(minRelevanceScore, maxResults, maxLinkedDocs, maxLinkDepth,
                includeCritical, value, docTypes, applyRelevanceBoosting);
    }

    public RetrievalOptions withDocTypes(List<String> value) {
        return new RetrievalOptions(minRelevanceScore, maxResults, maxLinkedDocs, maxLinkDepth,
                includeCritical, minPromotionLevel, value, applyRelevanceBoosting);
    }

    public RetrievalOptions withBoosting(boolean value) {
        return new RetrievalOptions(minRelevanceScore, maxResults, maxLinkedDocs, maxLinkDepth,
                includeCritical, minPromotionLevel, docTypes, value);
    }

    public boolean allowsDocType(String docType) {
        return docTypes.isEmpty() || (docType != null && docTypes.stream().anyMatch(docType::equalsIgnoreCase));
    }
}
