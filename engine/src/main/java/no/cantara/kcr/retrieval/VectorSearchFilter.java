package no.cantara.kcr.retrieval;

import no.cantara.kcr.model.PromotionLevel;
import no.cantara.kcr.model.TenantScope;

import java.util.List;
import java.util.Objects;

/**
 * Filter pushed down to the vector store.
 *
 * @param promotionTags stored tags to accept (at or above the requested floor)
 * @param docTypes      document types to accept; empty means all
 */
public record VectorSearchFilter(TenantScope tenant, List<String> promotionTags, List<String> docTypes) {
    public VectorSearchFilter {
        Objects.requireNonNull(tenant, "tenant");
        promotionTags = promotionTags != null ? List.copyOf(promotionTags) : List.of();
        docTypes = docTypes != null ? List.copyOf(docTypes) : List.of();
    }

    public static VectorSearchFilter of(TenantScope tenant, PromotionLevel floor, List<String> docTypes) {
        List<String> tags = floor == PromotionLevel.STANDARD
                ? List.of()
                : floor.atOrAbove().stream().map(PromotionLevel::tag).toList();
        return new VectorSearchFilter(tenant, tags, docTypes);
    }
}
