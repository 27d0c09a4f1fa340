package no.cantara.kcr.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A document selected for a query. Immutable; downstream stages derive new
 * instances instead of mutating a shared one.
 *
 * @param id           document id, used for supersession lookups
 * @param path         relative path, unique per tenant
 * @param rawScore     similarity reported by the vector store (0 when not retrieved by similarity)
 * @param boostedScore raw score plus the promotion boost, capped at 1.0
 */
public record RetrievedDocument(
        String id,
        String path,
        String title,
        String summary,
        String content,
        int charCount,
        String docType,
        PromotionLevel promotion,
        double rawScore,
        double boostedScore,
        LocalDate date
) {
    public RetrievedDocument {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(promotion, "promotion");
        content = content != null ? content : "";
    }

    public static RetrievedDocument of(StoredDocument stored, PromotionLevel promotion,
                                       double rawScore, double boostedScore) {
        return new RetrievedDocument(
                stored.id(),
                stored.path(),
                stored.title(),
                stored.summary(),
                stored.content(),
                stored.content().length(),
                stored.docType(),
                promotion,
                rawScore,
                boostedScore,
                stored.date());
    }
}
