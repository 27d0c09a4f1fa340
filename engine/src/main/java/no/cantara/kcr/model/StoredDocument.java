package no.cantara.kcr.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A document as the indexer persisted it. The promotion tag is kept raw because
 * stored data may carry a missing or malformed value.
 */
public record StoredDocument(
        String id,
        String path,
        String title,
        String summary,
        String content,
        String docType,
        String promotion,
        LocalDate date
) {
    public StoredDocument {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(path, "path");
        content = content != null ? content : "";
    }

    public StoredDocument withPromotion(PromotionLevel level) {
        return new StoredDocument(id, path, title, summary, content, docType, level.tag(), date);
    }
}
