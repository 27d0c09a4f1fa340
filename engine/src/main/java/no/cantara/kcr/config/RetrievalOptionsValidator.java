package no.cantara.kcr.config;

import no.cantara.kcr.error.InvalidOptionsException;
import no.cantara.kcr.model.RetrievalOptions;

import java.util.ArrayList;
import java.util.List;

/**
 * Rejects out-of-range retrieval options before any backend is called.
 */
public final class RetrievalOptionsValidator {

    private RetrievalOptionsValidator() {}

    public static List<String> violations(RetrievalOptions options) {
        List<String> errors = new ArrayList<>();
        if (options == null) {
            errors.add("options are required");
            return errors;
        }
        double min = options.minRelevanceScore();
        if (Double.isNaN(min) || min < 0.0 || min > 1.0) {
            errors.add("min_relevance_score must be in [0, 1], got " + min);
        }
        if (options.maxResults() < 1) {
            errors.add("max_results must be >= 1, got " + options.maxResults());
        }
        if (options.maxLinkedDocs() < 0) {
            errors.add("max_linked_docs must be >= 0, got " + options.maxLinkedDocs());
        }
        if (options.maxLinkDepth() < 0) {
            errors.add("max_link_depth must be >= 0, got " + options.maxLinkDepth());
        }
        if (options.minPromotionLevel() == null) {
            errors.add("min_promotion_level is required");
        }
        if (options.docTypes().stream().anyMatch(t -> t == null || t.isBlank())) {
            errors.add("doc_types must not contain blank entries");
        }
        return errors;
    }

    /** @throws InvalidOptionsException listing every violation */
    public static RetrievalOptions requireValid(RetrievalOptions options) {
        List<String> errors = violations(options);
        if (!errors.isEmpty()) {
            throw new InvalidOptionsException(errors);
        }
        return options;
    }
}
