package no.cantara.kcr.model;

import java.util.Objects;

/**
 * A document reached by following links from a directly retrieved document.
 * It carries no similarity score of its own.
 *
 * @param document   the hydrated document (scores are zero)
 * @param linkedFrom path of the document whose link led here
 * @param linkDepth  number of link hops from the nearest direct match, at least 1
 */
public record LinkedDocument(RetrievedDocument document, String linkedFrom, int linkDepth) {
    public LinkedDocument {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(linkedFrom, "linkedFrom");
        if (linkDepth < 1) {
            throw new IllegalArgumentException("linkDepth must be >= 1, got " + linkDepth);
        }
    }

    public String path() {
        return document.path();
    }
}
