package no.cantara.kcr.model;

/**
 * Supersession state of one document, as seen by the tracker at lookup time.
 *
 * @param supersedesId     id this document supersedes, or {@code null}
 * @param supersededById   id of the document that supersedes this one, or {@code null}
 * @param chainDepth       hops from this document to the current version (0 when current)
 * @param currentVersionId id of the newest reachable version
 * @param multiplier       relevance multiplier applied to this document's score
 * @param cycleDetected    true when the walk revisited a document
 * @param truncated        true when the walk stopped at the configured maximum depth
 */
public record SupersessionInfo(
        String documentId,
        String supersedesId,
        String supersededById,
        int chainDepth,
        String currentVersionId,
        double multiplier,
        boolean cycleDetected,
        boolean truncated
) {
    public static SupersessionInfo standalone(String documentId) {
        return new SupersessionInfo(documentId, null, null, 0, documentId, 1.0, false, false);
    }

    public boolean isSuperseded() {
        return supersededById != null;
    }
}
