package no.cantara.kcr.model;

import java.util.Objects;

/**
 * "{@code documentId} supersedes the document at {@code supersededPath}".
 *
 * @param supersededDocumentId id of the superseded document, or {@code null} while the
 *                             path does not resolve to an indexed document
 */
public record SupersessionRelationship(
        String documentId,
        String supersededPath,
        String supersededDocumentId
) {
    public SupersessionRelationship {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(supersededPath, "supersededPath");
    }

    public boolean isResolved() {
        return supersededDocumentId != null;
    }

    public SupersessionRelationship resolvedTo(String targetId) {
        return new SupersessionRelationship(documentId, supersededPath, targetId);
    }
}
