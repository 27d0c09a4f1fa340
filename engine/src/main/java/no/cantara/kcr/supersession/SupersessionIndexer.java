package no.cantara.kcr.supersession;

import java.util.Objects;
import java.util.Optional;

/**
 * Hooks the indexing pipeline calls when documents carrying a {@code supersedes}
 * declaration are indexed or deleted.
 */
public class SupersessionIndexer {

    private final SupersessionTracker tracker;

    public SupersessionIndexer(SupersessionTracker tracker) {
        this.tracker = Objects.requireNonNull(tracker, "tracker");
    }

    /**
     * @param declaredSupersededPath the document's {@code supersedes} value, or
     *                               {@code null} when it declares none (any earlier
     *                               declaration is dropped)
     * @return the registration outcome, empty when nothing was declared
     */
    public Optional<RegistrationResult> onDocumentIndexed(String documentId, String declaredSupersededPath) {
        if (declaredSupersededPath == null || declaredSupersededPath.isBlank()) {
            tracker.clearDeclaration(documentId);
            return Optional.empty();
        }
        return Optional.of(tracker.register(documentId, declaredSupersededPath.trim()));
    }

    public RemovalResult onDocumentDeleted(String documentId) {
        return tracker.removeFromChain(documentId);
    }
}
