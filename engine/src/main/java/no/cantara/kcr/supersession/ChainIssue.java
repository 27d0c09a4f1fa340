package no.cantara.kcr.supersession;

/** A defect found by {@link SupersessionTracker#validateAllChains()}. */
public record ChainIssue(Type type, String documentId, String detail) {

    public enum Type {
        /** The superseded path does not resolve to an indexed document. */
        UNRESOLVED_TARGET,
        /** Following superseded-by pointers returns to an already visited document. */
        CYCLE,
        /** The chain is longer than the configured maximum depth. */
        EXCESSIVE_DEPTH,
        /** More than one document claims to supersede the same document. */
        BRANCHING
    }
}
