package no.cantara.kcr.error;

/**
 * An upstream collaborator (vector store, document repository, supersession store)
 * could not be reached or failed. Distinct from an empty result.
 */
public class RetrievalBackendException extends KnowledgeRetrievalException {

    private final String backend;

    public RetrievalBackendException(String backend, String message, Throwable cause) {
        super(backend + " unavailable: " + message, cause);
        this.backend = backend;
    }

    public String backend() {
        return backend;
    }
}
