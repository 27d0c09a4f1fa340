package no.cantara.kcr.error;

/** Base class for failures that abort a retrieval or maintenance call. */
public class KnowledgeRetrievalException extends RuntimeException {
    public KnowledgeRetrievalException(String message) {
        super(message);
    }

    public KnowledgeRetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
