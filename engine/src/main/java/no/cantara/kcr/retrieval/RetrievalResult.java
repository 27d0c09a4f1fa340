package no.cantara.kcr.retrieval;

import no.cantara.kcr.model.RetrievedDocument;

import java.util.List;

/**
 * @param documents    ranked matches, at most {@code max_results}
 * @param totalMatches matches that cleared the relevance threshold, before truncation
 */
public record RetrievalResult(List<RetrievedDocument> documents, int totalMatches) {
    public RetrievalResult {
        documents = documents != null ? List.copyOf(documents) : List.of();
    }

    public static RetrievalResult empty() {
        return new RetrievalResult(List.of(), 0);
    }
}
