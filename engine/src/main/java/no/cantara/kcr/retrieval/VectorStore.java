package no.cantara.kcr.retrieval;

import no.cantara.kcr.model.VectorMatch;

import java.util.List;

/**
 * Similarity search backend. Implementations apply their own timeouts and throw
 * when the backend cannot answer; an empty list means "no matches".
 */
public interface VectorStore {

    /**
     * @param embedding query embedding
     * @param topN      maximum rows to return, best first
     * @param filter    tenant, promotion and doc-type restrictions
     */
    List<VectorMatch> search(float[] embedding, int topN, VectorSearchFilter filter);
}
