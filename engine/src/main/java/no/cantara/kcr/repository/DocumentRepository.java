package no.cantara.kcr.repository;

import no.cantara.kcr.model.PromotionLevel;
import no.cantara.kcr.model.StoredDocument;
import no.cantara.kcr.model.TenantScope;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable document storage owned by the indexing pipeline. Implementations carry
 * their own timeouts and report unavailability by throwing.
 */
public interface DocumentRepository {

    Optional<StoredDocument> getByPath(TenantScope tenant, String path);

    Optional<StoredDocument> getById(String documentId);

    /** Batch lookup; paths with no indexed document are absent from the result. */
    Map<String, StoredDocument> getByPaths(TenantScope tenant, Collection<String> paths);

    boolean exists(TenantScope tenant, String path);

    List<StoredDocument> findByPromotionLevel(TenantScope tenant, PromotionLevel level);

    void updatePromotionLevel(String documentId, PromotionLevel level);
}
