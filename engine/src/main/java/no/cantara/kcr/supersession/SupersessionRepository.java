package no.cantara.kcr.supersession;

import no.cantara.kcr.model.SupersessionRelationship;

import java.util.List;
import java.util.Optional;

/**
 * Durable store of supersession relationships, one per superseding document.
 * Each call is an independent point read or write; nothing spans a chain walk.
 */
public interface SupersessionRepository {

    /** The relationship declared by {@code documentId}, i.e. what it supersedes. */
    Optional<SupersessionRelationship> findBySuperseding(String documentId);

    /** Relationships whose resolved target is {@code documentId}. More than one is a data defect. */
    List<SupersessionRelationship> findBySuperseded(String documentId);

    /** Inserts or replaces the relationship declared by {@code relationship.documentId()}. */
    void save(SupersessionRelationship relationship);

    void delete(String documentId);

    List<SupersessionRelationship> findAll();
}
