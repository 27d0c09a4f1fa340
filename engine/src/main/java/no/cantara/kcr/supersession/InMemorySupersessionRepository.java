package no.cantara.kcr.supersession;

import no.cantara.kcr.model.SupersessionRelationship;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link SupersessionRepository} for embedded use and tests.
 */
public class InMemorySupersessionRepository implements SupersessionRepository {

    private final Map<String, SupersessionRelationship> byDocument = new ConcurrentHashMap<>();

    @Override
    public Optional<SupersessionRelationship> findBySuperseding(String documentId) {
        return Optional.ofNullable(byDocument.get(documentId));
    }

    @Override
    public List<SupersessionRelationship> findBySuperseded(String documentId) {
        return byDocument.values().stream()
                .filter(r -> documentId.equals(r.supersededDocumentId()))
                .sorted(Comparator.comparing(SupersessionRelationship::documentId))
                .toList();
    }

    @Override
    public void save(SupersessionRelationship relationship) {
        byDocument.put(relationship.documentId(), relationship);
    }

    @Override
    public void delete(String documentId) {
        byDocument.remove(documentId);
    }

    @Override
    public List<SupersessionRelationship> findAll() {
        return byDocument.values().stream()
                .sorted(Comparator.comparing(SupersessionRelationship::documentId))
                .toList();
    }
}
