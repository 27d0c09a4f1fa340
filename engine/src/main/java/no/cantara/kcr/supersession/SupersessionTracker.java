package no.cantara.kcr.supersession;

import no.cantara.kcr.config.EngineConfig;
import no.cantara.kcr.error.RetrievalBackendException;
import no.cantara.kcr.model.PromotionLevel;
import no.cantara.kcr.model.StoredDocument;
import no.cantara.kcr.model.SupersessionInfo;
import no.cantara.kcr.model.SupersessionRelationship;
import no.cantara.kcr.model.TenantScope;
import no.cantara.kcr.repository.DocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Tracks supersession chains (older version &rarr; newer version) and derives the
 * relevance multiplier for superseded documents.
 *
 * <p>Each document supersedes at most one document and is superseded by at most
 * one, so a lineage is a linked list. Registration refuses anything that would
 * close a loop. Reads never fail on bad data: walks are iterative, bounded by
 * {@code max_chain_depth} and guarded by a visited set, and problems are logged.
 *
 * <p>The current version has multiplier 1.0; a document {@code d} hops behind it
 * gets {@code decay_base^d}. A document caught in a cycle keeps 1.0.
 */
public class SupersessionTracker {

    private static final Logger logger = LoggerFactory.getLogger(SupersessionTracker.class);

    private final SupersessionRepository relationships;
    private final DocumentRepository documents;
    private final TenantScope tenant;
    private final int maxChainDepth;
    private final double decayBase;
    private final ReentrantLock mutationLock = new ReentrantLock();

    public SupersessionTracker(SupersessionRepository relationships,
                               DocumentRepository documents,
                               TenantScope tenant,
                               EngineConfig config) {
        this.relationships = Objects.requireNonNull(relationships, "relationships");
        this.documents = Objects.requireNonNull(documents, "documents");
        this.tenant = Objects.requireNonNull(tenant, "tenant");
        this.maxChainDepth = config.maxChainDepth();
        this.decayBase = config.decayBase();
    }

    // ── Registration ──────────────────────────────────────────────────────────────

    /**
     * Records that {@code documentId} supersedes the document at {@code supersededPath}.
     * A path that is not indexed yet is stored unresolved with a warning. A
     * registration that would create a cycle, or give a document a second
     * successor, is rejected and nothing is stored.
     *
     * <p>Demotion of the superseded document is one-way: switching to another
     * target does not restore the promotion of the previous one.
     */
    public RegistrationResult register(String documentId, String supersededPath) {
        Objects.requireNonNull(documentId, "documentId");
        Objects.requireNonNull(supersededPath, "supersededPath");

        mutationLock.lock();
        try {
            Optional<StoredDocument> target = documentCall(() -> documents.getByPath(tenant, supersededPath));
            String targetId = target.map(StoredDocument::id).orElse(null);

            if (targetId != null) {
                String rejection = rejectionReason(documentId, targetId);
                if (rejection != null) {
                    logger.warn("Supersession '{}' -> '{}' rejected: {}", documentId, supersededPath, rejection);
                    return RegistrationResult.rejected(rejection);
                }
            }

            Optional<SupersessionRelationship> previous = store(() -> relationships.findBySuperseding(documentId))
                    .filter(r -> !r.supersededPath().equals(supersededPath));

            String warning = null;
            if (targetId == null) {
                warning = "Superseded document '" + supersededPath + "' not found; stored unresolved";
                logger.warn("Supersession '{}' -> '{}': target not indexed yet, stored unresolved",
                        documentId, supersededPath);
            } else {
                // demote before saving: a failed demotion leaves nothing stored
                demote(target.get(), documentId);
            }
            storeRun(() -> relationships.save(new SupersessionRelationship(documentId, supersededPath, targetId)));

            previous.ifPresent(r -> {
                logger.info("'{}' now supersedes '{}' instead of '{}'",
                        documentId, supersededPath, r.supersededPath());
                if (r.isResolved()) {
                    logger.warn("'{}' is no longer superseded but keeps its lowered promotion; re-promote it manually",
                            r.supersededPath());
                }
            });

            int depth = chainDepthBehind(documentId);
            logger.info("Registered supersession '{}' -> '{}' (chain depth {})", documentId, supersededPath, depth);
            return RegistrationResult.stored(depth, warning);
        } finally {
            mutationLock.unlock();
        }
    }

    /** Drops the supersession declared by {@code documentId}, if any. */
    public boolean clearDeclaration(String documentId) {
        mutationLock.lock();
        try {
            if (store(() -> relationships.findBySuperseding(documentId)).isEmpty()) return false;
            storeRun(() -> relationships.delete(documentId));
            logger.info("Cleared supersession declared by '{}'", documentId);
            return true;
        } finally {
            mutationLock.unlock();
        }
    }

    /** Null when {@code documentId -> targetId} may be stored. */
    private String rejectionReason(String documentId, String targetId) {
        if (documentId.equals(targetId)) {
            return "document cannot supersede itself (cycle)";
        }
        if (walkBackward(targetId).ids().contains(documentId)) {
            return "cycle detected: '" + targetId + "' already supersedes '" + documentId + "'";
        }
        List<SupersessionRelationship> claimants = store(() -> relationships.findBySuperseded(targetId)).stream()
                .filter(r -> !r.documentId().equals(documentId))
                .toList();
        if (!claimants.isEmpty()) {
            return "'" + targetId + "' is already superseded by '" + claimants.get(0).documentId() + "'";
        }
        return null;
    }

    private void demote(StoredDocument target, String supersedingId) {
        PromotionLevel level = PromotionLevel.fromTag(target.promotion()).orElse(PromotionLevel.STANDARD);
        if (level == PromotionLevel.STANDARD) return;
        documentRun(() -> documents.updatePromotionLevel(target.id(), PromotionLevel.STANDARD));
        logger.info("Lowered promotion of superseded '{}' from {} to standard (superseded by '{}')",
                target.path(), level.tag(), supersedingId);
    }

    // ── Reads ─────────────────────────────────────────────────────────────────────

    public SupersessionInfo getInfo(String documentId) {
        Walk forward = walkForward(documentId);
        String supersedes = store(() -> relationships.findBySuperseding(documentId))
                .map(SupersessionRelationship::supersededDocumentId)
                .orElse(null);
        String supersededBy = forward.ids().size() > 1 ? forward.ids().get(1) : forward.revisited();
        int depth = forward.ids().size() - 1;
        double multiplier = forward.cycle() ? 1.0 : multiplierFor(depth);
        return new SupersessionInfo(documentId, supersedes, supersededBy, depth,
                forward.last(), multiplier, forward.cycle(), forward.truncated());
    }

    /** {@code decay_base ^ depth}; 1.0 for the current version. */
    public double multiplierFor(int chainDepth) {
        return chainDepth <= 0 ? 1.0 : Math.pow(decayBase, chainDepth);
    }

    /** Document ids of the lineage containing {@code documentId}, oldest first. */
    public List<String> getChain(String documentId) {
        List<String> older = new ArrayList<>(walkBackward(documentId).ids());
        Collections.reverse(older);
        Set<String> chain = new LinkedHashSet<>(older);
        chain.addAll(walkForward(documentId).ids());
        return List.copyOf(chain);
    }

    /** The newest reachable version; on a cycle or depth cap, the last node safely reached. */
    public String getCurrentVersion(String documentId) {
        return walkForward(documentId).last();
    }

    // ── Removal ───────────────────────────────────────────────────────────────────

    /**
     * Takes a deleted document out of its chain. A successor is spliced onto the
     * predecessor; if the document was current, its predecessor becomes current.
     * A successor with no predecessor to inherit keeps its declaration, unresolved.
     */
    public RemovalResult removeFromChain(String documentId) {
        mutationLock.lock();
        try {
            Optional<SupersessionRelationship> own = store(() -> relationships.findBySuperseding(documentId));
            List<SupersessionRelationship> successors = store(() -> relationships.findBySuperseded(documentId));

            own.ifPresent(r -> storeRun(() -> relationships.delete(documentId)));

            boolean reconnected = false;
            for (SupersessionRelationship successor : successors) {
                if (own.isPresent()) {
                    SupersessionRelationship spliced = new SupersessionRelationship(
                            successor.documentId(), own.get().supersededPath(), own.get().supersededDocumentId());
                    storeRun(() -> relationships.save(spliced));
                    reconnected = true;
                    logger.info("Spliced '{}' onto '{}' after removing '{}'",
                            successor.documentId(), own.get().supersededPath(), documentId);
                } else {
                    storeRun(() -> relationships.save(successor.resolvedTo(null)));
                    logger.info("'{}' now supersedes a deleted document '{}'",
                            successor.documentId(), successor.supersededPath());
                }
            }

            String promoted = null;
            if (successors.isEmpty() && own.isPresent() && own.get().isResolved()) {
                promoted = own.get().supersededDocumentId();
                logger.info("'{}' is the current version after removing '{}'", promoted, documentId);
            }
            return new RemovalResult(reconnected, promoted);
        } finally {
            mutationLock.unlock();
        }
    }

    // ── Maintenance ───────────────────────────────────────────────────────────────

    /**
     * Scans every stored relationship for unresolved targets, cycles, branching and
     * over-long chains. Intended for an offline validation pass.
     */
    public List<ChainIssue> validateAllChains() {
        List<SupersessionRelationship> all = store(relationships::findAll);
        List<ChainIssue> issues = new ArrayList<>();

        Map<String, List<String>> claimantsByTarget = new TreeMap<>();
        Set<String> ids = new LinkedHashSet<>();
        for (SupersessionRelationship r : all) {
            ids.add(r.documentId());
            if (!r.isResolved()) {
                issues.add(new ChainIssue(ChainIssue.Type.UNRESOLVED_TARGET, r.documentId(),
                        "superseded path '" + r.supersededPath() + "' is not indexed"));
                continue;
            }
            ids.add(r.supersededDocumentId());
            claimantsByTarget.computeIfAbsent(r.supersededDocumentId(), k -> new ArrayList<>()).add(r.documentId());
        }
        claimantsByTarget.forEach((target, claimants) -> {
            if (claimants.size() > 1) {
                issues.add(new ChainIssue(ChainIssue.Type.BRANCHING, target,
                        "superseded by more than one document: " + claimants));
            }
        });

        Set<Set<String>> seenCycles = new HashSet<>();
        for (String id : ids) {
            Walk walk = walkForward(id);
            if (walk.cycle()) {
                List<String> path = walk.ids();
                Set<String> members = new LinkedHashSet<>(path.subList(path.indexOf(walk.revisited()), path.size()));
                if (seenCycles.add(members)) {
                    issues.add(new ChainIssue(ChainIssue.Type.CYCLE, id, "supersession cycle through " + members));
                }
            } else if (walk.truncated() && isOldest(id)) {
                issues.add(new ChainIssue(ChainIssue.Type.EXCESSIVE_DEPTH, id,
                        "chain longer than " + maxChainDepth + " versions"));
            }
        }
        if (!issues.isEmpty()) {
            logger.warn("Supersession validation found {} issue(s)", issues.size());
        }
        return List.copyOf(issues);
    }

    /**
     * Re-resolves relationships stored while their target was not indexed.
     *
     * @return number of relationships that now point at a document
     */
    public int resolvePending() {
        mutationLock.lock();
        try {
            int resolved = 0;
            for (SupersessionRelationship r : store(relationships::findAll)) {
                if (r.isResolved()) continue;
                Optional<StoredDocument> target = documentCall(() -> documents.getByPath(tenant, r.supersededPath()));
                if (target.isEmpty()) continue;

                String rejection = rejectionReason(r.documentId(), target.get().id());
                if (rejection != null) {
                    logger.warn("Cannot resolve '{}' -> '{}': {}", r.documentId(), r.supersededPath(), rejection);
                    continue;
                }
                demote(target.get(), r.documentId());
                storeRun(() -> relationships.save(r.resolvedTo(target.get().id())));
                resolved++;
            }
            if (resolved > 0) {
                logger.info("Resolved {} pending supersession(s)", resolved);
            }
            return resolved;
        } finally {
            mutationLock.unlock();
        }
    }

    // ── Walks ─────────────────────────────────────────────────────────────────────

    /**
     * @param ids       visited ids in walk order, starting with the origin
     * @param revisited id that closed a cycle, or {@code null}
     * @param dangling  true when the walk ended on an unresolved relationship
     */
    private record Walk(List<String> ids, boolean cycle, boolean truncated, String revisited, boolean dangling) {
        String last() {
            return ids.get(ids.size() - 1);
        }
    }

    /** Follows superseded-by pointers toward the current version. */
    private Walk walkForward(String documentId) {
        return walk(documentId, id -> {
            List<SupersessionRelationship> successors = store(() -> relationships.findBySuperseded(id));
            if (successors.size() > 1) {
                logger.warn("'{}' is superseded by {} documents; following '{}'",
                        id, successors.size(), successors.get(0).documentId());
            }
            return successors.isEmpty() ? Step.END : new Step(successors.get(0).documentId(), false);
        });
    }

    /** Follows supersedes pointers toward the oldest version. */
    private Walk walkBackward(String documentId) {
        return walk(documentId, id -> store(() -> relationships.findBySuperseding(id))
                .map(r -> r.isResolved() ? new Step(r.supersededDocumentId(), false) : Step.DANGLING)
                .orElse(Step.END));
    }

    private record Step(String next, boolean dangling) {
        static final Step END = new Step(null, false);
        static final Step DANGLING = new Step(null, true);
    }

    private Walk walk(String origin, Function<String, Step> step) {
        List<String> ids = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        ids.add(origin);
        visited.add(origin);
        String current = origin;
        while (true) {
            Step s = step.apply(current);
            if (s.next() == null) {
                return new Walk(ids, false, false, null, s.dangling());
            }
            if (visited.contains(s.next())) {
                logger.warn("Supersession cycle detected at '{}' while walking from '{}'", s.next(), origin);
                return new Walk(ids, true, false, s.next(), false);
            }
            if (ids.size() - 1 >= maxChainDepth) {
                logger.warn("Supersession chain from '{}' exceeds {} hops; stopping at '{}'",
                        origin, maxChainDepth, current);
                return new Walk(ids, false, true, null, false);
            }
            visited.add(s.next());
            ids.add(s.next());
            current = s.next();
        }
    }

    private boolean isOldest(String documentId) {
        return store(() -> relationships.findBySuperseding(documentId))
                .filter(SupersessionRelationship::isResolved)
                .isEmpty();
    }

    private int chainDepthBehind(String documentId) {
        Walk back = walkBackward(documentId);
        return back.ids().size() - 1 + (back.dangling() ? 1 : 0);
    }

    // ── Backend calls ─────────────────────────────────────────────────────────────

    private <T> T store(Supplier<T> call) {
        try {
            return call.get();
        } catch (RetrievalBackendException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RetrievalBackendException("supersession store", e.getMessage(), e);
        }
    }

    private void storeRun(Runnable call) {
        store(() -> {
            call.run();
            return null;
        });
    }

    private <T> T documentCall(Supplier<T> call) {
        try {
            return call.get();
        } catch (RetrievalBackendException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RetrievalBackendException("document repository", e.getMessage(), e);
        }
    }

    private void documentRun(Runnable call) {
        documentCall(() -> {
            call.run();
            return null;
        });
    }
}
