package no.cantara.kcr.manifest;

import no.cantara.kcr.context.KnowledgeRetrievalService;
import no.cantara.kcr.manifest.model.CorpusManifest;
import no.cantara.kcr.manifest.model.ManifestDocument;
import no.cantara.kcr.supersession.ChainIssue;
import no.cantara.kcr.supersession.RegistrationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Feeds a manifest's links and supersession declarations through a service's
 * indexing hooks, then collects what the offline validation pass reports.
 * Documents themselves must already be in the service's repository.
 */
public class ManifestIndexer {

    private static final Logger logger = LoggerFactory.getLogger(ManifestIndexer.class);

    /**
     * @param linkCycles           strongly connected groups of linked paths
     * @param supersessionWarnings warnings and rejections from registration
     * @param chainIssues          problems found by a full chain scan
     */
    public record IndexReport(List<List<String>> linkCycles,
                              List<String> supersessionWarnings,
                              List<ChainIssue> chainIssues) {
        public IndexReport {
            linkCycles = List.copyOf(linkCycles);
            supersessionWarnings = List.copyOf(supersessionWarnings);
            chainIssues = List.copyOf(chainIssues);
        }

        public boolean isClean() {
            return linkCycles.isEmpty() && supersessionWarnings.isEmpty() && chainIssues.isEmpty();
        }
    }

    public static IndexReport index(CorpusManifest manifest, KnowledgeRetrievalService service) {
        Map<String, List<String>> links = new LinkedHashMap<>();
        for (ManifestDocument doc : manifest.documents()) {
            links.put(doc.path(), doc.links());
        }
        service.linkGraphIndexer().onFullRebuild(links);

        List<String> warnings = new ArrayList<>();
        for (ManifestDocument doc : manifest.documents()) {
            Optional<RegistrationResult> result = service.supersessionIndexer()
                    .onDocumentIndexed(doc.id(), doc.supersedes());
            result.filter(r -> r.warning() != null).ifPresent(r -> warnings.add(
                    "document '" + doc.id() + "': " + (r.success() ? "" : "rejected, ") + r.warning()));
        }
        int resolved = service.supersessionTracker().resolvePending();

        IndexReport report = new IndexReport(
                service.linkGraph().enumerateCycles(),
                warnings,
                service.supersessionTracker().validateAllChains());
        logger.info("Indexed '{}': {} vertices, {} edges, {} late-resolved supersession(s), {} chain issue(s)",
                manifest.project(), service.linkGraph().vertexCount(), service.linkGraph().edgeCount(),
                resolved, report.chainIssues().size());
        return report;
    }
}
