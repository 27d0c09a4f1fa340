package no.cantara.kcr.manifest.model;

import no.cantara.kcr.model.TenantScope;

import java.util.List;

/**
 * A parsed {@code knowledge.yaml}: the documents of one project branch.
 */
public record CorpusManifest(
        String kcrVersion,
        String project,
        String branch,
        List<ManifestDocument> documents
) {
    public static final String DEFAULT_BRANCH = "main";

    public CorpusManifest {
        documents = documents != null ? List.copyOf(documents) : List.of();
        if (branch == null || branch.isBlank()) branch = DEFAULT_BRANCH;
    }

    public TenantScope tenant(String pathHash) {
        return new TenantScope(project, branch, pathHash);
    }
}
