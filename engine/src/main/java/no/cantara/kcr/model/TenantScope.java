package no.cantara.kcr.model;

import java.util.Objects;

/**
 * Identifies one activated corpus: a project on a branch under a repository path.
 * Every vector-store and repository call is scoped to exactly one tenant.
 */
public record TenantScope(String project, String branch, String pathHash) {
    public TenantScope {
        Objects.requireNonNull(project, "project");
        Objects.requireNonNull(branch, "branch");
        Objects.requireNonNull(pathHash, "pathHash");
    }

    public String key() {
        return project + ":" + branch + ":" + pathHash;
    }
}
