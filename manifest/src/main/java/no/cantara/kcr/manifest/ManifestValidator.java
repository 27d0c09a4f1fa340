package no.cantara.kcr.manifest;

import no.cantara.kcr.manifest.model.CorpusManifest;
import no.cantara.kcr.manifest.model.ManifestDocument;
import no.cantara.kcr.model.PromotionLevel;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Checks a parsed {@link CorpusManifest} before it is indexed.
 *
 * <p>Errors make the corpus unusable; warnings describe data the engine tolerates
 * (it treats unknown promotion tags as standard and keeps dangling links).
 */
public class ManifestValidator {

    private static final Set<String> KNOWN_KCR_VERSIONS = Set.of("0.1");

    /**
     * @param errors   conditions that block indexing
     * @param warnings conditions that are tolerated but suspicious
     */
    public record ValidationResult(List<String> errors, List<String> warnings) {
        public ValidationResult {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
        }

        public boolean isValid() { return errors.isEmpty(); }
        public boolean hasWarnings() { return !warnings.isEmpty(); }
    }

    public static ValidationResult validate(CorpusManifest manifest) {
        return validate(manifest, null);
    }

    /**
     * @param manifestDir directory holding the manifest, or {@code null} to skip
     *                    checking that document files exist
     */
    public static ValidationResult validate(CorpusManifest manifest, Path manifestDir) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        Set<String> declaredPaths = manifest.documents().stream()
                .map(ManifestDocument::path)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());

        if (manifest.kcrVersion() == null || manifest.kcrVersion().isBlank()) {
            warnings.add("manifest: 'kcr_version' not declared; assuming 0.1");
        } else if (!KNOWN_KCR_VERSIONS.contains(manifest.kcrVersion())) {
            warnings.add("manifest: unknown kcr_version '" + manifest.kcrVersion() + "'; processing as 0.1");
        }
        if (manifest.project() == null || manifest.project().isBlank()) {
            errors.add("manifest: 'project' is required");
        }
        if (manifest.documents().isEmpty()) {
            errors.add("manifest: 'documents' must not be empty");
        }

        Set<String> seenIds = new HashSet<>();
        Set<String> seenPaths = new HashSet<>();
        int dimension = -1;

        for (ManifestDocument doc : manifest.documents()) {
            if (doc.id() == null || doc.id().isBlank()) {
                errors.add("document: 'id' is required" + (doc.path() != null ? " (path '" + doc.path() + "')" : ""));
                continue;
            }
            String p = "document '" + doc.id() + "'";

            if (!seenIds.add(doc.id())) {
                errors.add(p + ": duplicate 'id'");
            }
            if (doc.path() == null || doc.path().isBlank()) {
                errors.add(p + ": 'path' is required");
                continue;
            }
            if (!seenPaths.add(doc.path())) {
                errors.add(p + ": duplicate 'path' '" + doc.path() + "'");
            }
            if (manifestDir != null && doc.content() == null && !Files.exists(manifestDir.resolve(doc.path()))) {
                warnings.add(p + ": path '" + doc.path() + "' does not exist and no inline content given");
            }

            if (PromotionLevel.fromTag(doc.promotion()).isEmpty()) {
                warnings.add(p + ": unknown 'promotion' value '" + doc.promotion() + "'; treated as standard");
            }

            for (String link : doc.links()) {
                if (link.equals(doc.path())) {
                    warnings.add(p + ": links to itself; ignored");
                } else if (!declaredPaths.contains(link)) {
                    warnings.add(p + ": 'links' references undeclared path '" + link + "'");
                }
            }

            if (doc.supersedes() != null) {
                if (doc.supersedes().equals(doc.path())) {
                    errors.add(p + ": cannot supersede itself");
                } else if (!declaredPaths.contains(doc.supersedes())) {
                    warnings.add(p + ": 'supersedes' references undeclared path '" + doc.supersedes() + "'");
                }
            }

            if (!doc.embedding().isEmpty()) {
                if (dimension < 0) {
                    dimension = doc.embedding().size();
                } else if (doc.embedding().size() != dimension) {
                    errors.add(p + ": embedding has " + doc.embedding().size()
                            + " dimensions, expected " + dimension);
                }
            }
        }

        return new ValidationResult(errors, warnings);
    }
}
