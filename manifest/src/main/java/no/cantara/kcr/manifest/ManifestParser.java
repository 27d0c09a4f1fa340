package no.cantara.kcr.manifest;

import no.cantara.kcr.manifest.model.CorpusManifest;
import no.cantara.kcr.manifest.model.ManifestDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.List;
import java.util.Map;

/**
 * Parses a knowledge.yaml corpus manifest into a {@link CorpusManifest}.
 */
public class ManifestParser {

    private static final Logger logger = LoggerFactory.getLogger(ManifestParser.class);

    private static final Yaml YAML = new Yaml(new SafeConstructor(new LoaderOptions()));

    /**
     * Parses the manifest file. Documents without inline {@code content} get the
     * content of the file at their path, resolved against the manifest's directory.
     */
    public static CorpusManifest parse(Path path) throws IOException {
        CorpusManifest manifest;
        try (InputStream is = Files.newInputStream(path)) {
            manifest = parse(is);
        }
        Path root = path.toAbsolutePath().getParent();
        List<ManifestDocument> documents = manifest.documents().stream()
                .map(d -> d.content() != null || d.path() == null ? d : d.withContent(readContent(root, d)))
                .toList();
        return new CorpusManifest(manifest.kcrVersion(), manifest.project(), manifest.branch(), documents);
    }

    public static CorpusManifest parse(InputStream is) {
        Map<String, Object> data = YAML.load(is);
        return fromMap(data != null ? data : Map.of());
    }

    @SuppressWarnings("unchecked")
    public static CorpusManifest fromMap(Map<String, Object> data) {
        String kcrVersion = stringOf(data.get("kcr_version"));
        String project = (String) data.get("project");
        String branch = (String) data.get("branch");

        List<Map<String, Object>> docMaps = (List<Map<String, Object>>) data.getOrDefault("documents", List.of());
        List<ManifestDocument> documents = docMaps.stream().map(ManifestParser::parseDocument).toList();

        return new CorpusManifest(kcrVersion, project, branch, documents);
    }

    /**
     * Rejects absolute paths and paths that escape the manifest root.
     */
    static String validateDocumentPath(String rawPath) {
        if (rawPath == null) return null;
        if (rawPath.startsWith("/") || rawPath.startsWith("\\")) {
            throw new IllegalArgumentException("Document path must be relative: " + rawPath);
        }
        try {
            Path normalised = Path.of(rawPath).normalize();
            if (normalised.startsWith("..")) {
                throw new IllegalArgumentException("Document path escapes manifest root: " + rawPath);
            }
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("Invalid document path: " + rawPath, e);
        }
        return rawPath;
    }

    @SuppressWarnings("unchecked")
    private static ManifestDocument parseDocument(Map<String, Object> d) {
        return new ManifestDocument(
                stringOf(d.get("id")),
                validateDocumentPath((String) d.get("path")),
                (String) d.get("title"),
                (String) d.get("summary"),
                (String) d.getOrDefault("doc_type", "doc"),
                (String) d.getOrDefault("promotion", "standard"),
                parseDate(d.get("date")),
                (List<String>) d.getOrDefault("links", List.of()),
                (String) d.get("supersedes"),
                parseEmbedding((List<Object>) d.getOrDefault("embedding", List.of())),
                (String) d.get("content")
        );
    }

    private static List<Double> parseEmbedding(List<Object> values) {
        return values.stream().map(v -> {
            if (v instanceof Number n) return n.doubleValue();
            throw new IllegalArgumentException("Embedding values must be numbers, got '" + v + "'");
        }).toList();
    }

    private static String readContent(Path root, ManifestDocument doc) {
        Path file = root.resolve(doc.path());
        if (!Files.isRegularFile(file)) return null;
        try {
            return Files.readString(file);
        } catch (IOException e) {
            logger.warn("Cannot read content of '{}': {}", doc.path(), e.getMessage());
            return null;
        }
    }

    // YAML reads an unquoted 0.1 as a double and an unquoted 42 as an integer
    private static String stringOf(Object value) {
        return value == null ? null : value.toString();
    }

    private static LocalDate parseDate(Object value) {
        if (value == null) return null;
        if (value instanceof Date d) return d.toInstant().atZone(ZoneOffset.UTC).toLocalDate();
        return LocalDate.parse(value.toString());
    }
}
