package no.cantara.kcr.manifest;

import no.cantara.kcr.config.EngineConfig;
import no.cantara.kcr.config.RetrievalOptionsValidator;
import no.cantara.kcr.context.ContextEntry;
import no.cantara.kcr.context.KnowledgeRetrievalService;
import no.cantara.kcr.context.RagContext;
import no.cantara.kcr.manifest.model.CorpusManifest;
import no.cantara.kcr.model.RetrievalOptions;
import no.cantara.kcr.model.TenantScope;
import no.cantara.kcr.supersession.InMemorySupersessionRepository;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Offline validation of a corpus manifest, with an optional test query.
 * Usage: java -jar kcr-manifest.jar &lt;knowledge.yaml&gt; [--query 0.1,0.9,...] [--min-score 0.7] [--max-results 10]
 */
public class ManifestCli {

    static final String USAGE =
            "Usage: java -jar kcr-manifest.jar <knowledge.yaml> [--query v1,v2,...] [--min-score x] [--max-results n]";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 1) {
            err.println(USAGE);
            return 1;
        }

        Path path = Path.of(args[0]);
        float[] query = null;
        RetrievalOptions options = RetrievalOptions.defaults();
        try {
            for (int i = 1; i < args.length; i++) {
                switch (args[i]) {
                    case "--query" -> query = parseVector(value(args, ++i));
                    case "--min-score" -> options = options.withMinRelevanceScore(Double.parseDouble(value(args, ++i)));
                    case "--max-results" -> options = options.withMaxResults(Integer.parseInt(value(args, ++i)));
                    default -> throw new IllegalArgumentException("unknown option '" + args[i] + "'");
                }
            }
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            err.println(USAGE);
            return 1;
        }

        List<String> violations = RetrievalOptionsValidator.violations(options);
        if (!violations.isEmpty()) {
            violations.forEach(v -> err.println("Error: " + v));
            return 1;
        }

        if (!Files.exists(path)) {
            err.println("Error: file not found: " + path);
            return 1;
        }

        CorpusManifest manifest;
        try {
            manifest = ManifestParser.parse(path);
        } catch (Exception e) {
            err.println("Parse error: " + e.getMessage());
            return 1;
        }

        Path root = path.toAbsolutePath().getParent();
        ManifestValidator.ValidationResult result = ManifestValidator.validate(manifest, root);
        result.warnings().forEach(w -> err.println("  ⚠ " + w));
        if (!result.isValid()) {
            err.println("Validation failed, " + result.errors().size() + " error(s):");
            result.errors().forEach(e -> err.println("  • " + e));
            return 1;
        }

        TenantScope tenant = manifest.tenant(Integer.toHexString(root.toString().hashCode()));
        InMemoryCorpus corpus = InMemoryCorpus.of(manifest, tenant);
        try (KnowledgeRetrievalService service = KnowledgeRetrievalService.create(
                tenant, corpus, corpus, new InMemorySupersessionRepository(), EngineConfig.loadDefault())) {

            ManifestIndexer.IndexReport report = ManifestIndexer.index(manifest, service);
            report.linkCycles().forEach(c -> err.println("  ⚠ link cycle: " + c));
            report.supersessionWarnings().forEach(w -> err.println("  ⚠ " + w));
            report.chainIssues().forEach(i -> err.println("  ⚠ supersession " + i.type() + " at '"
                    + i.documentId() + "': " + i.detail()));

            out.printf("✓ %s is valid: project '%s' (%s), %d document(s), %d link(s)%n",
                    path,
                    manifest.project(),
                    manifest.branch(),
                    manifest.documents().size(),
                    service.linkGraph().edgeCount());

            if (query != null) {
                RagContext context = service.assemble(query, options);
                out.printf("%d match(es), %d entr(ies), %d character(s)%n",
                        context.totalMatches(), context.entries().size(), context.totalCharacters());
                for (ContextEntry entry : context.entries()) {
                    out.printf("  %-40s %s%n", entry.path(), entry.attribution());
                }
            }
        }
        return 0;
    }

    private static String value(String[] args, int i) {
        if (i >= args.length) {
            throw new IllegalArgumentException("missing value for '" + args[i - 1] + "'");
        }
        return args[i];
    }

    static float[] parseVector(String csv) {
        String[] parts = csv.split(",");
        float[] vector = new float[parts.length];
        for (int i = 0; i < parts.length; i++) {
            vector[i] = Float.parseFloat(parts[i].trim());
        }
        return vector;
    }
}
