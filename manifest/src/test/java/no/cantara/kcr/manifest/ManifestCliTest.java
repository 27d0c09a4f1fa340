package no.cantara.kcr.manifest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static no.cantara.kcr.manifest.ManifestParserTest.fixture;
import static org.junit.jupiter.api.Assertions.*;

class ManifestCliTest {

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(String... args) {
        return ManifestCli.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void validManifestPassesAndReportsLinkCycle() throws Exception {
        int code = run(fixture("knowledge.yaml").toString());

        assertEquals(0, code, stderr());
        assertTrue(stdout().contains("project 'payments' (main), 5 document(s), 3 link(s)"));
        assertTrue(stderr().contains("link cycle: [docs/errors.md, docs/retries.md]"));
    }

    @Test
    void queryPrintsAttributedEntries() throws Exception {
        int code = run(fixture("knowledge.yaml").toString(), "--query", "1,0", "--min-score", "0.5");

        assertEquals(0, code, stderr());
        String output = stdout();
        assertTrue(output.contains("docs/security.md"));
        assertTrue(output.contains("critical"));
        assertTrue(output.contains("direct match"));
        assertTrue(output.contains("linked from"));
    }

    @Test
    void invalidManifestExitsWithErrors() throws Exception {
        assertEquals(1, run(fixture("invalid.yaml").toString()));
        assertTrue(stderr().contains("Validation failed, 3 error(s)"));
    }

    @Test
    void missingFileIsReported(@TempDir Path dir) {
        assertEquals(1, run(dir.resolve("absent.yaml").toString()));
        assertTrue(stderr().contains("file not found"));
    }

    @Test
    void badArgumentsPrintUsage() throws Exception {
        assertEquals(1, run());
        assertEquals(1, run(fixture("knowledge.yaml").toString(), "--bogus"));
        assertEquals(1, run(fixture("knowledge.yaml").toString(), "--min-score"));
        assertEquals(1, run(fixture("knowledge.yaml").toString(), "--min-score", "1.5"));
        assertTrue(stderr().contains("Usage:"));
    }

    @Test
    void parsesQueryVector() {
        assertArrayEquals(new float[]{0.5f, -1f, 2f}, ManifestCli.parseVector("0.5, -1,2"));
    }
}
