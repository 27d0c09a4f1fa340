package no.cantara.kcr.context;

import no.cantara.kcr.model.PromotionLevel;
import no.cantara.kcr.model.RetrievedDocument;
import no.cantara.kcr.model.StoredDocument;
import no.cantara.kcr.model.SupersessionInfo;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RagContextTest {

    private static ContextEntry entry(String path, String content, SourceBucket bucket, double score,
                                      String linkedFrom, int depth) {
        StoredDocument stored = new StoredDocument(path, path, "T " + path, null, content, "doc", "standard", null);
        RetrievedDocument doc = RetrievedDocument.of(stored, PromotionLevel.STANDARD, score, score);
        return new ContextEntry(doc, bucket, score, linkedFrom, depth, SupersessionInfo.standalone(path));
    }

    @Test
    void snippetTruncatesWithEllipsis() {
        ContextEntry e = entry("a.md", "abcdefghij", SourceBucket.DIRECT, 0.9, null, 0);

        assertEquals("abcd...", e.snippet(4));
        assertEquals("abcdefghij", e.snippet(10));
    }

    @Test
    void attributionNamesTheSource() {
        assertEquals("critical", entry("c.md", "", SourceBucket.CRITICAL, 1.0, null, 0).attribution());
        assertEquals("direct match (score 0.850)", entry("d.md", "", SourceBucket.DIRECT, 0.85, null, 0).attribution());
        assertEquals("linked from d.md (depth 2)", entry("l.md", "", SourceBucket.LINKED, 0, "d.md", 2).attribution());
    }

    @Test
    void renderKeepsEntryOrderAndContent() {
        RagContext context = new RagContext(List.of(
                entry("a.md", "alpha", SourceBucket.DIRECT, 0.9, null, 0),
                entry("b.md", "beta", SourceBucket.LINKED, 0, "a.md", 1)), 1, 9);

        String rendered = context.render();

        assertTrue(rendered.indexOf("[a.md]") < rendered.indexOf("[b.md]"));
        assertTrue(rendered.contains("# T a.md\nalpha"));
        assertEquals(List.of("b.md"), context.bucket(SourceBucket.LINKED).stream().map(ContextEntry::path).toList());
    }
}
