package no.cantara.kcr.manifest.model;

import no.cantara.kcr.model.StoredDocument;

import java.time.LocalDate;
import java.util.List;

/**
 * One entry in the {@code documents} list of a corpus manifest.
 *
 * @param links      relative paths this document links to
 * @param supersedes path of the document this one replaces, or {@code null}
 * @param embedding  precomputed embedding; empty when the document is not searchable
 * @param content    inline content, or the file's content when loaded from disk
 */
public record ManifestDocument(
        String id,
        String path,
        String title,
        String summary,
        String docType,
        String promotion,
        LocalDate date,
        List<String> links,
        String supersedes,
        List<Double> embedding,
        String content
) {
    public ManifestDocument {
        links = links != null ? List.copyOf(links) : List.of();
        embedding = embedding != null ? List.copyOf(embedding) : List.of();
    }

    public ManifestDocument withContent(String newContent) {
        return new ManifestDocument(id, path, title, summary, docType, promotion, date,
                links, supersedes, embedding, newContent);
    }

    public float[] embeddingVector() {
        float[] vector = new float[embedding.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = embedding.get(i).floatValue();
        }
        return vector;
    }

    public StoredDocument toStored() {
        return new StoredDocument(id, path, title, summary, content, docType, promotion, date);
    }
}
