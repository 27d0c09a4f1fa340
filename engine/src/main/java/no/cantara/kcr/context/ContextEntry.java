package no.cantara.kcr.context;

import no.cantara.kcr.model.RetrievedDocument;
import no.cantara.kcr.model.SupersessionInfo;

import java.util.Locale;
import java.util.Objects;

/**
 * One document in an assembled context, with its source attribution.
 *
 * @param finalScore   boosted score times supersession multiplier; for critical
 *                     entries without a match score, the multiplier alone; 0 for linked
 * @param linkedFrom   referring path for linked entries, otherwise {@code null}
 * @param linkDepth    link hops for linked entries, otherwise 0
 * @param supersession supersession state at assembly time
 */
public record ContextEntry(
        RetrievedDocument document,
        SourceBucket bucket,
        double finalScore,
        String linkedFrom,
        int linkDepth,
        SupersessionInfo supersession
) {
    public ContextEntry {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(bucket, "bucket");
        Objects.requireNonNull(supersession, "supersession");
    }

    public String path() {
        return document.path();
    }

    /** Leading {@code maxLength} characters of the content, with "..." when cut. */
    public String snippet(int maxLength) {
        String content = document.content();
        if (content.length() <= maxLength) return content;
        return content.substring(0, maxLength) + "...";
    }

    /** Human-readable origin, e.g. {@code linked from docs/a.md (depth 2)}. */
    public String attribution() {
        return switch (bucket) {
            case CRITICAL -> "critical";
            case DIRECT   -> String.format(Locale.ROOT, "direct match (score %.3f)", finalScore);
            case LINKED   -> "linked from " + linkedFrom + " (depth " + linkDepth + ")";
        };
    }
}
