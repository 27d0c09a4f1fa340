package no.cantara.kcr.context;

import java.util.List;

/**
 * The assembled context bundle handed to an external generation step.
 *
 * @param entries         ordered: critical, then direct by score, then linked by depth
 * @param totalMatches    direct matches above the relevance threshold, before truncation
 * @param totalCharacters sum of {@code charCount} over all entries
 */
public record RagContext(List<ContextEntry> entries, int totalMatches, long totalCharacters) {

    public RagContext {
        entries = entries != null ? List.copyOf(entries) : List.of();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<ContextEntry> bucket(SourceBucket bucket) {
        return entries.stream().filter(e -> e.bucket() == bucket).toList();
    }

    public List<String> paths() {
        return entries.stream().map(ContextEntry::path).toList();
    }

    /** Plain-text rendering: one block per entry, headed by path and attribution. */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (ContextEntry e : entries) {
            sb.append("--- [").append(e.path()).append("] ").append(e.attribution());
            if (e.supersession().isSuperseded()) {
                sb.append(", superseded by ").append(e.supersession().currentVersionId());
            }
            sb.append(" ---\n");
            if (e.document().title() != null) {
                sb.append("# ").append(e.document().title()).append('\n');
            }
            sb.append(e.document().content()).append("\n\n");
        }
        return sb.toString();
    }
}
