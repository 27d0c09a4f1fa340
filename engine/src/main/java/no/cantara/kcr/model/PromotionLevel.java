package no.cantara.kcr.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * A document's declared importance tier, ordered from least to most important.
 */
public enum PromotionLevel {
    STANDARD("standard"),
    IMPORTANT("important"),
    CRITICAL("critical");

    private final String tag;

    PromotionLevel(String tag) {
        this.tag = tag;
    }

    /** The lowercase tag stored on indexed documents and used in vector-store filters. */
    public String tag() {
        return tag;
    }

    public boolean isAtLeast(PromotionLevel floor) {
        return compareTo(floor) >= 0;
    }

    /** This level and every level above it, lowest first. */
    public List<PromotionLevel> atOrAbove() {
        return Arrays.stream(values()).filter(l -> l.isAtLeast(this)).toList();
    }

    /**
     * Parses a stored promotion tag. Accepts the legacy aliases {@code promoted}
     * (important) and {@code pinned} (critical), case-insensitively.
     *
     * @return the level, or empty when the tag is missing or unrecognised
     */
    public static Optional<PromotionLevel> fromTag(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "standard"             -> Optional.of(STANDARD);
            case "important", "promoted" -> Optional.of(IMPORTANT);
            case "critical", "pinned"    -> Optional.of(CRITICAL);
            default                      -> Optional.empty();
        };
    }
}
