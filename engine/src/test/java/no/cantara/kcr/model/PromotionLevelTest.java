package no.cantara.kcr.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PromotionLevelTest {

    @Test
    void parsesTagsAndAliasesCaseInsensitively() {
        assertEquals(Optional.of(PromotionLevel.CRITICAL), PromotionLevel.fromTag("Pinned"));
        assertEquals(Optional.of(PromotionLevel.IMPORTANT), PromotionLevel.fromTag(" promoted "));
        assertEquals(Optional.of(PromotionLevel.STANDARD), PromotionLevel.fromTag("STANDARD"));
    }

    @Test
    void unknownOrMissingTagsAreEmpty() {
        assertTrue(PromotionLevel.fromTag(null).isEmpty());
        assertTrue(PromotionLevel.fromTag("").isEmpty());
        assertTrue(PromotionLevel.fromTag("urgent").isEmpty());
    }

    @Test
    void levelsAreOrdered() {
        assertTrue(PromotionLevel.CRITICAL.isAtLeast(PromotionLevel.IMPORTANT));
        assertFalse(PromotionLevel.STANDARD.isAtLeast(PromotionLevel.IMPORTANT));
        assertEquals(List.of(PromotionLevel.IMPORTANT, PromotionLevel.CRITICAL), PromotionLevel.IMPORTANT.atOrAbove());
    }
}
