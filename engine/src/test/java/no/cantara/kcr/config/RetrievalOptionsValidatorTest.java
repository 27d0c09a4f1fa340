package no.cantara.kcr.config;

import no.cantara.kcr.error.InvalidOptionsException;
import no.cantara.kcr.model.RetrievalOptions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RetrievalOptionsValidatorTest {

    @Test
    void defaultsAreValid() {
        assertTrue(RetrievalOptionsValidator.violations(RetrievalOptions.defaults()).isEmpty());
    }

    @Test
    void boundaryValuesAreAccepted() {
        RetrievalOptions edge = RetrievalOptions.defaults()
                .withMinRelevanceScore(0.0)
                .withMaxResults(1)
                .withLinkLimits(0, 0);
        assertSame(edge, RetrievalOptionsValidator.requireValid(edge));
        assertTrue(RetrievalOptionsValidator.violations(edge.withMinRelevanceScore(1.0)).isEmpty());
    }

    @Test
    void everyViolationIsListed() {
        RetrievalOptions bad = RetrievalOptions.defaults()
                .withMinRelevanceScore(-0.1)
                .withMaxResults(0)
                .withLinkLimits(-1, -1)
                .withMinPromotionLevel(null)
                .withDocTypes(Arrays.asList("adr", " "));

        InvalidOptionsException e = assertThrows(InvalidOptionsException.class,
                () -> RetrievalOptionsValidator.requireValid(bad));
        assertEquals(6, e.violations().size());
    }

    @Test
    void nanThresholdIsRejected() {
        assertEquals(1, RetrievalOptionsValidator.violations(
                RetrievalOptions.defaults().withMinRelevanceScore(Double.NaN)).size());
    }

    @Test
    void nullOptionsAreRejected() {
        assertEquals(List.of("options are required"), RetrievalOptionsValidator.violations(null));
    }
}
