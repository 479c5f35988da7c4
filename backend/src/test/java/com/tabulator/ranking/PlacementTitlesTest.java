package com.tabulator.ranking;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class PlacementTitlesTest {

    @Test
    void firstPlaceGetsTitleholderLabel() {
        assertEquals("Mister Campus", PlacementTitles.titleFor(new BigDecimal("1.0"), "Mister Campus"));
    }

    @Test
    void laterPlacesAreRunnersUp() {
        assertEquals("1st Runner Up", PlacementTitles.titleFor(new BigDecimal("2.0"), "Winner"));
        assertEquals("2nd Runner Up", PlacementTitles.titleFor(new BigDecimal("3"), "Winner"));
        assertEquals("3rd Runner Up", PlacementTitles.titleFor(new BigDecimal("4.0"), "Winner"));
        assertEquals("4th Runner Up", PlacementTitles.titleFor(new BigDecimal("5.0"), "Winner"));
        assertEquals("11th Runner Up", PlacementTitles.titleFor(new BigDecimal("12.0"), "Winner"));
        assertEquals("21st Runner Up", PlacementTitles.titleFor(new BigDecimal("22.0"), "Winner"));
    }

    @Test
    void fractionalPlacementIsReportedAsTie() {
        assertEquals("Tied at 1.5", PlacementTitles.titleFor(new BigDecimal("1.5"), "Winner"));
    }

    @Test
    void missingPlacementHasNoTitle() {
        assertNull(PlacementTitles.titleFor(null, "Winner"));
    }
}
