package com.tabulator.ranking;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WeightedScoreCalculatorTest {

    private final WeightedScoreCalculator calculator = new WeightedScoreCalculator();

    @Test
    void maxRawScoreRoundsPercentageHalfUp() {
        assertEquals(new BigDecimal("35"), calculator.maxRawScore(new BigDecimal("0.35")));
        assertEquals(new BigDecimal("5"), calculator.maxRawScore(new BigDecimal("0.045")));
        assertEquals(new BigDecimal("100"), calculator.maxRawScore(BigDecimal.ONE));
    }

    @Test
    void weightedScoreIsRawRoundedToThreeDecimals() {
        assertEquals(new BigDecimal("27.500"), calculator.weighted(new BigDecimal("27.5"), new BigDecimal("0.30")));
        assertEquals(new BigDecimal("12.346"), calculator.weighted(new BigDecimal("12.3455"), new BigDecimal("0.30")));
    }

    @Test
    void boundaryValuesAreAccepted() {
        assertEquals(new BigDecimal("0.000"), calculator.weighted(BigDecimal.ZERO, new BigDecimal("0.05")));
        assertEquals(new BigDecimal("5.000"), calculator.weighted(new BigDecimal("5"), new BigDecimal("0.05")));
    }

    @Test
    void outOfRangeRawScoresAreRejected() {
        assertFalse(calculator.isWithinRange(new BigDecimal("-0.001"), new BigDecimal("0.30")));
        assertFalse(calculator.isWithinRange(new BigDecimal("30.001"), new BigDecimal("0.30")));
        assertFalse(calculator.isWithinRange(null, new BigDecimal("0.30")));
        assertTrue(calculator.isWithinRange(new BigDecimal("30"), new BigDecimal("0.30")));

        assertThrows(IllegalArgumentException.class,
                () -> calculator.weighted(new BigDecimal("31"), new BigDecimal("0.30")));
        assertThrows(IllegalArgumentException.class,
                () -> calculator.weighted(new BigDecimal("-1"), new BigDecimal("0.30")));
    }

    @Test
    void invalidPercentageIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> calculator.maxRawScore(BigDecimal.ZERO));
        assertThrows(IllegalArgumentException.class, () -> calculator.maxRawScore(new BigDecimal("1.01")));
    }

    @Test
    void totalSumsWeightedScores() {
        assertEquals(new BigDecimal("90.250"), calculator.total(List.of(
                new BigDecimal("27.500"),
                new BigDecimal("30.000"),
                new BigDecimal("27.750"),
                new BigDecimal("5.000")
        )));
        assertEquals(new BigDecimal("0.000"), calculator.total(List.of()));
    }
}
