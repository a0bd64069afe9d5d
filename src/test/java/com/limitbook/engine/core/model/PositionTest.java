package com.limitbook.engine.core.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class PositionTest {

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual),
                () -> "expected " + expected + " but was " + actual);
    }

    @Test
    void openingFromFlatTakesFillPrice() {
        Position p = Position.flat("acc", "X").applyFill(2, new BigDecimal("100"));

        assertEquals(2, p.getQuantity());
        assertAmount("100", p.getAveragePrice());
        assertAmount("0", p.getRealizedPnl());
    }

    @Test
    void addingInSameDirectionUsesWeightedAverage() {
        Position p = Position.flat("acc", "X")
                .applyFill(2, new BigDecimal("100"))
                .applyFill(2, new BigDecimal("110"));

        assertEquals(4, p.getQuantity());
        assertAmount("105", p.getAveragePrice());
        assertAmount("0", p.getRealizedPnl());
    }

    @Test
    void flipFromLongToShortRealizesClosedPartAndResetsAverage() {
        Position p = Position.flat("acc", "X")
                .applyFill(2, new BigDecimal("100"))
                .applyFill(-3, new BigDecimal("110"));

        assertEquals(-1, p.getQuantity());
        assertAmount("20", p.getRealizedPnl());
        assertAmount("110", p.getAveragePrice());
    }

    @Test
    void partialCloseKeepsAverage() {
        Position p = Position.flat("acc", "X")
                .applyFill(10, new BigDecimal("50"))
                .applyFill(-4, new BigDecimal("45"));

        assertEquals(6, p.getQuantity());
        assertAmount("50", p.getAveragePrice());
        assertAmount("-20", p.getRealizedPnl());
    }

    @Test
    void shortCoveredBelowEntryIsProfit() {
        Position p = Position.flat("acc", "X")
                .applyFill(-5, new BigDecimal("200"))
                .applyFill(-5, new BigDecimal("220"));
        assertAmount("210", p.getAveragePrice());

        Position closed = p.applyFill(10, new BigDecimal("190"));
        assertTrue(closed.isFlat());
        assertAmount("200", closed.getRealizedPnl());
        assertAmount("0", closed.getAveragePrice());
    }

    @Test
    void flipFromShortToLong() {
        Position p = Position.flat("acc", "X")
                .applyFill(-3, new BigDecimal("10"))
                .applyFill(5, new BigDecimal("8"));

        assertEquals(2, p.getQuantity());
        assertAmount("6", p.getRealizedPnl());
        assertAmount("8", p.getAveragePrice());
    }

    @Test
    void unrealizedPnlIsSignedByQuantity() {
        Position longPos = Position.flat("acc", "X").applyFill(3, new BigDecimal("100"));
        Position shortPos = Position.flat("acc", "X").applyFill(-3, new BigDecimal("100"));

        assertAmount("30", longPos.unrealizedPnl(new BigDecimal("110")));
        assertAmount("-30", shortPos.unrealizedPnl(new BigDecimal("110")));
        assertAmount("0", Position.flat("acc", "X").unrealizedPnl(new BigDecimal("110")));
    }

    @Test
    void applyFillLeavesOriginalUntouched() {
        Position original = Position.flat("acc", "X").applyFill(1, new BigDecimal("10"));
        original.applyFill(5, new BigDecimal("20"));

        assertEquals(1, original.getQuantity());
        assertAmount("10", original.getAveragePrice());
    }
}
