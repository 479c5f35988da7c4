package com.tabulator.ranking;

import java.math.BigDecimal;

/**
 * Pageant titles for overall placements: 1 is the titleholder, 2 the 1st runner-up, and so on.
 */
public final class PlacementTitles {

    private PlacementTitles() {
    }

    public static String titleFor(BigDecimal placement, String titleholder) {
        if (placement == null) {
            return null;
        }
        if (placement.stripTrailingZeros().scale() > 0) {
            return "Tied at " + placement.toPlainString();
        }
        int position = placement.intValueExact();
        if (position == 1) {
            return titleholder;
        }
        int runnerUp = position - 1;
        return runnerUp + ordinalSuffix(runnerUp) + " Runner Up";
    }

    static String ordinalSuffix(int value) {
        int lastTwo = value % 100;
        if (lastTwo >= 11 && lastTwo <= 13) {
            return "th";
        }
        return switch (value % 10) {
            case 1 -> "st";
            case 2 -> "nd";
            case 3 -> "rd";
            default -> "th";
        };
    }
}
