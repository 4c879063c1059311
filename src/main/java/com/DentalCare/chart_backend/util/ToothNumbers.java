package com.DentalCare.chart_backend.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * FDI two-digit tooth notation for the permanent dentition.
 */
public class ToothNumbers {

    private ToothNumbers() {
        // Utility class, no instantiation
    }

    public static final int TEETH_PER_QUADRANT = 8;

    /**
     * Quadrants 1 (upper right) to 4 (lower right), positions 1 to 8.
     */
    public static final List<Integer> ALL_TEETH;

    static {
        List<Integer> teeth = new ArrayList<>(32);
        for (int quadrant = 1; quadrant <= 4; quadrant++) {
            for (int position = 1; position <= TEETH_PER_QUADRANT; position++) {
                teeth.add(quadrant * 10 + position);
            }
        }
        ALL_TEETH = Collections.unmodifiableList(teeth);
    }

    public static boolean isValid(Integer toothNumber) {
        if (toothNumber == null) {
            return false;
        }
        int quadrant = toothNumber / 10;
        int position = toothNumber % 10;
        return quadrant >= 1 && quadrant <= 4 && position >= 1 && position <= TEETH_PER_QUADRANT;
    }

    /**
     * Sorted, de-duplicated copy. Invalid numbers are kept so the caller can report them.
     */
    public static List<Integer> normalize(Collection<Integer> toothNumbers) {
        if (toothNumbers == null || toothNumbers.isEmpty()) {
            return new ArrayList<>();
        }
        Set<Integer> sorted = new TreeSet<>();
        for (Integer toothNumber : toothNumbers) {
            if (toothNumber != null) {
                sorted.add(toothNumber);
            }
        }
        return new ArrayList<>(sorted);
    }
}
