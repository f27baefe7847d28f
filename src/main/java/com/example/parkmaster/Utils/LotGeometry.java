package com.example.parkmaster.Utils;

import com.example.parkmaster.Exceptions.InvalidDataException;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Physical dimensions of a parking lot, in metres. Rows stack along the Y axis
 * with an aisle between each pair of adjacent rows; columns run along X.
 * A merged aisle collapses to a near-zero gap so the two rows sit back to back.
 */
public final class LotGeometry {

    public static final double SPACE_WIDTH = 2.5;
    public static final double SPACE_DEPTH = 5.0;
    public static final double AISLE_WIDTH = 6.0;
    public static final double MERGED_AISLE_WIDTH = 0.1;

    private LotGeometry() {
    }

    /**
     * Width of the aisle between {@code row} and {@code row + 1}.
     *
     * @throws IllegalArgumentException if there is no aisle after {@code row}
     */
    public static double aisleWidthAfterRow(int row, int rows, Set<Integer> mergedAisles) {
        if (row < 0 || row >= rows - 1) {
            throw new IllegalArgumentException(
                    "No aisle after row " + row + " in a lot with " + rows + " rows");
        }
        return aisleWidth(row, mergedAisles);
    }

    public static double lotHeight(int rows, Set<Integer> mergedAisles) {
        double totalHeight = 0;
        for (int r = 0; r < rows; r++) {
            totalHeight += SPACE_DEPTH;
            if (r < rows - 1) {
                totalHeight += aisleWidth(r, mergedAisles);
            }
        }
        return totalHeight;
    }

    public static double rowYPosition(int row, Set<Integer> mergedAisles) {
        double y = 0;
        for (int r = 0; r < row; r++) {
            y += SPACE_DEPTH + aisleWidth(r, mergedAisles);
        }
        return y;
    }

    public static double spaceXPosition(int col) {
        return col * SPACE_WIDTH;
    }

    public static double lotWidth(int cols) {
        return cols * SPACE_WIDTH;
    }

    /**
     * Removes the aisle between two adjacent rows. The row numbers arrive as raw
     * user input. Returns a new set; {@code mergedAisles} itself is never modified.
     *
     * @throws InvalidDataException if either value is not a row of the lot or the
     *                              rows are not adjacent
     */
    public static Set<Integer> mergeRows(Set<Integer> mergedAisles, String row1, String row2, int rows) {
        int r1 = parseRow(row1);
        int r2 = parseRow(row2);

        if (r1 < 0 || r1 >= rows || r2 < 0 || r2 >= rows) {
            throw new InvalidDataException("Row numbers must be between 0 and " + (rows - 1) + ".");
        }
        if (Math.abs(r1 - r2) != 1) {
            throw new InvalidDataException("Rows must be adjacent to merge.");
        }

        Set<Integer> merged = new TreeSet<>(mergedAisles != null ? mergedAisles : Collections.emptySet());
        merged.add(Math.min(r1, r2));
        return merged;
    }

    /**
     * Keeps only the aisles that still exist in a lot with {@code rows} rows.
     */
    public static Set<Integer> retainExistingAisles(Set<Integer> mergedAisles, int rows) {
        if (mergedAisles == null) {
            return new TreeSet<>();
        }
        return mergedAisles.stream()
                .filter(aisle -> aisle != null && aisle >= 0 && aisle < rows - 1)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * @throws InvalidDataException if any index does not name an aisle of the lot
     */
    public static void validateMergedAisles(Set<Integer> mergedAisles, int rows) {
        if (mergedAisles == null) {
            return;
        }
        for (Integer aisle : mergedAisles) {
            if (aisle == null || aisle < 0 || aisle >= rows - 1) {
                throw new InvalidDataException("Merged aisle " + aisle + " does not exist in a lot with "
                        + rows + " rows. Aisle indices must be between 0 and " + (rows - 2) + ".");
            }
        }
    }

    private static double aisleWidth(int row, Set<Integer> mergedAisles) {
        return mergedAisles != null && mergedAisles.contains(row) ? MERGED_AISLE_WIDTH : AISLE_WIDTH;
    }

    private static int parseRow(String value) {
        if (value == null) {
            throw new InvalidDataException("Please enter valid row numbers.");
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidDataException("Please enter valid row numbers.");
        }
    }
}
