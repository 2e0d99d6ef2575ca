package nl.bytesoflife.coefficients.table;

import java.util.Arrays;

/**
 * Measured coefficients for one (system, category) pair.
 * {@code value(i, j)} is the coefficient measured at {@code (width(i), height(j))}.
 * Both axes are strictly increasing breakpoints in meters.
 */
public final class Grid {

    private final double[] widths;
    private final double[] heights;
    private final double[][] values;

    public Grid(double[] widths, double[] heights, double[][] values) {
        if (widths == null || heights == null || values == null) {
            throw new IllegalArgumentException("Grid widths, heights and values must not be null");
        }
        requireStrictlyIncreasing("widths", widths);
        requireStrictlyIncreasing("heights", heights);
        if (values.length != widths.length) {
            throw new IllegalArgumentException("values has " + values.length
                    + " rows but there are " + widths.length + " widths");
        }
        double[][] copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            double[] row = values[i];
            if (row == null || row.length != heights.length) {
                throw new IllegalArgumentException("values row " + i + " has "
                        + (row == null ? 0 : row.length) + " entries but there are "
                        + heights.length + " heights");
            }
            for (int j = 0; j < row.length; j++) {
                if (!Double.isFinite(row[j])) {
                    throw new IllegalArgumentException("values[" + i + "][" + j + "] is not finite: " + row[j]);
                }
            }
            copy[i] = row.clone();
        }
        this.widths = widths.clone();
        this.heights = heights.clone();
        this.values = copy;
    }

    private static void requireStrictlyIncreasing(String axis, double[] points) {
        if (points.length == 0) {
            throw new IllegalArgumentException(axis + " must contain at least one breakpoint");
        }
        for (int i = 0; i < points.length; i++) {
            if (!Double.isFinite(points[i])) {
                throw new IllegalArgumentException(axis + "[" + i + "] is not finite: " + points[i]);
            }
            if (i > 0 && points[i] <= points[i - 1]) {
                throw new IllegalArgumentException(axis + " must be strictly increasing, but "
                        + axis + "[" + i + "]=" + points[i] + " follows " + points[i - 1]);
            }
        }
    }

    public int widthCount() {
        return widths.length;
    }

    public int heightCount() {
        return heights.length;
    }

    public double width(int index) {
        return widths[index];
    }

    public double height(int index) {
        return heights[index];
    }

    public double value(int widthIndex, int heightIndex) {
        return values[widthIndex][heightIndex];
    }

    public double minWidth() {
        return widths[0];
    }

    public double maxWidth() {
        return widths[widths.length - 1];
    }

    public double minHeight() {
        return heights[0];
    }

    public double maxHeight() {
        return heights[heights.length - 1];
    }

    public double[] getWidths() {
        return widths.clone();
    }

    public double[] getHeights() {
        return heights.clone();
    }

    public GridRanges ranges() {
        return new GridRanges(minWidth(), maxWidth(), minHeight(), maxHeight(),
                widths.length, heights.length);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Grid other)) return false;
        return Arrays.equals(widths, other.widths)
                && Arrays.equals(heights, other.heights)
                && Arrays.deepEquals(values, other.values);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(widths);
        result = 31 * result + Arrays.hashCode(heights);
        result = 31 * result + Arrays.deepHashCode(values);
        return result;
    }

    @Override
    public String toString() {
        return "Grid{widths=" + Arrays.toString(widths) + ", heights=" + Arrays.toString(heights) + "}";
    }
}
