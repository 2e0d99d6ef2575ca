package nl.bytesoflife.coefficients.resolve;

import nl.bytesoflife.coefficients.table.Grid;

/**
 * Interpolates between the four grid points bracketing the requested size.
 * On a single-breakpoint axis, or exactly on a breakpoint, it degrades to linear
 * interpolation along the other axis.
 */
public class BilinearLookupPolicy implements GridLookupPolicy {

    @Override
    public double lookup(Grid grid, double width, double height) {
        double[] widths = grid.getWidths();
        double[] heights = grid.getHeights();
        int w1 = lowerIndex(widths, width);
        int w2 = Math.min(w1 + 1, widths.length - 1);
        int h1 = lowerIndex(heights, height);
        int h2 = Math.min(h1 + 1, heights.length - 1);

        double q11 = grid.value(w1, h1);
        double q12 = grid.value(w1, h2);
        double q21 = grid.value(w2, h1);
        double q22 = grid.value(w2, h2);

        double tw = fraction(widths[w1], widths[w2], width);
        double th = fraction(heights[h1], heights[h2], height);

        double atH1 = q11 + tw * (q21 - q11);
        double atH2 = q12 + tw * (q22 - q12);
        return atH1 + th * (atH2 - atH1);
    }

    /**
     * Index of the last breakpoint that is less than or equal to {@code value}.
     */
    static int lowerIndex(double[] axis, double value) {
        int low = 0;
        int high = axis.length - 1;
        if (value >= axis[high]) return high;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (axis[mid] <= value) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low;
    }

    private static double fraction(double lower, double upper, double value) {
        if (upper == lower) return 0.0;
        return (value - lower) / (upper - lower);
    }
}
