package nl.bytesoflife.coefficients.resolve;

import nl.bytesoflife.coefficients.table.Grid;

/**
 * Costs a unit against the next-larger measured size: on each axis the smallest
 * breakpoint that is greater than or equal to the requested value.
 */
public class CeilingLookupPolicy implements GridLookupPolicy {

    /** Absorbs representation noise such as 1.2 arriving as 1.2000000000000002. */
    static final double EPSILON = 1e-9;

    @Override
    public double lookup(Grid grid, double width, double height) {
        int wi = ceilingIndex(grid.getWidths(), width);
        int hi = ceilingIndex(grid.getHeights(), height);
        return grid.value(wi, hi);
    }

    static int ceilingIndex(double[] axis, double value) {
        int low = 0;
        int high = axis.length - 1;
        if (value >= axis[high] - EPSILON) return high;
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (axis[mid] >= value - EPSILON) {
                high = mid;
            } else {
                low = mid + 1;
            }
        }
        return low;
    }
}
