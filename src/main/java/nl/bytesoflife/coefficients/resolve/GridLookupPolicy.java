package nl.bytesoflife.coefficients.resolve;

import nl.bytesoflife.coefficients.table.Grid;

/**
 * Maps a point inside a grid's measured range onto a coefficient.
 * Callers clamp the point to {@code [min, max]} on both axes first.
 */
public interface GridLookupPolicy {

    double lookup(Grid grid, double width, double height);
}
