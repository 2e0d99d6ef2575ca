package nl.bytesoflife.coefficients.table;

/**
 * Measured extent of a grid, in meters.
 *
 * @param widthMin     first width breakpoint
 * @param widthMax     last width breakpoint
 * @param heightMin    first height breakpoint
 * @param heightMax    last height breakpoint
 * @param widthPoints  number of width breakpoints
 * @param heightPoints number of height breakpoints
 */
public record GridRanges(
        double widthMin,
        double widthMax,
        double heightMin,
        double heightMax,
        int widthPoints,
        int heightPoints
) {
}
