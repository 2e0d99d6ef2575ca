package nl.bytesoflife.coefficients.table;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GridTest {

    private static Grid threeByTwoGrid() {
        return new Grid(
                new double[]{1, 2, 3},
                new double[]{1, 2},
                new double[][]{{10, 11}, {20, 21}, {30, 31}});
    }

    @Test
    void valuesAreIndexedByWidthThenHeight() {
        Grid grid = threeByTwoGrid();
        assertEquals(3, grid.widthCount());
        assertEquals(2, grid.heightCount());
        assertEquals(21, grid.value(1, 1));
        assertEquals(30, grid.value(2, 0));
        assertEquals(2.0, grid.width(1));
        assertEquals(2.0, grid.height(1));
    }

    @Test
    void rangesReportBoundsAndPointCounts() {
        GridRanges ranges = threeByTwoGrid().ranges();
        assertEquals(new GridRanges(1, 3, 1, 2, 3, 2), ranges);
    }

    @Test
    void axesAreDefensivelyCopied() {
        double[] widths = {1, 2};
        double[][] values = {{5}, {6}};
        Grid grid = new Grid(widths, new double[]{1}, values);

        widths[0] = 99;
        values[0][0] = 99;
        grid.getWidths()[1] = 99;

        assertEquals(1.0, grid.minWidth());
        assertEquals(2.0, grid.maxWidth());
        assertEquals(5.0, grid.value(0, 0));
    }

    @Test
    void rejectsNonIncreasingAxis() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> new Grid(
                new double[]{1, 3, 2}, new double[]{1}, new double[][]{{1}, {2}, {3}}));
        assertTrue(e.getMessage().contains("strictly increasing"));

        assertThrows(IllegalArgumentException.class, () -> new Grid(
                new double[]{1, 1}, new double[]{1}, new double[][]{{1}, {2}}));
    }

    @Test
    void rejectsEmptyAxis() {
        assertThrows(IllegalArgumentException.class, () -> new Grid(
                new double[]{}, new double[]{1}, new double[][]{}));
    }

    @Test
    void rejectsShapeMismatch() {
        assertThrows(IllegalArgumentException.class, () -> new Grid(
                new double[]{1, 2}, new double[]{1, 2}, new double[][]{{1, 2}}));
        assertThrows(IllegalArgumentException.class, () -> new Grid(
                new double[]{1, 2}, new double[]{1, 2}, new double[][]{{1, 2}, {3}}));
    }

    @Test
    void rejectsNonFiniteValues() {
        assertThrows(IllegalArgumentException.class, () -> new Grid(
                new double[]{1}, new double[]{1}, new double[][]{{Double.NaN}}));
        assertThrows(IllegalArgumentException.class, () -> new Grid(
                new double[]{Double.POSITIVE_INFINITY}, new double[]{1}, new double[][]{{1}}));
    }

    @Test
    void equalGridsAreEqual() {
        assertEquals(threeByTwoGrid(), threeByTwoGrid());
        assertEquals(threeByTwoGrid().hashCode(), threeByTwoGrid().hashCode());
    }
}
