package nl.bytesoflife.coefficients.resolve;

import nl.bytesoflife.coefficients.table.Grid;
import nl.bytesoflife.coefficients.table.SystemEntry;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FirstAvailableCategoryPolicyTest {

    private static final Grid GRID = new Grid(new double[]{1}, new double[]{1}, new double[][]{{1}});

    @Test
    void picksLexicographicallyFirstCategory() {
        Map<String, Grid> grids = new LinkedHashMap<>();
        grids.put("E", GRID);
        grids.put("3", GRID);
        grids.put("1", GRID);
        SystemEntry system = new SystemEntry("uni1_zebra", grids);

        assertEquals("1", new FirstAvailableCategoryPolicy().selectFallback(system, "XYZ"));
    }

    @Test
    void choiceIsIndependentOfRequestedCategory() {
        SystemEntry system = new SystemEntry("s", Map.of("B", GRID, "A", GRID));
        FirstAvailableCategoryPolicy policy = new FirstAvailableCategoryPolicy();

        assertEquals("A", policy.selectFallback(system, "Z"));
        assertEquals("A", policy.selectFallback(system, null));
    }
}
