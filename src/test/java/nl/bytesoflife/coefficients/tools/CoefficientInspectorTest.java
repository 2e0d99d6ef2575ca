package nl.bytesoflife.coefficients.tools;

import nl.bytesoflife.coefficients.table.CoefficientTables;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CoefficientInspectorTest {

    private final CoefficientInspector inspector = new CoefficientInspector(CoefficientTables.bundled());

    @Test
    void describesSystems() {
        String output = inspector.describeSystems();

        assertTrue(output.startsWith("Systems: 4\n"), output);
        assertTrue(output.contains("| 1 | uni1_zebra | 5          |"), output);
        assertTrue(output.contains("| 4 | mini_roll  | 5          |"), output);
    }

    @Test
    void describesOneSystem() {
        String output = inspector.describeSystem("mini_roll").orElseThrow();

        assertTrue(output.startsWith("System \"mini_roll\": 5 categories\n"), output);
        assertTrue(output.contains("| 0.300m - 1.400m | 0.500m - 2.000m | 10     | 8       |"), output);
    }

    @Test
    void systemKeyIsMatchedIgnoringCase() {
        String output = inspector.describeSystem("MINI_ROLL").orElseThrow();

        assertTrue(output.startsWith("System \"mini_roll\": 5 categories\n"), output);
    }

    @Test
    void unknownSystemHasNoDescription() {
        assertTrue(inspector.describeSystem("uni1zebra").isEmpty());
    }

    @Test
    void tableColumnsArePadded() {
        String table = CoefficientInspector.formatTable(new String[]{"#", "Name"},
                List.of(new String[]{"1", "a"}, new String[]{"10", "long"}));

        assertEquals("+----+------+\n"
                + "| #  | Name |\n"
                + "+----+------+\n"
                + "| 1  | a    |\n"
                + "| 10 | long |\n"
                + "+----+------+\n", table);
    }
}
