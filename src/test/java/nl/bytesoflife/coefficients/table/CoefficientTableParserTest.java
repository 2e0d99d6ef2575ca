package nl.bytesoflife.coefficients.table;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CoefficientTableParserTest {

    private final CoefficientTableParser parser = new CoefficientTableParser();

    private CoefficientTable parseResource(String name) throws IOException {
        try (InputStream is = getClass().getResourceAsStream("/coefficients/" + name)) {
            assertNotNull(is, "missing fixture " + name);
            return parser.parse(is);
        }
    }

    @Test
    void parsesFlatLayout() throws IOException {
        CoefficientTable table = parseResource("simple.json");

        assertEquals(List.of("roller", "Zebra_Wide"), List.copyOf(table.systems()));
        assertEquals(List.of("A", "B"), List.copyOf(table.categories("roller")));

        Grid grid = table.lookupGrid("roller", "A").orElseThrow();
        assertEquals(3, grid.widthCount());
        assertEquals(2, grid.heightCount());
        assertEquals(20, grid.value(1, 0));
        assertEquals(31, grid.value(2, 1));
    }

    @Test
    void parsesProductsLayout() throws IOException {
        CoefficientTable table = parseResource("wrapped.json");

        assertEquals(List.of("roller"), List.copyOf(table.systems()));
        assertEquals(21, table.lookupGrid("roller", "A").orElseThrow().value(1, 1));
    }

    @Test
    void systemNamedProductsIsNotMistakenForWrapper() {
        CoefficientTable table = parser.parse(
                "{\"products\": {\"A\": {\"widths\": [1], \"heights\": [1], \"values\": [[2]]}}}");

        assertEquals(List.of("products"), List.copyOf(table.systems()));
        assertEquals(2, table.lookupGrid("products", "A").orElseThrow().value(0, 0));
    }

    @Test
    void rejectsNonMonotonicAxisWithPath() {
        CoefficientTableException e = assertThrows(CoefficientTableException.class,
                () -> parseResource("non-monotonic.json"));
        assertTrue(e.getMessage().startsWith("roller/A"), e.getMessage());
        assertEquals(CoefficientTableException.CODE, e.getCode());
    }

    @Test
    void rejectsDimensionMismatch() {
        CoefficientTableException e = assertThrows(CoefficientTableException.class, () -> parser.parse(
                "{\"s\": {\"c\": {\"widths\": [1, 2], \"heights\": [1], \"values\": [[1]]}}}"));
        assertTrue(e.getMessage().contains("s/c"), e.getMessage());
    }

    @Test
    void rejectsNonNumericValue() {
        CoefficientTableException e = assertThrows(CoefficientTableException.class, () -> parser.parse(
                "{\"s\": {\"c\": {\"widths\": [1], \"heights\": [1], \"values\": [[\"x\"]]}}}"));
        assertTrue(e.getMessage().contains("s/c/values[0][0]"), e.getMessage());
    }

    @Test
    void rejectsMissingAxis() {
        assertThrows(CoefficientTableException.class, () -> parser.parse(
                "{\"s\": {\"c\": {\"heights\": [1], \"values\": [[1]]}}}"));
    }

    @Test
    void rejectsSystemWithoutCategories() {
        assertThrows(CoefficientTableException.class, () -> parser.parse("{\"s\": {}}"));
    }

    @Test
    void rejectsMalformedJson() {
        CoefficientTableException e = assertThrows(CoefficientTableException.class,
                () -> parser.parse("{\"s\": "));
        assertInstanceOf(nl.bytesoflife.coefficients.parser.JsonParser.ParseException.class, e.getCause());
    }

    @Test
    void emptyDatasetIsAllowed() {
        CoefficientTable table = parser.parse("{}");
        assertTrue(table.isEmpty());
        assertEquals(0, table.size());
    }
}
