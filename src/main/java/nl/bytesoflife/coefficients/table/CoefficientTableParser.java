package nl.bytesoflife.coefficients.table;

import nl.bytesoflife.coefficients.parser.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a coefficient dataset document into a {@link CoefficientTable}.
 * Two layouts are accepted:
 * <pre>
 * { "uni1_zebra": { "E": { "widths": [...], "heights": [...], "values": [[...]] } } }
 * { "products": { "uni1_zebra": { "categories": { "E": { ... } } } } }
 * </pre>
 * {@code values[i][j]} is the coefficient at {@code (widths[i], heights[j])}.
 * Any structural problem or grid invariant violation fails the whole load.
 */
public class CoefficientTableParser {

    private static final Logger log = LoggerFactory.getLogger(CoefficientTableParser.class);

    private static final String PRODUCTS = "products";
    private static final String CATEGORIES = "categories";

    private final JsonParser jsonParser = new JsonParser();

    public CoefficientTable parse(String content) {
        Map<String, Object> root;
        try {
            root = jsonParser.parseObject(content);
        } catch (JsonParser.ParseException e) {
            throw new CoefficientTableException("Coefficient dataset is not valid JSON: " + e.getMessage(), e);
        }
        return buildTable(root);
    }

    public CoefficientTable parse(InputStream is) throws IOException {
        String content = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        return parse(content);
    }

    public CoefficientTable parse(Path path) throws IOException {
        return parse(Files.readString(path, StandardCharsets.UTF_8));
    }

    private CoefficientTable buildTable(Map<String, Object> root) {
        boolean wrapped = isWrappedLayout(root);
        Map<String, Object> systemsNode = wrapped ? asObject(root.get(PRODUCTS), PRODUCTS) : root;

        Map<String, SystemEntry> systems = new LinkedHashMap<>();
        int gridCount = 0;
        for (Map.Entry<String, Object> systemNode : systemsNode.entrySet()) {
            String systemKey = systemNode.getKey();
            Map<String, Object> categoriesNode = asObject(systemNode.getValue(), systemKey);
            if (wrapped) {
                categoriesNode = asObject(categoriesNode.get(CATEGORIES), systemKey + "/" + CATEGORIES);
            }

            Map<String, Grid> grids = new LinkedHashMap<>();
            for (Map.Entry<String, Object> categoryNode : categoriesNode.entrySet()) {
                String path = systemKey + "/" + categoryNode.getKey();
                grids.put(categoryNode.getKey(), buildGrid(asObject(categoryNode.getValue(), path), path));
            }
            try {
                systems.put(systemKey, new SystemEntry(systemKey, grids));
            } catch (IllegalArgumentException e) {
                throw new CoefficientTableException(e.getMessage(), e);
            }
            gridCount += grids.size();
        }

        if (systems.isEmpty()) {
            log.warn("Coefficient dataset contains no systems");
        }
        log.debug("Parsed coefficient dataset: {} systems, {} grids", systems.size(), gridCount);
        return new CoefficientTable(systems);
    }

    @SuppressWarnings("unchecked")
    private boolean isWrappedLayout(Map<String, Object> root) {
        if (root.size() != 1 || !(root.get(PRODUCTS) instanceof Map)) return false;
        Map<String, Object> products = (Map<String, Object>) root.get(PRODUCTS);
        return products.values().stream()
                .allMatch(v -> v instanceof Map && ((Map<String, Object>) v).containsKey(CATEGORIES));
    }

    private Grid buildGrid(Map<String, Object> node, String path) {
        double[] widths = toAxis(node.get("widths"), path + "/widths");
        double[] heights = toAxis(node.get("heights"), path + "/heights");
        Object valuesNode = node.get("values");
        if (!(valuesNode instanceof List<?> rows)) {
            throw new CoefficientTableException(path + "/values must be an array of arrays");
        }
        double[][] values = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            values[i] = toAxis(rows.get(i), path + "/values[" + i + "]");
        }
        try {
            return new Grid(widths, heights, values);
        } catch (IllegalArgumentException e) {
            throw new CoefficientTableException(path + ": " + e.getMessage(), e);
        }
    }

    private static double[] toAxis(Object node, String path) {
        if (!(node instanceof List<?> list)) {
            throw new CoefficientTableException(path + " must be an array of numbers");
        }
        double[] result = new double[list.size()];
        for (int i = 0; i < list.size(); i++) {
            if (!(list.get(i) instanceof Number n)) {
                throw new CoefficientTableException(path + "[" + i + "] is not a number: " + list.get(i));
            }
            result[i] = n.doubleValue();
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asObject(Object node, String path) {
        if (node instanceof Map) {
            return (Map<String, Object>) node;
        }
        throw new CoefficientTableException(path + " must be a JSON object");
    }
}
