package nl.bytesoflife.coefficients.table;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Entry points for loading a coefficient table, including the dataset bundled on the classpath.
 */
public class CoefficientTables {

    private static final Logger log = LoggerFactory.getLogger(CoefficientTables.class);

    public static final String BUNDLED_RESOURCE = "/coefficients/coefficients.json";

    private static volatile CoefficientTable cachedBundled;

    private CoefficientTables() {
    }

    /**
     * The bundled dataset, loaded on first use.
     */
    public static CoefficientTable bundled() {
        if (cachedBundled == null) {
            synchronized (CoefficientTables.class) {
                if (cachedBundled == null) {
                    cachedBundled = loadResource(BUNDLED_RESOURCE);
                }
            }
        }
        return cachedBundled;
    }

    public static CoefficientTable loadResource(String resource) {
        try (InputStream is = CoefficientTables.class.getResourceAsStream(resource)) {
            if (is == null) throw new IllegalStateException("Resource not found: " + resource);
            CoefficientTable table = new CoefficientTableParser().parse(is);
            log.info("Loaded coefficient table from {}: {} systems", resource, table.size());
            return table;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read coefficient resource " + resource, e);
        }
    }

    public static CoefficientTable load(Path path) throws IOException {
        CoefficientTable table = new CoefficientTableParser().parse(path);
        log.info("Loaded coefficient table from {}: {} systems", path, table.size());
        return table;
    }
}
