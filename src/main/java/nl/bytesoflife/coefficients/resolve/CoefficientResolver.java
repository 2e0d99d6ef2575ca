package nl.bytesoflife.coefficients.resolve;

import nl.bytesoflife.coefficients.table.CoefficientTable;
import nl.bytesoflife.coefficients.table.Grid;
import nl.bytesoflife.coefficients.table.SystemEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves a sash's coefficient from the loaded table. Deterministic and free of
 * mutable state once configured, so one instance can serve concurrent requests.
 *
 * <pre>
 * ResolutionResult result = new CoefficientResolver(CoefficientTables.bundled())
 *     .withLookupMode(LookupMode.CEILING)
 *     .resolve(new ResolutionRequest("uni1_zebra", "E", 1.2, 1.6));
 * </pre>
 *
 * Resolution order:
 * <ol>
 *   <li>reject non-positive or non-finite dimensions</li>
 *   <li>find the system (exact key, then ignoring case), else {@link UnknownSystemException}</li>
 *   <li>find the category (exact, then ignoring case), else ask the fallback policy</li>
 *   <li>clamp each dimension into the grid's measured range</li>
 *   <li>map the clamped point onto a coefficient with the lookup policy</li>
 * </ol>
 */
public class CoefficientResolver {

    private static final Logger log = LoggerFactory.getLogger(CoefficientResolver.class);

    private final CoefficientTable table;
    private GridLookupPolicy lookupPolicy = new CeilingLookupPolicy();
    private CategoryFallbackPolicy fallbackPolicy = new FirstAvailableCategoryPolicy();

    public CoefficientResolver(CoefficientTable table) {
        if (table == null) {
            throw new IllegalArgumentException("Coefficient table must not be null");
        }
        this.table = table;
    }

    public CoefficientResolver withLookupPolicy(GridLookupPolicy lookupPolicy) {
        if (lookupPolicy == null) {
            throw new IllegalArgumentException("Lookup policy must not be null");
        }
        this.lookupPolicy = lookupPolicy;
        return this;
    }

    public CoefficientResolver withLookupMode(LookupMode mode) {
        return withLookupPolicy(mode.createPolicy());
    }

    public CoefficientResolver withFallbackPolicy(CategoryFallbackPolicy fallbackPolicy) {
        if (fallbackPolicy == null) {
            throw new IllegalArgumentException("Fallback policy must not be null");
        }
        this.fallbackPolicy = fallbackPolicy;
        return this;
    }

    public CoefficientTable getTable() {
        return table;
    }

    public ResolutionResult resolve(ResolutionRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Resolution request must not be null");
        }
        requireDimension("width", request.width());
        requireDimension("height", request.height());

        SystemEntry system = table.findSystemIgnoreCase(request.systemKey())
                .orElseThrow(() -> new UnknownSystemException(request.systemKey()));

        List<String> warnings = new ArrayList<>();
        boolean fallback = false;
        Optional<String> matched = system.findCategoryIgnoreCase(request.category());
        String category;
        if (matched.isPresent()) {
            category = matched.get();
        } else {
            category = fallbackPolicy.selectFallback(system, request.category());
            fallback = true;
            log.warn("Category \"{}\" is not configured for system \"{}\"; falling back to \"{}\"",
                    request.category(), system.getSystemKey(), category);
            warnings.add("Category \"" + request.category() + "\" is not configured for system \""
                    + system.getSystemKey() + "\"; using category \"" + category + "\"");
        }
        Grid grid = system.grid(category)
                .orElseThrow(() -> new IllegalStateException("Fallback policy chose unknown category \""
                        + category + "\" for system \"" + system.getSystemKey() + "\""));

        double width = clamp("Width", request.width(), grid.minWidth(), grid.maxWidth(), warnings);
        double height = clamp("Height", request.height(), grid.minHeight(), grid.maxHeight(), warnings);

        double coefficient = lookupPolicy.lookup(grid, width, height);
        String warning = warnings.isEmpty() ? null : String.join("; ", warnings);
        if (warning != null) {
            log.debug("Resolved {}/{} at {}x{} with warning: {}", system.getSystemKey(), category,
                    request.width(), request.height(), warning);
        }
        return new ResolutionResult(coefficient, fallback, warning, system.getSystemKey(), category);
    }

    private static void requireDimension(String name, double value) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new InvalidDimensionsException(
                    "Sash " + name + " must be a positive finite number of meters, got " + value);
        }
    }

    private static double clamp(String axis, double value, double min, double max, List<String> warnings) {
        if (value < min) {
            warnings.add(outOfRange(axis, value, min, max, min));
            return min;
        }
        if (value > max) {
            warnings.add(outOfRange(axis, value, min, max, max));
            return max;
        }
        return value;
    }

    private static String outOfRange(String axis, double value, double min, double max, double used) {
        return String.format(Locale.ROOT,
                "%s %.3f m is outside the measured range %.3f-%.3f m; using %.3f m",
                axis, value, min, max, used);
    }
}
