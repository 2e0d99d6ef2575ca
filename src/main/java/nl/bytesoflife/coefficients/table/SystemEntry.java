package nl.bytesoflife.coefficients.table;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The grids of one product system, keyed by category name in document order.
 */
public final class SystemEntry {

    private final String systemKey;
    private final Map<String, Grid> grids;

    public SystemEntry(String systemKey, Map<String, Grid> grids) {
        if (systemKey == null || systemKey.isBlank()) {
            throw new IllegalArgumentException("System key must not be blank");
        }
        if (grids == null || grids.isEmpty()) {
            throw new IllegalArgumentException("System \"" + systemKey + "\" must have at least one category");
        }
        for (Map.Entry<String, Grid> entry : grids.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new IllegalArgumentException("System \"" + systemKey + "\" has a null category or grid");
            }
        }
        this.systemKey = systemKey;
        this.grids = Collections.unmodifiableMap(new LinkedHashMap<>(grids));
    }

    public String getSystemKey() {
        return systemKey;
    }

    public Set<String> categories() {
        return grids.keySet();
    }

    public Optional<Grid> grid(String category) {
        return Optional.ofNullable(grids.get(category));
    }

    /**
     * Finds the configured spelling of a category, ignoring case.
     */
    public Optional<String> findCategoryIgnoreCase(String category) {
        if (category == null) return Optional.empty();
        if (grids.containsKey(category)) return Optional.of(category);
        return grids.keySet().stream()
                .filter(name -> name.equalsIgnoreCase(category))
                .findFirst();
    }

    @Override
    public String toString() {
        return "SystemEntry{" + systemKey + ", categories=" + grids.keySet() + "}";
    }
}
