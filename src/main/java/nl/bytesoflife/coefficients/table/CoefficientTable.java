package nl.bytesoflife.coefficients.table;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only store of coefficient grids, keyed by system key and then by category.
 * Instances are built once by {@link CoefficientTableParser} and never mutated;
 * changing the data means loading a new table.
 */
public final class CoefficientTable {

    private final Map<String, SystemEntry> systems;

    public CoefficientTable(Map<String, SystemEntry> systems) {
        if (systems == null) {
            throw new IllegalArgumentException("Systems must not be null");
        }
        for (Map.Entry<String, SystemEntry> entry : systems.entrySet()) {
            if (entry.getValue() == null || !entry.getValue().getSystemKey().equals(entry.getKey())) {
                throw new IllegalArgumentException("System entry does not match key \"" + entry.getKey() + "\"");
            }
        }
        this.systems = Collections.unmodifiableMap(new LinkedHashMap<>(systems));
    }

    /**
     * All known system keys, in document order.
     */
    public Set<String> systems() {
        return systems.keySet();
    }

    public Optional<Grid> lookupGrid(String systemKey, String category) {
        return findSystem(systemKey).flatMap(entry -> entry.grid(category));
    }

    public Optional<SystemEntry> findSystem(String systemKey) {
        if (systemKey == null) return Optional.empty();
        return Optional.ofNullable(systems.get(systemKey));
    }

    /**
     * Finds a system by exact key, then by a case-insensitive match.
     */
    public Optional<SystemEntry> findSystemIgnoreCase(String systemKey) {
        if (systemKey == null) return Optional.empty();
        SystemEntry exact = systems.get(systemKey);
        if (exact != null) return Optional.of(exact);
        return systems.values().stream()
                .filter(entry -> entry.getSystemKey().equalsIgnoreCase(systemKey))
                .findFirst();
    }

    /**
     * Categories of a system, matched the way the resolver matches it (exact key, then
     * ignoring case), or an empty set when the system is unknown.
     */
    public Set<String> categories(String systemKey) {
        return findSystemIgnoreCase(systemKey).map(SystemEntry::categories).orElse(Set.of());
    }

    /**
     * Measured range of a grid, with system and category matched ignoring case.
     */
    public Optional<GridRanges> ranges(String systemKey, String category) {
        return findSystemIgnoreCase(systemKey)
                .flatMap(entry -> entry.findCategoryIgnoreCase(category).flatMap(entry::grid))
                .map(Grid::ranges);
    }

    public int size() {
        return systems.size();
    }

    public boolean isEmpty() {
        return systems.isEmpty();
    }

    @Override
    public String toString() {
        return "CoefficientTable{systems=" + systems.keySet() + "}";
    }
}
