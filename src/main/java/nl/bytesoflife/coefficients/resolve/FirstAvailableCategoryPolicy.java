package nl.bytesoflife.coefficients.resolve;

import nl.bytesoflife.coefficients.table.SystemEntry;

import java.util.Comparator;

/**
 * Falls back to the lexicographically first category of the system.
 */
public class FirstAvailableCategoryPolicy implements CategoryFallbackPolicy {

    @Override
    public String selectFallback(SystemEntry system, String requestedCategory) {
        return system.categories().stream()
                .min(Comparator.naturalOrder())
                .orElseThrow(() -> new IllegalStateException(
                        "System \"" + system.getSystemKey() + "\" has no categories"));
    }
}
