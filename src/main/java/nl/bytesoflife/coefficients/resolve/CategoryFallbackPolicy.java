package nl.bytesoflife.coefficients.resolve;

import nl.bytesoflife.coefficients.table.SystemEntry;

/**
 * Chooses the category to use when the requested one is not configured for a system.
 */
public interface CategoryFallbackPolicy {

    /**
     * @param system            the system the request resolved to; has at least one category
     * @param requestedCategory the category that was not found, possibly null
     * @return a category name present in {@code system}
     */
    String selectFallback(SystemEntry system, String requestedCategory);
}
