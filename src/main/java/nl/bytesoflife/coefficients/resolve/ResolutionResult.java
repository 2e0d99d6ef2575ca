package nl.bytesoflife.coefficients.resolve;

/**
 * Outcome of a resolution. A fallback category or a clamped dimension is still a
 * success; {@code warning} then explains what was substituted.
 *
 * @param coefficient        the resolved coefficient
 * @param isFallbackCategory true when the requested category was not configured and another was used
 * @param warning            human-readable note, or null when the lookup was exact
 * @param systemKey          system key actually used
 * @param category           category actually used
 */
public record ResolutionResult(
        double coefficient,
        boolean isFallbackCategory,
        String warning,
        String systemKey,
        String category
) {

    public boolean hasWarning() {
        return warning != null;
    }
}
