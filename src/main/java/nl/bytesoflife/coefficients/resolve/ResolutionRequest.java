package nl.bytesoflife.coefficients.resolve;

import java.util.Locale;

/**
 * One coefficient lookup. Dimensions are in meters and are validated by the resolver,
 * not here, so that malformed requests can still be carried to it and rejected there.
 *
 * @param systemKey product system identifier
 * @param category  material category within the system
 * @param width     sash width in meters
 * @param height    sash height in meters
 */
public record ResolutionRequest(
        String systemKey,
        String category,
        double width,
        double height
) {

    /**
     * Cache key: {@code systemKey|category|width|height} with dimensions rounded to millimeters.
     */
    public String fingerprint() {
        return systemKey + "|" + category + "|"
                + String.format(Locale.ROOT, "%.3f", width) + "|"
                + String.format(Locale.ROOT, "%.3f", height);
    }
}
