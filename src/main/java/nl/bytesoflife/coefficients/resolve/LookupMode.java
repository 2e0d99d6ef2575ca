package nl.bytesoflife.coefficients.resolve;

import java.util.Locale;

/**
 * Configurable choice of {@link GridLookupPolicy}.
 */
public enum LookupMode {
    CEILING,
    BILINEAR;

    public GridLookupPolicy createPolicy() {
        return switch (this) {
            case CEILING -> new CeilingLookupPolicy();
            case BILINEAR -> new BilinearLookupPolicy();
        };
    }

    public static LookupMode fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Lookup mode must not be null");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "ceiling", "bucket", "bucketing" -> CEILING;
            case "bilinear", "interpolate", "interpolation" -> BILINEAR;
            default -> throw new IllegalArgumentException("Unknown lookup mode: " + name);
        };
    }
}
