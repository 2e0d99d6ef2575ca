package nl.bytesoflife.coefficients.resolve;

import nl.bytesoflife.coefficients.CoefficientException;

/**
 * The requested system key is not present in the coefficient table.
 * This is a configuration defect and is never answered with a fallback.
 */
public class UnknownSystemException extends CoefficientException {

    public static final String CODE = "UNKNOWN_SYSTEM";

    private final String systemKey;

    public UnknownSystemException(String systemKey) {
        super(CODE, "Unknown system \"" + systemKey + "\"");
        this.systemKey = systemKey;
    }

    public UnknownSystemException(String systemKey, String message) {
        super(CODE, message);
        this.systemKey = systemKey;
    }

    public String getSystemKey() {
        return systemKey;
    }
}
