package nl.bytesoflife.coefficients.table;

import nl.bytesoflife.coefficients.CoefficientException;

/**
 * The coefficient dataset is malformed or violates a grid invariant. Raised while loading;
 * a table that fails to load must not be served.
 */
public class CoefficientTableException extends CoefficientException {

    public static final String CODE = "INVALID_TABLE";

    public CoefficientTableException(String message) {
        super(CODE, message);
    }

    public CoefficientTableException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
