package nl.bytesoflife.coefficients.resolve;

import nl.bytesoflife.coefficients.CoefficientException;

/**
 * Width or height is not a positive finite number.
 */
public class InvalidDimensionsException extends CoefficientException {

    public static final String CODE = "INVALID_DIMENSIONS";

    public InvalidDimensionsException(String message) {
        super(CODE, message);
    }
}
