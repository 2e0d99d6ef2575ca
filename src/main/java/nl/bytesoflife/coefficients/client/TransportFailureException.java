package nl.bytesoflife.coefficients.client;

import nl.bytesoflife.coefficients.CoefficientException;

/**
 * A resolution call failed in transit: connection error, unexpected HTTP status or an
 * unreadable response. Not retried automatically.
 */
public class TransportFailureException extends CoefficientException {

    public static final String CODE = "TRANSPORT_FAILURE";

    public TransportFailureException(String message) {
        super(CODE, message);
    }

    public TransportFailureException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
