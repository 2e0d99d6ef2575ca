package nl.bytesoflife.coefficients;

/**
 * Base class for coefficient resolution failures. Each subclass carries a stable
 * code that the HTTP API reports next to the message.
 */
public abstract class CoefficientException extends RuntimeException {

    private final String code;

    protected CoefficientException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected CoefficientException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
