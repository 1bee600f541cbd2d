package theory.provider;

/**
 * Raised when a data directive cannot be resolved or its rows cannot be read.
 */
public class DataDiscoveryException extends RuntimeException {

    public DataDiscoveryException(String message) {
        super(message);
    }

    public DataDiscoveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
