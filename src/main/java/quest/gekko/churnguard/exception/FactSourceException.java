package quest.gekko.churnguard.exception;

/**
 * The upstream warehouse could not be queried, after retries.
 */
public class FactSourceException extends RuntimeException {
    public FactSourceException(String message) {
        super(message);
    }

    public FactSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
