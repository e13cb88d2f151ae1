package co.codecraft.jresilience;

/**
 * Root of the errors that the protection primitives manufacture themselves. Errors raised by a protected
 * operation are never wrapped in one of these; they reach the caller unchanged.
 */
public class ResilienceException extends RuntimeException {

    private final String name;

    public ResilienceException(String name, String message) {
        super(message);
        this.name = name;
    }

    public ResilienceException(String name, String message, Throwable cause) {
        super(message, cause);
        this.name = name;
    }

    /**
     * @return the name of the breaker, bulkhead or recovery instance that raised this error.
     */
    public String getName() {
        return name;
    }
}
