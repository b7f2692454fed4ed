package tech.syncbridge.transform.function;

/**
 * A function could not handle its input value.
 */
public class FunctionException extends RuntimeException {

    public FunctionException(String message) {
        super(message);
    }

    public FunctionException(String message, Throwable cause) {
        super(message, cause);
    }
}
