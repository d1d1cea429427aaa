package dk.trustworks.templatefiller.exceptions;

/**
 * Thrown when storage could not be written to or probed after a successful fill.
 */
public class StoreFailureException extends TemplateFillException {

    public StoreFailureException(String message, Throwable cause) {
        super(502, message, cause);
    }
}
