package droidreplay;

/**
 * Raised when the current event hits a situation the translator does not
 * handle (both scroll axes available, no tab host, exhausted scroll budget).
 *
 * <p>Only the current event is affected; the player decides whether to skip
 * it or stop the run.
 */
public class UnsupportedCircumstanceException extends ReplayException {

    public UnsupportedCircumstanceException(String message) {
        super(message);
    }

    public UnsupportedCircumstanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
