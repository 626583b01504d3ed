package droidreplay;

/**
 * Raised when a caller breaks an API contract, e.g. applying a pattern that
 * was never matched or creating a segment without roots. Always fatal.
 */
public class ContractViolationException extends ReplayException {

    public ContractViolationException(String message) {
        super(message);
    }

    public ContractViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
