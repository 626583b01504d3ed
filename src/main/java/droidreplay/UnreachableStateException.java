package droidreplay;

/**
 * Raised when an internal invariant fails: the segmentation rules reach no
 * decision, a separator has no neighbours, or a recorded view cannot be
 * found on its own UI.
 */
public class UnreachableStateException extends ReplayException {

    public UnreachableStateException(String message) {
        super(message);
    }

    public UnreachableStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
