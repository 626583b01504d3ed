package droidreplay.device;

import droidreplay.ReplayException;

/**
 * Raised when the device transport fails to perform or report an action.
 */
public class DeviceException extends ReplayException {

    public DeviceException(String message) {
        super(message);
    }

    public DeviceException(String message, Throwable cause) {
        super(message, cause);
    }
}
