package droidreplay.device;

import droidreplay.model.DeviceInfo;
import droidreplay.model.Ui;

/**
 * A connected playee device.
 */
public interface Droid {

    DeviceInfo getDeviceInfo();

    /** Dumps the view hierarchy of the top activity, prepared for searching. */
    Ui fetchTopUi();

    DroidInput getInput();
}
