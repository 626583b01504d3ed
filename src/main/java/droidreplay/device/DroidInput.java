package droidreplay.device;

import droidreplay.model.KeyEvent;

import java.util.List;

/**
 * Input side of the on-device automation transport. Calls block until the
 * device acknowledges the action. Transport failures surface as
 * {@link DeviceException}.
 */
public interface DroidInput {

    void tap(int x, int y);

    void longTap(int x, int y);

    void doubleTap(int x, int y);

    void swipe(int x, int y, int dx, int dy, long durationMs);

    void key(int code);

    void text(String text);

    /** Views on the current screen matching every filter of {@code options}. */
    List<ViewMap> select(SelectOptions options);

    default void pressBack() {
        key(KeyEvent.KEYCODE_BACK);
    }
}
