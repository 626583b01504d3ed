package droidreplay.device;

import droidreplay.ContractViolationException;
import droidreplay.model.DeviceInfo;
import droidreplay.model.DoubleTapEvent;
import droidreplay.model.LongTapEvent;
import droidreplay.model.SwipeEvent;
import droidreplay.model.TapEvent;
import droidreplay.model.View;
import droidreplay.model.Views;
import droidreplay.model.XYEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-fires a recorded XY event on a playee view.
 *
 * <p>Taps land one pixel inside the view's top-left corner, clamped to the
 * view. A swipe starts one pixel inside the edge it moves away from; its
 * displacement is scaled by the screen-size ratio of the two devices and
 * clamped so the gesture ends on screen. The recorded duration is kept.
 */
public class EventTranslator {

    private static final Logger log = LoggerFactory.getLogger(EventTranslator.class);

    private final DroidInput input;
    private final DeviceInfo fromDevice;
    private final DeviceInfo toDevice;

    public EventTranslator(DroidInput input, DeviceInfo fromDevice, DeviceInfo toDevice) {
        this.input      = input;
        this.fromDevice = fromDevice;
        this.toDevice   = toDevice;
    }

    /** Fires {@code event} on a playee view from the UI dump. */
    public void fire(XYEvent event, View target) {
        fire(event, Views.x0(target), Views.y0(target), Views.x1(target), Views.y1(target));
    }

    /** Fires {@code event} on a playee view reported by {@code select}. */
    public void fire(XYEvent event, ViewMap target) {
        ViewMap.Bounds b = target.getBounds();
        fire(event, b.getLeft(), b.getTop(), b.getRight(), b.getBottom());
    }

    /** Taps go to the centre of {@code target}; swipes behave as in {@link #fire(XYEvent, ViewMap)}. */
    public void fireAtCenter(XYEvent event, ViewMap target) {
        ViewMap.Bounds b = target.getBounds();
        if (event instanceof SwipeEvent) {
            fire(event, target);
            return;
        }
        tapLike(event, b.centerX(), b.centerY());
    }

    private void fire(XYEvent event, int left, int top, int right, int bottom) {
        if (event instanceof SwipeEvent) {
            swipe((SwipeEvent) event, left, top, right, bottom);
            return;
        }
        tapLike(event, Math.min(left + 1, right), Math.min(top + 1, bottom));
    }

    private void tapLike(XYEvent event, int x, int y) {
        if (event instanceof TapEvent) {
            input.tap(x, y);
        } else if (event instanceof DoubleTapEvent) {
            input.doubleTap(x, y);
        } else if (event instanceof LongTapEvent) {
            input.longTap(x, y);
        } else {
            throw new ContractViolationException("Not a tap-like event: " + event.describe());
        }
        log.debug("Fired {} at ({}, {})", event.describe(), x, y);
    }

    private void swipe(SwipeEvent e, int left, int top, int right, int bottom) {
        int fromX = e.getDx() >= 0 ? left + 1 : right - 1;
        int fromY = e.getDy() >= 0 ? top + 1 : bottom - 1;
        int dx = (int) Math.round((double) e.getDx() / fromDevice.getWidth() * toDevice.getWidth());
        int dy = (int) Math.round((double) e.getDy() / fromDevice.getHeight() * toDevice.getHeight());

        if (fromY + dy <= 0) {
            dy = -fromY + 1;
        } else if (fromY + dy >= toDevice.getHeight()) {
            dy = toDevice.getHeight() - 1 - fromY;
        }
        if (fromX + dx <= 0) {
            dx = -fromX + 1;
        } else if (fromX + dx >= toDevice.getWidth()) {
            dx = toDevice.getWidth() - 1 - fromX;
        }
        input.swipe(fromX, fromY, dx, dy, e.getDuration());
        log.debug("Fired {} as swipe from ({}, {}) by ({}, {})", e.describe(), fromX, fromY, dx, dy);
    }
}
