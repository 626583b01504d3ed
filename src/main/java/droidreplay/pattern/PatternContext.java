package droidreplay.pattern;

import droidreplay.model.DeviceInfo;
import droidreplay.model.EventQueue;
import droidreplay.model.ReplayEvent;
import droidreplay.model.Ui;
import droidreplay.model.View;
import droidreplay.segment.Segment;

/**
 * What a pattern works on: the recorded event and view, the remaining
 * events, and for each device its segment, UI and description.
 *
 * @param event    the recorded event being translated
 * @param view     the recordee view the event targets
 * @param queue    events still to replay
 * @param recordee recordee side, its segment holds {@code view}
 * @param playee   playee side, its segment is matched with the recordee's
 */
public record PatternContext(ReplayEvent event, View view, EventQueue queue, Side recordee, Side playee) {

    /** One device's view of the circumstance. */
    public record Side(Segment segment, Ui ui, DeviceInfo device) {}
}
