package droidreplay.pattern;

import droidreplay.model.DeviceInfo;
import droidreplay.model.EventQueue;
import droidreplay.model.ReplayEvent;
import droidreplay.model.Ui;
import droidreplay.model.View;
import droidreplay.segment.Segments;

import java.util.List;

/** Builds pattern contexts whose segments span each whole screen. */
final class PatternContexts {

    private PatternContexts() {}

    static PatternContext of(ReplayEvent event, View view,
                             Ui recordee, DeviceInfo recordeeDevice,
                             Ui playee, DeviceInfo playeeDevice) {
        return new PatternContext(event, view, new EventQueue(List.of()),
                new PatternContext.Side(Segments.create(List.of(recordee.getDecor())), recordee, recordeeDevice),
                new PatternContext.Side(Segments.create(List.of(playee.getDecor())), playee, playeeDevice));
    }
}
