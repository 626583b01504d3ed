package droidreplay.model;

/**
 * A tap at a screen point.
 */
public class TapEvent extends XYEvent {

    public TapEvent() {}

    public TapEvent(Ui ui, int x, int y, long t) {
        super(ui, x, y, t);
    }

    @Override
    public String describe() {
        return "tap(" + getX() + ", " + getY() + ")";
    }
}
