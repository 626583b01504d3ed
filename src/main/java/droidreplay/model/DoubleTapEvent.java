package droidreplay.model;

/**
 * A double-tap at a screen point.
 */
public class DoubleTapEvent extends XYEvent {

    public DoubleTapEvent() {}

    public DoubleTapEvent(Ui ui, int x, int y, long t) {
        super(ui, x, y, t);
    }

    @Override
    public String describe() {
        return "double-tap(" + getX() + ", " + getY() + ")";
    }
}
