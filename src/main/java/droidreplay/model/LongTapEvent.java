package droidreplay.model;

/**
 * A long-tap at a screen point.
 */
public class LongTapEvent extends XYEvent {

    public LongTapEvent() {}

    public LongTapEvent(Ui ui, int x, int y, long t) {
        super(ui, x, y, t);
    }

    @Override
    public String describe() {
        return "long-tap(" + getX() + ", " + getY() + ")";
    }
}
