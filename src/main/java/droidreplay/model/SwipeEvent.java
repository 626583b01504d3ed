package droidreplay.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A swipe starting at {@code (x, y)} moving by {@code (dx, dy)}, from time
 * {@code t} to {@code t1}.
 */
public class SwipeEvent extends XYEvent {

    @JsonProperty("dx") private int dx;
    @JsonProperty("dy") private int dy;
    @JsonProperty("t1") private long t1;

    public SwipeEvent() {}

    public SwipeEvent(Ui ui, int x, int y, int dx, int dy, long t0, long t1) {
        super(ui, x, y, t0);
        this.dx = dx;
        this.dy = dy;
        this.t1 = t1;
    }

    public int getDx()  { return dx; }
    public int getDy()  { return dy; }
    public long getT0() { return getT(); }
    public long getT1() { return t1; }

    public long getDuration() {
        return t1 - getT();
    }

    @Override
    public String describe() {
        return "swipe(" + getX() + ", " + getY() + ", dx=" + dx + ", dy=" + dy + ", " + getDuration() + "ms)";
    }
}
