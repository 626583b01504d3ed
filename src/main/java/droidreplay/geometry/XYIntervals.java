package droidreplay.geometry;

/**
 * Pair of {@link Intervals}, one per axis, with subtraction applied to both
 * projections independently.
 */
public class XYIntervals {

    private final Intervals xs;
    private final Intervals ys;

    public XYIntervals(XYInterval initial) {
        this.xs = new Intervals(initial.x());
        this.ys = new Intervals(initial.y());
    }

    /** Removes the x projection of {@code removed} from the x set and its y projection from the y set. */
    public void remove(XYInterval removed) {
        xs.remove(removed.x());
        ys.remove(removed.y());
    }

    public Intervals xs() { return xs; }
    public Intervals ys() { return ys; }

    @Override
    public String toString() {
        return "{xs=" + xs + ", ys=" + ys + "}";
    }
}
