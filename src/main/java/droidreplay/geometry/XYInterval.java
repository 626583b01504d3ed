package droidreplay.geometry;

import java.util.Optional;

/**
 * Axis-aligned rectangle expressed as an x and a y {@link Interval}.
 */
public final class XYInterval {

    private final Interval x;
    private final Interval y;

    public XYInterval(Interval x, Interval y) {
        this.x = x;
        this.y = y;
    }

    /** Builds a rectangle from its edges. */
    public static XYInterval of(int left, int top, int right, int bottom) {
        return new XYInterval(new Interval(left, right), new Interval(top, bottom));
    }

    public Interval x() { return x; }
    public Interval y() { return y; }

    public int width()  { return x.length(); }
    public int height() { return y.length(); }
    public long area()  { return (long) x.length() * y.length(); }

    public XYInterval merge(XYInterval other) {
        return new XYInterval(x.merge(other.x), y.merge(other.y));
    }

    /** Strict overlap on both axes. */
    public boolean overlaps(XYInterval other) {
        return x.overlaps(other.x) && y.overlaps(other.y);
    }

    public Optional<XYInterval> overlap(XYInterval other) {
        Optional<Interval> ox = x.overlap(other.x);
        Optional<Interval> oy = y.overlap(other.y);
        if (ox.isEmpty() || oy.isEmpty()) return Optional.empty();
        return Optional.of(new XYInterval(ox.get(), oy.get()));
    }

    /** Inclusive point containment. */
    public boolean contains(int px, int py) {
        return x.contains(px) && y.contains(py);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof XYInterval)) return false;
        XYInterval that = (XYInterval) o;
        return x.equals(that.x) && y.equals(that.y);
    }

    @Override
    public int hashCode() {
        return 31 * x.hashCode() + y.hashCode();
    }

    @Override
    public String toString() {
        return "{x=" + x + ", y=" + y + "}";
    }
}
