package droidreplay.geometry;

import droidreplay.ContractViolationException;

import java.util.Optional;

/**
 * Immutable closed 1-D interval {@code [low, high]} in screen pixels.
 *
 * <p>Overlap is strict: two intervals that merely touch at an endpoint do not
 * overlap, and a zero-width interval never overlaps anything. This is what
 * keeps adjacent views from colliding in drawing-level and separator
 * computations.
 */
public final class Interval {

    /** How one interval covers another, see {@link #cover(Interval)}. */
    public enum Cover { NONE, SAME_LOW, SAME_HIGH, IDENTICAL, STRICT }

    /** How one interval crosses another, see {@link #cross(Interval)}. */
    public enum Cross { NONE, LOW_INSIDE, HIGH_INSIDE }

    private final int low;
    private final int high;

    public Interval(int low, int high) {
        if (low > high) {
            throw new ContractViolationException(
                    "Interval low bound " + low + " is greater than high bound " + high);
        }
        this.low  = low;
        this.high = high;
    }

    public static Interval of(int low, int high) {
        return new Interval(low, high);
    }

    // ── Accessors ─────────────────────────────────────────────────────────

    public int low()    { return low; }
    public int high()   { return high; }
    public int length() { return high - low; }

    public boolean isEmpty() {
        return low == high;
    }

    // ── Operations ────────────────────────────────────────────────────────

    /** Smallest interval containing both this and {@code other}. */
    public Interval merge(Interval other) {
        return new Interval(Math.min(low, other.low), Math.max(high, other.high));
    }

    /** Returns the strictly overlapping part, or empty when the intervals only touch or are disjoint. */
    public Optional<Interval> overlap(Interval other) {
        int lo = Math.max(low, other.low);
        int hi = Math.min(high, other.high);
        return lo < hi ? Optional.of(new Interval(lo, hi)) : Optional.empty();
    }

    public boolean overlaps(Interval other) {
        return Math.max(low, other.low) < Math.min(high, other.high);
    }

    /** Inclusive point containment. */
    public boolean contains(int point) {
        return low <= point && point <= high;
    }

    /**
     * Classifies how this interval covers {@code other}.
     * <ul>
     *   <li>{@code IDENTICAL}: same bounds</li>
     *   <li>{@code STRICT}: other lies strictly inside</li>
     *   <li>{@code SAME_LOW}: same low bound, other ends earlier</li>
     *   <li>{@code SAME_HIGH}: same high bound, other starts later</li>
     * </ul>
     */
    public Cover cover(Interval other) {
        if (low == other.low && high == other.high) return Cover.IDENTICAL;
        if (low < other.low && other.high < high)   return Cover.STRICT;
        if (low == other.low && other.high < high)  return Cover.SAME_LOW;
        if (low < other.low && high == other.high)  return Cover.SAME_HIGH;
        return Cover.NONE;
    }

    /**
     * Classifies a partial overlap. {@code LOW_INSIDE} means this interval's
     * low bound lies strictly inside {@code other} while its high bound lies
     * beyond; {@code HIGH_INSIDE} is the mirror case.
     */
    public Cross cross(Interval other) {
        if (low > other.low && low < other.high && other.high < high)  return Cross.LOW_INSIDE;
        if (other.low > low && other.low < high && high < other.high)  return Cross.HIGH_INSIDE;
        return Cross.NONE;
    }

    // ── Object ────────────────────────────────────────────────────────────

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Interval)) return false;
        Interval that = (Interval) o;
        return low == that.low && high == that.high;
    }

    @Override
    public int hashCode() {
        return 31 * low + high;
    }

    @Override
    public String toString() {
        return "[" + low + ", " + high + "]";
    }
}
