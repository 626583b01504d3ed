package droidreplay.segment;

/**
 * No line divides the segment, yet some of its views were pooled below the
 * roots: the segment continues as {@link #getAfter()}, rooted on the pool.
 */
public final class ShrinkSeparator extends Separator {

    private final Segment after;

    public ShrinkSeparator(Segment after) {
        this.after = after;
    }

    public Segment getAfter() {
        return after;
    }
}
