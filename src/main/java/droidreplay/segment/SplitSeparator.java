package droidreplay.segment;

import droidreplay.geometry.Interval;

/**
 * Horizontal, vertical or elevated separator with its score and the two
 * segments it produces. For {@link Direction#E} the intervals span the whole
 * divided segment.
 */
public final class SplitSeparator extends Separator {

    private final double score;
    private final Direction direction;
    private final Interval xinv;
    private final Interval yinv;
    private final Segment first;
    private final Segment second;

    public SplitSeparator(double score, Direction direction, Interval xinv, Interval yinv,
                          Segment first, Segment second) {
        this.score     = score;
        this.direction = direction;
        this.xinv      = xinv;
        this.yinv      = yinv;
        this.first     = first;
        this.second    = second;
    }

    public double getScore()        { return score; }
    public Direction getDirection() { return direction; }
    public Interval getXinv()       { return xinv; }
    public Interval getYinv()       { return yinv; }
    /** Left side for V, top side for H, the shared drawing level for E. */
    public Segment getFirst()       { return first; }
    public Segment getSecond()      { return second; }

    @Override
    public String toString() {
        return direction + " " + score + " xxyy=[" + xinv.low() + ";" + xinv.high() + ";"
                + yinv.low() + ";" + yinv.high() + "]";
    }
}
