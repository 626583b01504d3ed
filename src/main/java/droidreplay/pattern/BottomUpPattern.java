package droidreplay.pattern;

/** Pattern of the recognizer catalog, working on a matched pair of segments. */
public abstract class BottomUpPattern extends Pattern {

    protected BottomUpPattern(PatternContext ctx) {
        super(ctx);
    }

    public abstract PatternLevel getLevel();
}
