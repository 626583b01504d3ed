package droidreplay.pattern;

import droidreplay.device.DroidInput;
import droidreplay.model.View;
import droidreplay.model.ViewFinder;
import droidreplay.model.Views;
import droidreplay.segment.Segment;
import droidreplay.select.AdaptiveSelector;

/**
 * The recorded view sits behind a button that only the playee shows, such
 * as an overflow menu. Tapping the button reveals it; the event is retried.
 */
public abstract class RevealButton extends BottomUpPattern {

    private View button;

    protected RevealButton(PatternContext ctx) {
        super(ctx);
    }

    @Override
    public PatternLevel getLevel() {
        return PatternLevel.REVEAL;
    }

    /** Whether {@code w} is the revealing button, visibility and clickability aside. */
    protected abstract boolean isButton(View w);

    @Override
    protected boolean doMatch() {
        button = null;
        Segment seg = ctx.playee().segment();
        for (View root : seg.getRoots()) {
            button = ViewFinder.findView(root, w -> Views.isVisibleToUser(w, ctx.playee().device())
                    && w.getFlags().isClickable()
                    && isButton(w));
            if (button != null) {
                return true;
            }
        }
        return false;
    }

    @Override
    protected boolean doApply(DroidInput input, AdaptiveSelector selector) {
        tapCorner(input, button);
        setDirty();
        return false;
    }

    public View getButton() {
        return button;
    }
}
