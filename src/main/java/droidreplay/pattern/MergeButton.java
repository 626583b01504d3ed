package droidreplay.pattern;

import droidreplay.device.DroidInput;
import droidreplay.model.View;
import droidreplay.model.Views;
import droidreplay.segment.BottomUpFinder;
import droidreplay.select.AdaptiveSelector;

/**
 * Content the recordee shows inline while the playee hides it behind a
 * button. The button is searched outward from the playee segment and
 * tapped; the event is retried.
 */
public abstract class MergeButton extends BottomUpPattern {

    private View button;

    protected MergeButton(PatternContext ctx) {
        super(ctx);
    }

    @Override
    public PatternLevel getLevel() {
        return PatternLevel.MERGE;
    }

    protected abstract boolean isButton(View w);

    @Override
    protected boolean doMatch() {
        button = BottomUpFinder.findView(ctx.playee().segment(), w ->
                Views.isVisibleToUser(w, ctx.playee().device()) && w.getFlags().isClickable() && isButton(w));
        return button != null;
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
