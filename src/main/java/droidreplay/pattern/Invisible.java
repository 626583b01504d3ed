package droidreplay.pattern;

import droidreplay.device.DroidInput;
import droidreplay.model.View;
import droidreplay.model.ViewFinder;
import droidreplay.model.Views;
import droidreplay.select.AdaptiveSelector;

/**
 * A playee view present in the tree but not visible, assumed to show up
 * when its nearest visible, accessibility-important ancestor is tapped.
 * The event is not consumed: it is retried once the view shows.
 */
public class Invisible extends Pattern {

    private final View playeeView;
    private View visibleParent;

    public Invisible(PatternContext ctx, View playeeView) {
        super(ctx);
        this.playeeView = playeeView;
    }

    @Override
    public String getName() {
        return "invisible";
    }

    @Override
    protected boolean doMatch() {
        visibleParent = ViewFinder.findParent(playeeView,
                p -> Views.isImportantForA11y(p) && Views.isVisibleToUser(p, ctx.playee().device()));
        return visibleParent != null;
    }

    @Override
    protected boolean doApply(DroidInput input, AdaptiveSelector selector) {
        tapCorner(input, visibleParent);
        setDirty();
        return false;
    }

    public View getVisibleParent() {
        return visibleParent;
    }
}
