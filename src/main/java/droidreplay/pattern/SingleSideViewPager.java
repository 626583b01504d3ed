package droidreplay.pattern;

import droidreplay.UnsupportedCircumstanceException;
import droidreplay.device.DroidInput;
import droidreplay.model.View;
import droidreplay.model.ViewType;
import droidreplay.segment.BottomUpFinder;
import droidreplay.select.AdaptiveSelector;

/**
 * Only the playee puts the content in a view pager. Its pages are tapped in
 * turn until the recorded view can be selected; the event is retried.
 */
public class SingleSideViewPager extends BottomUpPattern {

    private View pager;

    public SingleSideViewPager(PatternContext ctx) {
        super(ctx);
    }

    @Override
    public String getName() {
        return "single-side-view-pager";
    }

    @Override
    public PatternLevel getLevel() {
        return PatternLevel.REVEAL;
    }

    @Override
    protected boolean doMatch() {
        pager = BottomUpFinder.findView(ctx.playee().segment(), w -> w.getType() == ViewType.VIEW_PAGER);
        if (pager == null) {
            return false;
        }
        View v = ctx.view();
        View onPlayee;
        if (!v.getText().isEmpty()) {
            onPlayee = ctx.playee().ui().findViewByText(v.getText());
        } else if (!v.getResEntry().isEmpty()) {
            onPlayee = ctx.playee().ui().findViewByResource(v.getResType(), v.getResEntry());
        } else if (!v.getDesc().isEmpty()) {
            onPlayee = ctx.playee().ui().findViewByDesc(v.getDesc());
        } else {
            onPlayee = null;
        }
        return onPlayee != null;
    }

    @Override
    protected boolean doApply(DroidInput input, AdaptiveSelector selector) {
        for (View page : pager.getChildren()) {
            tapCorner(input, page);
            setDirty();
            if (selector.select(ctx.view(), true).isPresent()) {
                return false;
            }
        }
        throw new UnsupportedCircumstanceException("No page contains the target view");
    }

    public View getPager() {
        return pager;
    }
}
