package droidreplay.pattern;

import droidreplay.UnsupportedCircumstanceException;
import droidreplay.device.DroidInput;
import droidreplay.model.View;
import droidreplay.model.ViewFinder;
import droidreplay.model.ViewType;
import droidreplay.segment.SegmentFinder;
import droidreplay.select.AdaptiveSelector;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Both devices show the recorded view inside a view pager but on different
 * pages. The page of the playee pager holding the view is tapped to bring it
 * forward; the event is retried.
 */
public class DoubleSideViewPager extends BottomUpPattern {

    private View recordeePager;
    private View playeePager;

    public DoubleSideViewPager(PatternContext ctx) {
        super(ctx);
    }

    @Override
    public String getName() {
        return "double-side-view-pager";
    }

    @Override
    public PatternLevel getLevel() {
        return PatternLevel.REVEAL;
    }

    @Override
    protected boolean doMatch() {
        recordeePager = ViewFinder.findParent(ctx.view(), p -> p.getType() == ViewType.VIEW_PAGER);
        if (recordeePager == null) {
            return false;
        }
        List<View> pagers = new ArrayList<>();
        if (!recordeePager.getResId().isEmpty()) {
            pagers.addAll(SegmentFinder.findViews(ctx.playee().segment(), w -> w.getType() == ViewType.VIEW_PAGER));
        }
        if (pagers.isEmpty()) {
            for (View root : ctx.playee().segment().getRoots()) {
                View p = ViewFinder.findParent(root, w -> w.getType() == ViewType.VIEW_PAGER);
                if (p != null && !pagers.contains(p)) pagers.add(p);
            }
        }
        playeePager = pickPager(pagers);
        return playeePager != null;
    }

    @Override
    protected boolean doApply(DroidInput input, AdaptiveSelector selector) {
        View v = ctx.view();
        View found = null;
        if (!v.getText().isEmpty()) {
            found = findInPages(w -> w.getText().equals(v.getText()));
        }
        if (found == null && !v.getResEntry().isEmpty()) {
            found = findInPages(w -> w.getResType().equals(v.getResType()) && w.getResEntry().equals(v.getResEntry()));
        }
        if (found == null && !v.getDesc().isEmpty()) {
            found = findInPages(w -> w.getDesc().equals(v.getDesc()));
        }
        if (found == null) {
            throw new UnsupportedCircumstanceException("Page containing " + v + " is not found");
        }
        tapCorner(input, found);
        setDirty();
        return false;
    }

    public View getPlayeePager() {
        return playeePager;
    }

    /** First view matching {@code pred} on any page of the playee pager, pages in order. */
    private View findInPages(Predicate<View> pred) {
        for (View page : playeePager.getChildren()) {
            View found = ViewFinder.findView(page, pred);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    private View pickPager(List<View> pagers) {
        View r = recordeePager;
        for (View p : pagers) {
            if (!r.getText().isEmpty() && r.getText().equals(p.getText())) return p;
        }
        for (View p : pagers) {
            if (!r.getResId().isEmpty() && r.getResId().equals(p.getResId())) return p;
        }
        for (View p : pagers) {
            if (!r.getDesc().isEmpty() && r.getDesc().equals(p.getDesc())) return p;
        }
        return null;
    }
}
