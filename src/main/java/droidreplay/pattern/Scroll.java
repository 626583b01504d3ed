package droidreplay.pattern;

import droidreplay.UnsupportedCircumstanceException;
import droidreplay.device.DroidInput;
import droidreplay.model.View;
import droidreplay.model.ViewFinder;
import droidreplay.model.Views;
import droidreplay.segment.BottomUpFinder;
import droidreplay.segment.Segment;
import droidreplay.select.AdaptiveSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * The recorded view lives in a scrollable container whose playee
 * counterpart has it off-screen. The container is swiped until the view can
 * be selected, first in the preferred direction, then back the other way,
 * then once more in the preferred direction; each run has a bounded number
 * of swipes.
 */
public class Scroll extends BottomUpPattern {

    private static final Logger log = LoggerFactory.getLogger(Scroll.class);

    /** Initial direction, reversed direction, initial direction again. */
    private static final int MAX_RUNS = 3;

    private final long swipeDurationMs;
    private final int maxSwipesPerDirection;

    private View hScrollable;
    private View vScrollable;

    public Scroll(PatternContext ctx, long swipeDurationMs, int maxSwipesPerDirection) {
        super(ctx);
        this.swipeDurationMs       = swipeDurationMs;
        this.maxSwipesPerDirection = maxSwipesPerDirection;
    }

    @Override
    public String getName() {
        return "scroll";
    }

    @Override
    public PatternLevel getLevel() {
        return PatternLevel.EXPAND;
    }

    @Override
    protected boolean doMatch() {
        View h = ViewFinder.findHScrollableParent(ctx.view());
        View v = ViewFinder.findVScrollableParent(ctx.view());
        hScrollable = h == null ? null : findTarget(h);
        vScrollable = v == null ? null : findTarget(v);
        return hScrollable != null || vScrollable != null;
    }

    @Override
    protected boolean doApply(DroidInput input, AdaptiveSelector selector) {
        if (hScrollable != null && vScrollable != null) {
            throw new UnsupportedCircumstanceException("Both horizontally and vertically scrollable");
        }
        List<Swipe> directions = hScrollable != null ? horizontal(hScrollable) : vertical(vScrollable);
        Swipe preferred = directions.get(0);
        Swipe reversed  = directions.get(1);
        if (!preferred.possible() && !reversed.possible()) {
            throw new UnsupportedCircumstanceException("Container can not be scrolled in any direction");
        }

        // an exhausted run always switches direction, whatever the scroll flags said
        Swipe current = preferred.possible() ? preferred : reversed;
        for (int run = 0; run < MAX_RUNS; run++) {
            log.debug("Scrolling {} up to {} times to find {}", current.name(), maxSwipesPerDirection, ctx.view());
            for (int i = 0; i < maxSwipesPerDirection; i++) {
                input.swipe(current.x(), current.y(), current.dx(), current.dy(), swipeDurationMs);
                setDirty();
                if (selector.select(ctx.view(), true).isPresent()) {
                    return false;
                }
            }
            current = current == preferred ? reversed : preferred;
        }
        throw new UnsupportedCircumstanceException("No views found in the list");
    }

    // ── Accessors ─────────────────────────────────────────────────────────

    public View getHScrollable() { return hScrollable; }
    public View getVScrollable() { return vScrollable; }

    // ── Helpers ───────────────────────────────────────────────────────────

    /** Maps a recordee container to the playee by text, resource, then description. */
    private View findTarget(View recorded) {
        Segment seg = ctx.playee().segment();
        View found = null;
        if (!recorded.getText().isEmpty()) {
            found = BottomUpFinder.findViewByText(seg, recorded.getText());
        }
        if (found == null && !recorded.getResEntry().isEmpty()) {
            found = BottomUpFinder.findViewByResource(seg, recorded.getResType(), recorded.getResEntry());
        }
        if (found == null && !recorded.getDesc().isEmpty()) {
            found = BottomUpFinder.findViewByDesc(seg, recorded.getDesc());
        }
        return found;
    }

    private static List<Swipe> horizontal(View w) {
        int xc = Views.xCenter(w);
        int yc = Views.yCenter(w);
        List<Swipe> swipes = new ArrayList<>(2);
        swipes.add(new Swipe("right-to-left", Views.canR2LScroll(w), xc, yc, -xc, 0));
        swipes.add(new Swipe("left-to-right", Views.canL2RScroll(w), xc, yc, xc, 0));
        return swipes;
    }

    private static List<Swipe> vertical(View w) {
        int xc = Views.xCenter(w);
        int yc = Views.yCenter(w);
        List<Swipe> swipes = new ArrayList<>(2);
        swipes.add(new Swipe("bottom-to-top", Views.canB2TScroll(w), xc, yc, 0, -yc));
        swipes.add(new Swipe("top-to-bottom", Views.canT2BScroll(w), xc, yc, 0, yc));
        return swipes;
    }

    private record Swipe(String name, boolean possible, int x, int y, int dx, int dy) {}
}
