package droidreplay.pattern;

import droidreplay.UnreachableStateException;
import droidreplay.device.DroidInput;
import droidreplay.device.ViewMap;
import droidreplay.model.ReplayEvent;
import droidreplay.model.View;
import droidreplay.model.XYEvent;
import droidreplay.select.AdaptiveSelector;

import java.util.List;
import java.util.Optional;

/**
 * Skips the current event when one of the next {@code k} events can already
 * be fired on the playee. Several recorded taps sometimes lead to a state the
 * playee reaches in fewer steps.
 *
 * <p>Only views without text are skipped, and only over a run of XY events.
 * Applying drops the events before the fireable one and consumes the
 * current event.
 */
public class Lookahead extends Pattern {

    private final int k;
    private final AdaptiveSelector selector;
    private int popCount = -1;

    public Lookahead(PatternContext ctx, int k, AdaptiveSelector selector) {
        super(ctx);
        this.k        = k;
        this.selector = selector;
    }

    @Override
    public String getName() {
        return "lookahead:" + k;
    }

    @Override
    protected boolean doMatch() {
        popCount = findFireable();
        return popCount >= 0;
    }

    @Override
    protected boolean doApply(DroidInput input, AdaptiveSelector selector) {
        ctx.queue().popN(popCount);
        return true;
    }

    /** Number of events to drop before the first fireable one, or -1. */
    public int getPopCount() {
        return popCount;
    }

    private int findFireable() {
        if (!ctx.view().getText().isEmpty() || ctx.queue().isEmpty()) {
            return -1;
        }
        List<ReplayEvent> next = ctx.queue().topN(k);
        for (int i = 0; i < next.size(); i++) {
            if (!(next.get(i) instanceof XYEvent)) {
                return -1;
            }
            XYEvent ne = (XYEvent) next.get(i);
            View nv = ne.getUi().findViewByXY(ne.getX(), ne.getY());
            if (nv == null) {
                throw new UnreachableStateException(
                        "No visible view found on recordee tree at (" + ne.getX() + ", " + ne.getY() + ")");
            }
            Optional<ViewMap> nvm = selector.select(nv, true);
            if (nvm.isPresent() && nvm.get().isVisible()) {
                return i;
            }
        }
        return -1;
    }
}
