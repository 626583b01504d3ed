package droidreplay.pattern;

import droidreplay.device.DroidInput;
import droidreplay.model.Fragment;
import droidreplay.model.Fragments;
import droidreplay.select.AdaptiveSelector;

/**
 * The recorded view is in the list of a master/detail layout while the
 * playee shows the details. Going back returns to the list; the event is
 * retried.
 */
public class DualFragmentGotoDescriptive extends DualFragment {

    public DualFragmentGotoDescriptive(PatternContext ctx) {
        super(ctx);
    }

    @Override
    public String getName() {
        return "dual-fragment-goto-descriptive";
    }

    @Override
    protected boolean doMatch() {
        Fragment f = Fragments.findFragmentByView(ctx.view(), ctx.recordee().ui());
        return f != null && isDescriptivePreview(f, ctx.recordee().ui(), ctx.recordee().device());
    }

    @Override
    protected boolean doApply(DroidInput input, AdaptiveSelector selector) {
        input.pressBack();
        setDirty();
        return false;
    }
}
