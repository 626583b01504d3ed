package droidreplay.pattern;

import droidreplay.model.DeviceInfo;
import droidreplay.model.Fragment;
import droidreplay.model.Fragments;
import droidreplay.model.Ui;
import droidreplay.model.View;
import droidreplay.model.ViewFinder;
import droidreplay.model.ViewType;
import droidreplay.model.Views;

/**
 * Master/detail layouts: the recordee shows a list (descriptive fragment)
 * next to the selected item's details (detailed fragment), while the playee
 * shows one at a time.
 */
public abstract class DualFragment extends BottomUpPattern {

    protected DualFragment(PatternContext ctx) {
        super(ctx);
    }

    @Override
    public PatternLevel getLevel() {
        return PatternLevel.MERGE;
    }

    static boolean isList(View w) {
        return w.getType() == ViewType.LIST_VIEW || w.getType() == ViewType.RECYCLER_VIEW;
    }

    /** Whether {@code f} shows a visible list with a selected, visible item. */
    static boolean isDescriptivePreview(Fragment f, Ui ui, DeviceInfo device) {
        if (f.getViewId() == null) return false;
        View fv = Fragments.viewOf(f, ui);
        if (fv == null || !Views.isValid(fv) || !Views.isVisibleToUser(fv, device)) {
            return false;
        }
        return ViewFinder.findView(fv, w -> isList(w)
                && Views.isVisibleToUser(w, device)
                && w.getChildren().stream().anyMatch(c ->
                        c.getFlags().isSelected() && Views.isVisibleToUser(c, device))) != null;
    }
}
