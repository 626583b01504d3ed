package droidreplay.pattern;

import droidreplay.UnsupportedCircumstanceException;
import droidreplay.device.DroidInput;
import droidreplay.model.View;
import droidreplay.model.ViewFinder;
import droidreplay.model.Views;
import droidreplay.segment.BottomUpFinder;
import droidreplay.select.AdaptiveSelector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The recorded view is a tab the playee keeps out of sight, typically in a
 * scrolled tab strip. A sibling tab that the playee shows is tapped to bring
 * the strip around; the event is retried.
 */
public class TabHostTab extends BottomUpPattern {

    static final String TABS_ID = "android:id/tabs";

    /** Tabs parent first, recorded view last. */
    protected List<View> path = Collections.emptyList();

    public TabHostTab(PatternContext ctx) {
        super(ctx);
    }

    @Override
    public String getName() {
        return "tab-host-tab";
    }

    @Override
    public PatternLevel getLevel() {
        return PatternLevel.REVEAL;
    }

    /** Whether {@code p} is the view holding the tabs. */
    protected boolean isTabsParent(View p) {
        return TABS_ID.equals(p.getResId());
    }

    @Override
    protected boolean doMatch() {
        View parent = ViewFinder.findParent(ctx.view(), this::isTabsParent);
        path = parent == null ? Collections.emptyList() : Views.path(ctx.view(), parent);
        return !path.isEmpty();
    }

    @Override
    protected boolean doApply(DroidInput input, AdaptiveSelector selector) {
        View found = null;
        for (View tab : findSiblingTabs()) {
            found = BottomUpFinder.findViewByText(ctx.playee().segment(), tab.getText());
            if (found != null) break;
        }
        if (found == null) {
            throw new UnsupportedCircumstanceException("No sibling tab found on playee");
        }
        tapCorner(input, found);
        setDirty();
        return false;
    }

    /**
     * Recordee views at the recorded view's position under every other tab,
     * keeping those with text.
     */
    public List<View> findSiblingTabs() {
        View parent = path.get(0);
        List<Integer> indices = new ArrayList<>();
        for (View w : path.subList(1, path.size())) {
            indices.add(Views.indexOf(w));
        }
        List<View> tabs = new ArrayList<>();
        if (indices.isEmpty()) {
            return tabs;
        }
        int currTab = indices.get(0);
        for (int i = 0; i < parent.getChildren().size(); i++) {
            if (i == currTab) continue;
            List<Integer> sibling = new ArrayList<>(indices);
            sibling.set(0, i);
            View tab = ViewFinder.findViewByIndices(parent, sibling);
            if (tab != null && Views.isText(tab)) {
                tabs.add(tab);
            }
        }
        return tabs;
    }

    public List<View> getPath() {
        return path;
    }
}
