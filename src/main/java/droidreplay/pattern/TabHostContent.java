package droidreplay.pattern;

import droidreplay.UnsupportedCircumstanceException;
import droidreplay.device.DroidInput;
import droidreplay.device.SelectOptions;
import droidreplay.device.ViewMap;
import droidreplay.model.View;
import droidreplay.model.ViewFinder;
import droidreplay.model.ViewType;
import droidreplay.model.Views;
import droidreplay.segment.BottomUpFinder;
import droidreplay.select.AdaptiveSelector;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * The recorded view is inside the content of a tab that is not selected on
 * the playee. The tab selected on the recordee is looked up by its text and
 * tapped; the event is retried.
 */
public class TabHostContent extends BottomUpPattern {

    static final String TAB_CONTENT_ID = "android:id/tabcontent";

    public TabHostContent(PatternContext ctx) {
        super(ctx);
    }

    @Override
    public String getName() {
        return "tab-host-content";
    }

    @Override
    public PatternLevel getLevel() {
        return PatternLevel.REVEAL;
    }

    @Override
    protected boolean doMatch() {
        return ViewFinder.findParent(ctx.view(), p -> TAB_CONTENT_ID.equals(p.getResId())
                || p.getResEntry().toLowerCase(Locale.ROOT).contains("tabcontent")) != null;
    }

    @Override
    protected boolean doApply(DroidInput input, AdaptiveSelector selector) {
        View host = findTabStrip();
        View selected = null;
        for (View c : host.getChildren()) {
            if (c.getFlags().isSelected()) {
                selected = c;
                break;
            }
        }
        if (selected == null) {
            throw new UnsupportedCircumstanceException("No selected tab");
        }

        List<View> containers = new ArrayList<>();
        containers.add(selected);
        containers.addAll(selected.getSiblings());
        List<View> tabs = new ArrayList<>();
        for (View c : containers) {
            View text = ViewFinder.findView(c, Views::isText);
            if (text != null) tabs.add(text);
        }
        if (tabs.isEmpty()) {
            throw new UnsupportedCircumstanceException("No tab has text");
        }

        View selectedTab = tabs.get(0);
        View found = null;
        for (View tab : tabs) {
            found = BottomUpFinder.findViewByText(ctx.playee().segment(), tab.getText());
            if (found != null) break;
        }
        if (found == null) {
            throw new UnsupportedCircumstanceException("No tab found on playee");
        }
        tapCorner(input, found);
        setDirty();

        // a different tab brought the strip around; now the selected one should show
        if (!found.getText().equals(selectedTab.getText())) {
            List<ViewMap> maps = input.select(SelectOptions.create(false).textContains(selectedTab.getText()));
            if (maps.isEmpty()) {
                throw new UnsupportedCircumstanceException("Selected tab '" + selectedTab.getText() + "' not shown");
            }
            ViewMap.Bounds b = maps.get(0).getBounds();
            input.tap(b.getLeft() + 1, b.getTop() + 1);
        }
        return false;
    }

    /** The single visible tab strip of the recordee. */
    private View findTabStrip() {
        List<View> hosts = ctx.recordee().ui().findViews(w -> TabHostTab.TABS_ID.equals(w.getResId())
                && Views.isVisibleToUser(w, ctx.recordee().device()));
        if (hosts.isEmpty()) {
            for (View w : ctx.recordee().ui().findViews(w -> w.getType() == ViewType.TAB_HOST
                    && Views.isVisibleToUser(w, ctx.recordee().device()))) {
                View strip = w;
                List<View> good = TabHost.goodChildren(strip);
                while (good.size() == 1) {
                    strip = good.get(0);
                    good = TabHost.goodChildren(strip);
                }
                hosts.add(strip);
            }
        }
        hosts.removeIf(h -> !Views.hasValidChild(h)
                || h.getChildren().stream().noneMatch(View::isShown));
        if (hosts.isEmpty()) {
            throw new UnsupportedCircumstanceException("No TabHosts found");
        }
        if (hosts.size() > 1) {
            throw new UnsupportedCircumstanceException("Multiple TabHosts found");
        }
        return hosts.get(0);
    }
}
