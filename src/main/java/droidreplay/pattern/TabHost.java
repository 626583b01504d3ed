package droidreplay.pattern;

import droidreplay.UnsupportedCircumstanceException;
import droidreplay.device.DroidInput;
import droidreplay.model.View;
import droidreplay.model.ViewType;
import droidreplay.model.Views;
import droidreplay.select.AdaptiveSelector;

import java.util.List;
import java.util.stream.Collectors;

/**
 * {@link TabHostTab} for a tab host without the platform tabs id. Wrappers
 * with a single meaningful child are skipped to reach the tab strip.
 */
public class TabHost extends TabHostTab {

    public TabHost(PatternContext ctx) {
        super(ctx);
    }

    @Override
    public String getName() {
        return "tab-host";
    }

    @Override
    protected boolean isTabsParent(View p) {
        return p.getType() == ViewType.TAB_HOST;
    }

    @Override
    protected boolean doApply(DroidInput input, AdaptiveSelector selector) {
        while (!path.isEmpty() && goodChildren(path.get(0)).size() == 1) {
            path = path.subList(1, path.size());
        }
        if (path.isEmpty()) {
            throw new UnsupportedCircumstanceException("No tab strip found in tab host");
        }
        return super.doApply(input, selector);
    }

    static List<View> goodChildren(View v) {
        return v.getChildren().stream()
                .filter(c -> Views.isValid(c) && Views.isHierarchyImportantForA11y(c))
                .collect(Collectors.toList());
    }
}
