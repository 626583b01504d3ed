package droidreplay.pattern;

import droidreplay.device.DroidInput;
import droidreplay.select.AdaptiveSelector;

import java.util.Set;

/** A view standing for navigating up is replaced by the back key. */
public class NavigationUp extends BottomUpPattern {

    static final Set<String> DESCRIPTIONS = Set.of("Back", "Navigation Up", "Close", "Dismiss");

    public NavigationUp(PatternContext ctx) {
        super(ctx);
    }

    @Override
    public String getName() {
        return "navigation-up";
    }

    @Override
    public PatternLevel getLevel() {
        return PatternLevel.TRANSFORM;
    }

    @Override
    protected boolean doMatch() {
        return DESCRIPTIONS.contains(ctx.view().getDesc());
    }

    @Override
    protected boolean doApply(DroidInput input, AdaptiveSelector selector) {
        input.pressBack();
        setDirty();
        return true;
    }
}
