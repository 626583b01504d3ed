package droidreplay.pattern;

import droidreplay.model.View;

/** Overflow menu of an action bar. */
public class MoreOptions extends RevealButton {

    static final String DESC = "More options";

    public MoreOptions(PatternContext ctx) {
        super(ctx);
    }

    @Override
    public String getName() {
        return "more-options";
    }

    @Override
    protected boolean isButton(View w) {
        return DESC.equals(w.getDesc());
    }
}
