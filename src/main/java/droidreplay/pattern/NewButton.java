package droidreplay.pattern;

import droidreplay.model.View;

import java.util.List;

/** A "New", "Create" or "Add" button that opens an editor the recordee shows inline. */
public class NewButton extends MergeButton {

    static final List<String> PREFIXES = List.of("New", "Create", "Add");

    public NewButton(PatternContext ctx) {
        super(ctx);
    }

    @Override
    public String getName() {
        return "new-button";
    }

    @Override
    protected boolean isButton(View w) {
        for (String prefix : PREFIXES) {
            if (w.getText().startsWith(prefix) || w.getDesc().startsWith(prefix)) return true;
        }
        return false;
    }
}
