package droidreplay.select;

import droidreplay.device.DroidInput;
import droidreplay.device.SelectOptions;
import droidreplay.device.ViewMap;
import droidreplay.model.View;

import java.util.List;
import java.util.Optional;

/**
 * Queries by text together with resource entry and description, keeping a
 * hit whose text is equal, or equal ignoring case.
 */
public class TextAndPropertyStrategy implements SelectionStrategy {

    @Override
    public boolean appliesTo(View view) {
        return !view.getText().isEmpty() && (!view.getResId().isEmpty() || !view.getDesc().isEmpty());
    }

    @Override
    public Optional<ViewMap> select(DroidInput input, View view, boolean compressed) {
        SelectOptions options = SelectOptions.create(compressed).textContains(view.getText());
        if (!view.getResId().isEmpty()) {
            options.resIdContains(view.getResEntry());
        }
        if (!view.getDesc().isEmpty()) {
            options.descContains(view.getDesc());
        }
        List<ViewMap> found = input.select(options);
        return Selections.byText(found, view.getText());
    }
}
