package droidreplay.select;

import droidreplay.device.DroidInput;
import droidreplay.device.SelectOptions;
import droidreplay.device.ViewMap;
import droidreplay.model.View;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Queries by description and keeps a hit whose description is equal, or equal ignoring case. */
public class StrictDescStrategy implements SelectionStrategy {

    @Override
    public boolean appliesTo(View view) {
        return !view.getDesc().isEmpty();
    }

    @Override
    public Optional<ViewMap> select(DroidInput input, View view, boolean compressed) {
        List<ViewMap> found = input.select(SelectOptions.create(compressed).descContains(view.getDesc()));
        for (ViewMap vm : found) {
            if (vm.getContentDesc().equals(view.getDesc())) return Optional.of(vm);
        }
        String lower = view.getDesc().toLowerCase(Locale.ROOT);
        for (ViewMap vm : found) {
            if (vm.getContentDesc().toLowerCase(Locale.ROOT).equals(lower)) return Optional.of(vm);
        }
        return Optional.empty();
    }
}
