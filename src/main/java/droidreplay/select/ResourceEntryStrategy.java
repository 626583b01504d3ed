package droidreplay.select;

import droidreplay.device.DroidInput;
import droidreplay.device.SelectOptions;
import droidreplay.device.ViewMap;
import droidreplay.model.View;
import droidreplay.text.BowModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Queries by resource entry. Among several hits the same entry is preferred,
 * then the same description, then a description containing the recorded
 * one, then the most similar description.
 */
public class ResourceEntryStrategy implements SelectionStrategy {

    @Override
    public boolean appliesTo(View view) {
        return !view.getResId().isEmpty();
    }

    @Override
    public Optional<ViewMap> select(DroidInput input, View view, boolean compressed) {
        List<ViewMap> found = input.select(SelectOptions.create(compressed).resIdContains(view.getResEntry()));
        if (found.isEmpty()) {
            return Optional.empty();
        }
        if (found.size() == 1) {
            return Optional.of(found.get(0));
        }

        List<ViewMap> sameEntry = new ArrayList<>();
        for (ViewMap vm : found) {
            if (vm.getResourceEntry().equals(view.getResEntry())) sameEntry.add(vm);
        }
        if (sameEntry.size() == 1) {
            return Optional.of(sameEntry.get(0));
        }
        List<ViewMap> candidates = sameEntry.isEmpty() ? found : sameEntry;
        if (view.getDesc().isEmpty()) {
            return Optional.of(candidates.get(0));
        }

        for (ViewMap vm : candidates) {
            if (vm.getContentDesc().equals(view.getDesc())) return Optional.of(vm);
        }
        for (ViewMap vm : candidates) {
            if (vm.getContentDesc().contains(view.getDesc())) return Optional.of(vm);
        }
        List<String> corpus = new ArrayList<>();
        corpus.add(view.getDesc());
        for (ViewMap vm : candidates) {
            corpus.add(vm.getContentDesc());
        }
        return Optional.of(candidates.get(Selections.closest(new BowModel(corpus))));
    }
}
