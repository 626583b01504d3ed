package droidreplay.select;

import droidreplay.device.DroidInput;
import droidreplay.device.SelectOptions;
import droidreplay.device.ViewMap;
import droidreplay.model.View;
import droidreplay.text.BowModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Queries by text alone. Text is what users see, so a view that shows text
 * on one device is expected to show the same text on another: when nothing
 * matches, no other property is tried.
 *
 * <p>Several hits are told apart by bag-of-words similarity over text and
 * resource entry.
 */
public class TextStrategy implements SelectionStrategy {

    @Override
    public boolean appliesTo(View view) {
        return !view.getText().isEmpty();
    }

    @Override
    public boolean isTerminal() {
        return true;
    }

    @Override
    public Optional<ViewMap> select(DroidInput input, View view, boolean compressed) {
        List<ViewMap> found = input.select(SelectOptions.create(compressed).textContains(view.getText()));

        List<ViewMap> hits = new ArrayList<>();
        for (ViewMap vm : found) {
            if (vm.getText().equals(view.getText())) hits.add(vm);
        }
        // the device may report capitalized text
        if (hits.isEmpty()) {
            String lower = view.getText().toLowerCase(Locale.ROOT);
            for (ViewMap vm : found) {
                if (vm.getText().toLowerCase(Locale.ROOT).equals(lower)) hits.add(vm);
            }
        }

        if (hits.isEmpty()) {
            return Optional.empty();
        }
        if (hits.size() == 1) {
            return Optional.of(hits.get(0));
        }
        List<String> corpus = new ArrayList<>();
        corpus.add(view.getText() + " " + view.getResEntry());
        for (ViewMap vm : hits) {
            corpus.add(vm.getText() + " " + vm.getResourceEntry());
        }
        return Optional.of(hits.get(Selections.closest(new BowModel(corpus))));
    }
}
