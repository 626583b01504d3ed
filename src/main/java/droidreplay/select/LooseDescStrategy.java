package droidreplay.select;

import droidreplay.device.DroidInput;
import droidreplay.device.SelectOptions;
import droidreplay.device.ViewMap;
import droidreplay.model.View;
import droidreplay.text.Words;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Queries by description with loose acceptance.
 *
 * <p>A one-word description usually labels an image button, so the word
 * must be a whole word of the hit's description: "New" accepts
 * "New Document" but not "Newsletter". Longer descriptions prefer the
 * shortest hit.
 */
public class LooseDescStrategy implements SelectionStrategy {

    @Override
    public boolean appliesTo(View view) {
        return !view.getDesc().isEmpty();
    }

    @Override
    public boolean isTerminal() {
        return true;
    }

    @Override
    public Optional<ViewMap> select(DroidInput input, View view, boolean compressed) {
        List<ViewMap> found = new ArrayList<>(
                input.select(SelectOptions.create(compressed).descContains(view.getDesc())));
        List<String> words = Words.splitAsWords(view.getDesc());
        if (words.size() == 1) {
            found.removeIf(vm -> !Words.splitAsWords(vm.getContentDesc()).contains(words.get(0)));
        } else {
            found.sort(Comparator.comparingInt(vm -> vm.getContentDesc().length()));
        }
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }
}
