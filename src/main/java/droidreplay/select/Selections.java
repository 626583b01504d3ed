package droidreplay.select;

import droidreplay.device.ViewMap;
import droidreplay.text.DocumentModel;
import droidreplay.text.Vectors;
import droidreplay.text.WordVector;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

final class Selections {

    private Selections() {}

    /** First hit with exactly {@code text}, else the first equal ignoring case. */
    static Optional<ViewMap> byText(List<ViewMap> found, String text) {
        for (ViewMap vm : found) {
            if (vm.getText().equals(text)) return Optional.of(vm);
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (ViewMap vm : found) {
            if (vm.getText().toLowerCase(Locale.ROOT).equals(lower)) return Optional.of(vm);
        }
        return Optional.empty();
    }

    /** Index among documents 1..n of the one closest to document 0. */
    static int closest(DocumentModel model) {
        List<WordVector> vectors = model.vectors();
        return Math.max(0, Vectors.closest(vectors.get(0), vectors.subList(1, vectors.size())));
    }
}
