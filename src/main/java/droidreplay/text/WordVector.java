package droidreplay.text;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Dense document vector over an ordered vocabulary.
 */
public final class WordVector {

    private final List<String> words;
    private final double[] values;

    public WordVector(List<String> words, double[] values) {
        this.words  = Collections.unmodifiableList(words);
        this.values = values;
    }

    public List<String> words() {
        return words;
    }

    /** Returns a copy of the components. */
    public double[] values() {
        return values.clone();
    }

    double[] raw() {
        return values;
    }

    public double get(String word) {
        int i = words.indexOf(word);
        return i < 0 ? 0.0 : values[i];
    }

    @Override
    public String toString() {
        return "WordVector" + Arrays.toString(values);
    }
}
