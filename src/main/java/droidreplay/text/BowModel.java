package droidreplay.text;

import java.util.List;
import java.util.Map;

/**
 * Bag-of-words model: vectors hold plain term frequencies.
 */
public class BowModel extends DocumentModel {

    public BowModel(List<String> corpus) {
        this(corpus, true, 1);
    }

    public BowModel(List<String> corpus, boolean filterStopWords, int ngram) {
        super(corpus, filterStopWords, ngram);
    }

    @Override
    protected Map<String, Double> weigh(Map<String, Integer> doc, List<Map<String, Integer>> corpus) {
        return tf(doc);
    }
}
