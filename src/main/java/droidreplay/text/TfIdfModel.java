package droidreplay.text;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * TF-IDF model: each term frequency is scaled by {@code ln(N / (1 + df))}.
 * Terms present in every document get a negative weight.
 */
public class TfIdfModel extends DocumentModel {

    public TfIdfModel(List<String> corpus) {
        this(corpus, true, 1);
    }

    public TfIdfModel(List<String> corpus, boolean filterStopWords, int ngram) {
        super(corpus, filterStopWords, ngram);
    }

    @Override
    protected Map<String, Double> weigh(Map<String, Integer> doc, List<Map<String, Integer>> corpus) {
        Map<String, Double> tf  = tf(doc);
        Map<String, Double> idf = idf(doc, corpus);
        Map<String, Double> tfidf = new LinkedHashMap<>();
        for (String w : doc.keySet()) {
            tfidf.put(w, tf.get(w) * idf.get(w));
        }
        return tfidf;
    }
}
