package droidreplay.text;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Base for corpus-trained document models. Each document is tokenized with
 * {@link Words#splitAsWords}, lower-cased, optionally stop-word filtered and
 * turned into n-grams; subclasses decide how term frequencies are weighted.
 * Vectors share one vocabulary sorted alphabetically.
 */
public abstract class DocumentModel {

    private final List<String> vocabulary;
    private final List<WordVector> vectors;

    protected DocumentModel(List<String> corpus, boolean filterStopWords, int ngram) {
        List<Map<String, Integer>> freqs = new ArrayList<>(corpus.size());
        TreeSet<String> vocab = new TreeSet<>();
        for (String doc : corpus) {
            List<String> words = Words.lower(Words.splitAsWords(doc));
            if (filterStopWords) {
                words = Words.filterStopWords(words);
            }
            words = Words.ngrams(words, ngram, " ");
            Map<String, Integer> freq = new LinkedHashMap<>();
            for (String w : words) {
                freq.merge(w, 1, Integer::sum);
            }
            freqs.add(freq);
            vocab.addAll(freq.keySet());
        }
        this.vocabulary = Collections.unmodifiableList(new ArrayList<>(vocab));

        List<WordVector> vecs = new ArrayList<>(freqs.size());
        for (Map<String, Integer> freq : freqs) {
            Map<String, Double> weights = weigh(freq, freqs);
            double[] values = new double[vocabulary.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = weights.getOrDefault(vocabulary.get(i), 0.0);
            }
            vecs.add(new WordVector(vocabulary, values));
        }
        this.vectors = Collections.unmodifiableList(vecs);
    }

    /** Computes the weight of each term of {@code doc} given the whole corpus. */
    protected abstract Map<String, Double> weigh(Map<String, Integer> doc, List<Map<String, Integer>> corpus);

    public List<String> vocabulary() {
        return vocabulary;
    }

    /** One vector per corpus document, in corpus order. */
    public List<WordVector> vectors() {
        return vectors;
    }

    public WordVector vector(int index) {
        return vectors.get(index);
    }

    // ── Weighting primitives ──────────────────────────────────────────────

    /** Term frequency: occurrences divided by the document's word count. */
    static Map<String, Double> tf(Map<String, Integer> doc) {
        int total = 0;
        for (int f : doc.values()) total += f;
        Map<String, Double> tf = new LinkedHashMap<>();
        for (Map.Entry<String, Integer> e : doc.entrySet()) {
            tf.put(e.getKey(), (double) e.getValue() / total);
        }
        return tf;
    }

    /** Inverse document frequency {@code ln(N / (1 + df))}. */
    static Map<String, Double> idf(Map<String, Integer> doc, List<Map<String, Integer>> corpus) {
        Map<String, Double> idf = new LinkedHashMap<>();
        for (String w : doc.keySet()) {
            int containing = 0;
            for (Map<String, Integer> d : corpus) {
                if (d.getOrDefault(w, 0) != 0) containing++;
            }
            idf.put(w, Math.log((double) corpus.size() / (1 + containing)));
        }
        return idf;
    }
}
