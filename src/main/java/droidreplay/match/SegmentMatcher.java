package droidreplay.match;

import droidreplay.matching.BipartiteMatcher;
import droidreplay.model.View;
import droidreplay.segment.Segment;
import droidreplay.text.TfIdfModel;
import droidreplay.text.Vectors;
import droidreplay.text.WordVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Pairs the segments of two UIs by textual similarity.
 *
 * <p>Each segment becomes one document made of the resource entry,
 * description, text, tag, tip and hint of every view under its roots. The
 * documents of both sides form one TF-IDF corpus. Cosine similarities scaled
 * to integers weigh a complete bipartite graph whose maximum-weight perfect
 * matching gives the pairing. The shorter side is padded with
 * {@link SegmentMatch#NO_MATCH}.
 */
public class SegmentMatcher {

    private static final Logger log = LoggerFactory.getLogger(SegmentMatcher.class);

    /** Cosine similarities are scaled by this factor before rounding. */
    static final int SCALE = 1000;

    public SegmentMatch match(List<Segment> a, List<Segment> b) {
        List<Segment> side1 = new ArrayList<>(a);
        List<Segment> side2 = new ArrayList<>(b);
        while (side1.size() < side2.size()) side1.add(SegmentMatch.NO_MATCH);
        while (side2.size() < side1.size()) side2.add(SegmentMatch.NO_MATCH);
        int size = side1.size();

        List<String> corpus = new ArrayList<>(2 * size);
        for (Segment s : side1) corpus.add(documentOf(s));
        for (Segment s : side2) corpus.add(documentOf(s));
        TfIdfModel model = new TfIdfModel(corpus, true, 1);

        int[][] weights = new int[size][size];
        for (int v = 0; v < size; v++) {
            if (side1.get(v) == SegmentMatch.NO_MATCH) continue;
            WordVector v1 = model.vector(v);
            for (int w = 0; w < size; w++) {
                if (side2.get(w) == SegmentMatch.NO_MATCH) continue;
                weights[v][w] = weigh(v1, model.vector(size + w));
            }
        }

        BipartiteMatcher graph = new BipartiteMatcher(weights);
        int total = graph.match();
        int[] pairs = new int[size];
        for (int v = 0; v < size; v++) {
            pairs[v] = graph.getMatch(v, true);
        }
        log.debug("Matched {} against {} segments, total similarity {}", a.size(), b.size(), total);
        return new SegmentMatch(side1, side2, weights, pairs);
    }

    /** Depth-first concatenation of the identity properties of every view under the roots. */
    static String documentOf(Segment s) {
        StringBuilder doc = new StringBuilder();
        for (View r : s.getRoots()) {
            concat(r, doc);
        }
        return doc.toString();
    }

    /**
     * Scaled cosine similarity. TF-IDF weights go negative for terms present
     * in most documents, so the cosine is clamped to the matcher's
     * non-negative domain and an undefined cosine counts as 0.
     */
    static int weigh(WordVector a, WordVector b) {
        double cos = Vectors.cosine(a, b);
        if (Double.isNaN(cos)) {
            return 0;
        }
        return (int) Math.max(0, Math.round(SCALE * cos));
    }

    private static void concat(View v, StringBuilder doc) {
        doc.append(v.getResEntry()).append(' ')
           .append(v.getDesc()).append(' ')
           .append(v.getText()).append(' ')
           .append(v.getTag()).append(' ')
           .append(v.getTip()).append(' ')
           .append(v.getHint()).append(' ');
        for (View c : v.getChildren()) {
            concat(c, doc);
        }
    }
}
