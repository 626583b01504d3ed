package droidreplay.text;

import java.util.List;

/**
 * Vector arithmetic used for text similarity.
 */
public final class Vectors {

    private Vectors() {}

    public static double dot(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    public static double norm(double[] a) {
        return Math.sqrt(dot(a, a));
    }

    /**
     * Cosine similarity {@code dot / (|a| * |b|)}. Returns {@link Double#NaN}
     * when either vector is all zeros; callers decide how to treat it.
     */
    public static double cosine(double[] a, double[] b) {
        return dot(a, b) / (norm(a) * norm(b));
    }

    public static double cosine(WordVector a, WordVector b) {
        return cosine(a.raw(), b.raw());
    }

    /**
     * Index of the candidate most similar to {@code target} by cosine.
     * NaN similarities rank below everything; ties keep the first candidate.
     *
     * @return the index, or -1 when {@code candidates} is empty
     */
    public static int closest(WordVector target, List<WordVector> candidates) {
        int best = -1;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < candidates.size(); i++) {
            double score = cosine(target, candidates.get(i));
            if (Double.isNaN(score)) {
                score = Double.NEGATIVE_INFINITY;
            }
            if (best < 0 || score > bestScore) {
                best      = i;
                bestScore = score;
            }
        }
        return best;
    }
}
