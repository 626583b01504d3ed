package droidreplay.match;

import droidreplay.segment.Segment;
import droidreplay.segment.Segments;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result of matching two equal-length (padded) segment sequences.
 *
 * <p>The perfect match of a segment is its partner in the optimal global
 * assignment. Its best matches are the segments on the other side sharing
 * the highest similarity score with it, in their original order.
 */
public class SegmentMatch {

    /** Padding segment; every score involving it is 0. */
    public static final Segment NO_MATCH = Segments.placeholder();

    private final List<Segment> left;
    private final List<Segment> right;
    private final int[][] scores;
    private final int[] pairs;

    SegmentMatch(List<Segment> left, List<Segment> right, int[][] scores, int[] pairs) {
        this.left   = Collections.unmodifiableList(new ArrayList<>(left));
        this.right  = Collections.unmodifiableList(new ArrayList<>(right));
        this.scores = scores;
        this.pairs  = pairs;
    }

    /**
     * Partner of {@code s} in the optimal assignment, {@link #NO_MATCH} when
     * it was paired with padding, or {@code null} when {@code s} is on
     * neither side.
     */
    public Segment getPerfectMatch(Segment s) {
        for (int a = 0; a < pairs.length; a++) {
            int b = pairs[a];
            if (left.get(a) == s) {
                return right.get(b);
            } else if (right.get(b) == s) {
                return left.get(a);
            }
        }
        return null;
    }

    /** Segments of the other side tied at the highest score with {@code s}. */
    public BestMatches getBestMatches(Segment s) {
        int ind = indexOf(left, s);
        if (ind != -1) {
            return bestOf(ind, true);
        }
        ind = indexOf(right, s);
        if (ind != -1) {
            return bestOf(ind, false);
        }
        return new BestMatches(Integer.MIN_VALUE, Collections.emptyList());
    }

    // ── Accessors ─────────────────────────────────────────────────────────

    public List<Segment> getLeft()  { return left; }
    public List<Segment> getRight() { return right; }
    public int size()               { return pairs.length; }

    public int getScore(int leftIndex, int rightIndex) {
        return scores[leftIndex][rightIndex];
    }

    /** Right index paired with {@code leftIndex}. */
    public int getPair(int leftIndex) {
        return pairs[leftIndex];
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private BestMatches bestOf(int ind, boolean isLeft) {
        int max = Integer.MIN_VALUE;
        List<Segment> best = new ArrayList<>();
        for (int i = 0; i < pairs.length; i++) {
            int w = isLeft ? scores[ind][i] : scores[i][ind];
            Segment other = isLeft ? right.get(i) : left.get(i);
            if (w > max) {
                max = w;
                best.clear();
                best.add(other);
            } else if (w == max) {
                best.add(other);
            }
        }
        return new BestMatches(max, best);
    }

    private static int indexOf(List<Segment> segments, Segment s) {
        for (int i = 0; i < segments.size(); i++) {
            if (segments.get(i) == s) return i;
        }
        return -1;
    }

    /** Highest score and the segments reaching it. */
    public record BestMatches(int score, List<Segment> segments) {

        public BestMatches {
            segments = Collections.unmodifiableList(new ArrayList<>(segments));
        }
    }
}
