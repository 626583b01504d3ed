package droidreplay.matching;

import droidreplay.ContractViolationException;

import java.util.Arrays;

/**
 * Maximum-weight perfect matching on a complete bipartite graph
 * (Kuhn-Munkres with vertex labels and slack tracking).
 *
 * <p>Rows are left vertices, columns right vertices. Weights must be
 * non-negative integers. Results are deterministic for a given matrix.
 *
 * <pre>{@code
 * BipartiteMatcher km = new BipartiteMatcher(weights);
 * int total = km.match();
 * int right = km.getMatch(0, true);
 * }</pre>
 */
public class BipartiteMatcher {

    private static final int INF = Integer.MAX_VALUE;

    private final int n;
    private final int[][] weights;

    private final int[] lval;
    private final int[] rval;
    private final boolean[] lvis;
    private final boolean[] rvis;
    private final int[] lmatch;
    private final int[] rmatch;
    private final int[] slack;

    private boolean matched;

    public BipartiteMatcher(int[][] weights) {
        this.n = weights.length;
        for (int[] row : weights) {
            if (row.length != n) {
                throw new ContractViolationException(
                        "Weight matrix must be square, got a row of " + row.length + " for " + n + " rows");
            }
            for (int w : row) {
                if (w < 0) {
                    throw new ContractViolationException("Weights must be non-negative, got " + w);
                }
            }
        }
        this.weights = weights;
        this.lval    = new int[n];
        this.rval    = new int[n];
        this.lvis    = new boolean[n];
        this.rvis    = new boolean[n];
        this.lmatch  = new int[n];
        this.rmatch  = new int[n];
        this.slack   = new int[n];
    }

    /**
     * Computes the matching.
     *
     * @return the total weight of the optimal perfect assignment
     */
    public int match() {
        Arrays.fill(lmatch, -1);
        Arrays.fill(rmatch, -1);
        Arrays.fill(rval, 0);
        for (int i = 0; i < n; i++) {
            int max = 0;
            for (int w : weights[i]) {
                max = Math.max(max, w);
            }
            lval[i] = max;
        }

        for (int i = 0; i < n; i++) {
            Arrays.fill(slack, INF);
            while (true) {
                Arrays.fill(lvis, false);
                Arrays.fill(rvis, false);
                if (augment(i)) {
                    break;
                }
                int d = INF;
                for (int j = 0; j < n; j++) {
                    if (!rvis[j]) d = Math.min(d, slack[j]);
                }
                for (int k = 0; k < n; k++) {
                    if (lvis[k]) lval[k] -= d;
                }
                for (int j = 0; j < n; j++) {
                    if (rvis[j]) {
                        rval[j] += d;
                    } else {
                        slack[j] -= d;
                    }
                }
            }
        }
        matched = true;

        int total = 0;
        for (int i = 0; i < n; i++) {
            total += weights[i][lmatch[i]];
        }
        return total;
    }

    /**
     * Returns the vertex matched with {@code index}.
     *
     * @param index  vertex index
     * @param isLeft whether {@code index} is a left (row) vertex
     */
    public int getMatch(int index, boolean isLeft) {
        if (!matched) {
            throw new ContractViolationException("match() must be called before getMatch()");
        }
        return isLeft ? lmatch[index] : rmatch[index];
    }

    public int size() {
        return n;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    /** DFS along tight edges looking for an augmenting path from left vertex {@code i}. */
    private boolean augment(int i) {
        lvis[i] = true;
        for (int j = 0; j < n; j++) {
            if (rvis[j]) continue;
            int gap = lval[i] + rval[j] - weights[i][j];
            if (gap == 0) {
                rvis[j] = true;
                if (rmatch[j] == -1 || augment(rmatch[j])) {
                    rmatch[j] = i;
                    lmatch[i] = j;
                    return true;
                }
            } else if (gap < slack[j]) {
                slack[j] = gap;
            }
        }
        return false;
    }
}
