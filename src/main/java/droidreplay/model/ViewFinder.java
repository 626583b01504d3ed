package droidreplay.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Tree searches over a view hierarchy. All searches are pre-order unless
 * stated otherwise and return {@code null} when nothing matches.
 */
public final class ViewFinder {

    private ViewFinder() {}

    // ── Generic ───────────────────────────────────────────────────────────

    /** First strict ancestor satisfying {@code pred}. */
    public static View findParent(View v, Predicate<View> pred) {
        for (View p = v.getParent(); p != null; p = p.getParent()) {
            if (pred.test(p)) return p;
        }
        return null;
    }

    /** First view of the subtree (root included) satisfying {@code pred}. */
    public static View findView(View root, Predicate<View> pred) {
        if (pred.test(root)) return root;
        for (View c : root.getChildren()) {
            View found = findView(c, pred);
            if (found != null) return found;
        }
        return null;
    }

    /** All views of the subtree (root included) satisfying {@code pred}. */
    public static List<View> findViews(View root, Predicate<View> pred) {
        List<View> found = new ArrayList<>();
        collect(root, pred, found);
        return found;
    }

    // ── By property ───────────────────────────────────────────────────────

    public static View findViewById(View root, String id) {
        return findView(root, w -> w.getId().equals(id));
    }

    public static View findViewByHash(View root, String hash) {
        return findView(root, w -> w.getHash().equals(hash));
    }

    public static View findViewByText(View root, String text) {
        return findViewByText(root, text, false);
    }

    public static View findViewByText(View root, String text, boolean caseInsensitive) {
        if (caseInsensitive) {
            String lower = text.toLowerCase(Locale.ROOT);
            return findView(root, w -> w.getText().toLowerCase(Locale.ROOT).equals(lower));
        }
        return findView(root, w -> w.getText().equals(text));
    }

    public static View findViewByDesc(View root, String desc) {
        return findView(root, w -> w.getDesc().equals(desc));
    }

    public static View findViewByResource(View root, String type, String entry) {
        return findView(root, w -> w.getResType().equals(type) && w.getResEntry().equals(entry));
    }

    /** Follows child indices from {@code root}; null when an index is out of range. */
    public static View findViewByIndices(View root, List<Integer> indices) {
        View current = root;
        for (int index : indices) {
            List<View> children = current.getChildren();
            if (index < 0 || index >= children.size()) return null;
            current = children.get(index);
        }
        return current;
    }

    public static List<View> findViewsByClass(View root, String cls) {
        return findViews(root, w -> w.getCls().equals(cls));
    }

    // ── Scrollable ancestors ──────────────────────────────────────────────

    /**
     * Nearest ancestor that is a horizontal scroll container or currently
     * scrolls horizontally. A container is not guaranteed to be scrollable.
     */
    public static View findHScrollableParent(View v) {
        return findParent(v, p -> p.getType() == ViewType.HORIZONTAL_SCROLL_VIEW
                || Views.canR2LScroll(p) || Views.canL2RScroll(p));
    }

    /** Vertical counterpart of {@link #findHScrollableParent(View)}. */
    public static View findVScrollableParent(View v) {
        return findParent(v, p -> {
            switch (p.getType()) {
                case RECYCLER_VIEW:
                case LIST_VIEW:
                case SCROLL_VIEW:
                case NESTED_SCROLL_VIEW:
                    return true;
                default:
                    return Views.canB2TScroll(p) || Views.canT2BScroll(p);
            }
        });
    }

    // ── By point ──────────────────────────────────────────────────────────

    /**
     * All views whose drawing bounds contain {@code (x, y)} inclusively,
     * deepest first: each view's hits among its descendants precede it, and
     * later children precede earlier ones.
     *
     * @param visible when true, views that are not shown are ignored
     */
    public static List<View> findViewsByXY(View root, int x, int y, boolean visible) {
        List<View> found = new ArrayList<>();
        if (!isInView(root, x, y, visible)) {
            return found;
        }
        found.add(root);
        for (View c : root.getChildren()) {
            List<View> hits = findViewsByXY(c, x, y, visible);
            hits.addAll(found);
            found = hits;
        }
        return found;
    }

    /** Most plausible tap target at {@code (x, y)} among visible, accessibility-important views. */
    public static View findViewByXY(View root, int x, int y) {
        return findViewByXY(root, x, y, true, true, true);
    }

    /**
     * Most detailed view at {@code (x, y)}.
     *
     * @param visible    ignore views that are not shown
     * @param a11y       keep only views important for accessibility
     * @param meaningful choose heuristically instead of taking the deepest hit
     */
    public static View findViewByXY(View root, int x, int y, boolean visible, boolean a11y, boolean meaningful) {
        List<View> views = findViewsByXY(root, x, y, visible);
        if (a11y) {
            views.removeIf(w -> !Views.isImportantForA11y(w));
        }
        if (meaningful) {
            return firstMeaningful(views);
        }
        return views.isEmpty() ? null : views.get(0);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private static void collect(View v, Predicate<View> pred, List<View> out) {
        if (pred.test(v)) out.add(v);
        for (View c : v.getChildren()) {
            collect(c, pred, out);
        }
    }

    private static boolean isInView(View v, int x, int y, boolean visible) {
        boolean hit = Views.x0(v) <= x && x <= Views.x1(v)
                && Views.y0(v) <= y && y <= Views.y1(v);
        return visible ? hit && v.isShown() : hit;
    }

    /**
     * Picks among the hits at a point: progress bars are dropped, the first
     * view with text wins, otherwise a clearly more informative view (level
     * 2 or more) wins unless it is an ancestor of the deepest hit.
     */
    private static View firstMeaningful(List<View> views) {
        if (views.isEmpty()) return null;
        if (views.size() == 1) return views.get(0);

        List<View> candidates = new ArrayList<>(views);
        candidates.removeIf(w -> w.getCls().toLowerCase(Locale.ROOT).contains("progressbar"));
        if (candidates.isEmpty()) return null;
        if (candidates.size() == 1) return candidates.get(0);

        for (View w : candidates) {
            if (Views.isText(w)) return w;
        }

        List<View> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingInt(Views::informativeLevelOf).reversed());
        View deepest = candidates.get(0);
        View best    = sorted.get(0);
        if (best == deepest) {
            return best;
        }
        int bestLevel = Views.informativeLevelOf(best);
        if (bestLevel > Views.informativeLevelOf(sorted.get(1))) {
            return bestLevel >= 2 && !Views.isChild(deepest, best) ? best : deepest;
        }
        return deepest;
    }
}
