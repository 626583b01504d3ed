package droidreplay.segment;

import droidreplay.model.View;
import droidreplay.model.ViewFinder;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/** Searches over a segment tree and over the views a segment is rooted on. */
public final class SegmentFinder {

    private SegmentFinder() {}

    /** Accepted segments of the tree under {@code s}, pre-order. */
    public static List<Segment> findAccepts(Segment s) {
        return findSegments(s, Segment::isAccepted);
    }

    public static List<Segment> findSegments(Segment s, Predicate<Segment> pred) {
        List<Segment> found = new ArrayList<>();
        collect(s, pred, found);
        return found;
    }

    /** First view satisfying {@code pred}, searching the roots in order. */
    public static View findView(Segment s, Predicate<View> pred) {
        for (View r : s.getRoots()) {
            View found = ViewFinder.findView(r, pred);
            if (found != null) return found;
        }
        return null;
    }

    public static List<View> findViews(Segment s, Predicate<View> pred) {
        List<View> found = new ArrayList<>();
        for (View r : s.getRoots()) {
            found.addAll(ViewFinder.findViews(r, pred));
        }
        return found;
    }

    public static View findViewByText(Segment s, String text) {
        return findView(s, w -> w.getText().equals(text));
    }

    public static View findViewByDesc(Segment s, String desc) {
        return findView(s, w -> w.getDesc().equals(desc));
    }

    public static View findViewByResource(Segment s, String type, String entry) {
        return findView(s, w -> w.getResType().equals(type) && w.getResEntry().equals(entry));
    }

    private static void collect(Segment s, Predicate<Segment> pred, List<Segment> out) {
        if (pred.test(s)) out.add(s);
        for (Segment c : s.getChildren()) {
            collect(c, pred, out);
        }
    }
}
