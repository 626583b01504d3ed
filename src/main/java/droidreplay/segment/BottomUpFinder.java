package droidreplay.segment;

import droidreplay.model.View;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Searches views outward from a segment: the segment itself, then its
 * siblings, then its parent (and the parent's siblings), up to the root.
 * Every view is tested at most once.
 */
public final class BottomUpFinder {

    private BottomUpFinder() {}

    public static View findView(Segment s, Predicate<View> pred) {
        Set<View> checked = Collections.newSetFromMap(new IdentityHashMap<>());
        Predicate<View> once = v -> checked.add(v) && pred.test(v);
        for (Segment c = s; c != null; c = c.getParent()) {
            View found = SegmentFinder.findView(c, once);
            if (found != null) return found;
            for (Segment sib : c.getSiblings()) {
                found = SegmentFinder.findView(sib, once);
                if (found != null) return found;
            }
        }
        return null;
    }

    public static View findViewByText(Segment s, String text) {
        return findView(s, w -> w.getText().equals(text));
    }

    public static View findViewByDesc(Segment s, String desc) {
        return findView(s, w -> w.getDesc().equals(desc));
    }

    public static View findViewById(Segment s, String id) {
        return findView(s, w -> w.getId().equals(id));
    }

    public static View findViewByResource(Segment s, String type, String entry) {
        return findView(s, w -> w.getResType().equals(type) && w.getResEntry().equals(entry));
    }
}
