package droidreplay.geometry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * 2-D interval tree built from one {@link IntervalTree} per axis.
 *
 * <p>A rectangle query returns the payloads whose x and y intervals both
 * strictly overlap the query. The two axis results are intersected by
 * payload identity. {@code null} payloads may be stored (the segmenter uses
 * one for its bounding sentinel) but are never returned.
 */
public class XYIntervalTree<T> {

    private final IntervalTree<T> xTree = new IntervalTree<>();
    private final IntervalTree<T> yTree = new IntervalTree<>();

    public void insert(XYInterval rect, T data) {
        xTree.insert(rect.x(), data);
        yTree.insert(rect.y(), data);
    }

    /** Non-null payloads overlapping {@code rect}, ordered as found on the x axis. */
    public List<T> query(XYInterval rect) {
        Set<T> onY = Collections.newSetFromMap(new IdentityHashMap<>());
        for (IntervalTree.Entry<T> e : yTree.query(rect.y())) {
            if (e.data() != null) {
                onY.add(e.data());
            }
        }
        Set<T> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<T> result = new ArrayList<>();
        for (IntervalTree.Entry<T> e : xTree.query(rect.x())) {
            T data = e.data();
            if (data != null && onY.contains(data) && seen.add(data)) {
                result.add(data);
            }
        }
        return result;
    }
}
