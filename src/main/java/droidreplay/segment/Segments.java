package droidreplay.segment;

import droidreplay.ContractViolationException;
import droidreplay.geometry.XYInterval;
import droidreplay.model.View;
import droidreplay.model.Views;

import java.util.Collections;
import java.util.List;

/** Segment construction and geometry. */
public final class Segments {

    private Segments() {}

    /**
     * Creates a segment whose rectangle is the merged bounds of {@code roots}
     * and whose level is their highest drawing level.
     *
     * @throws ContractViolationException when {@code roots} is empty
     */
    public static Segment create(List<View> roots) {
        if (roots.isEmpty()) {
            throw new ContractViolationException("Cannot create a segment without roots");
        }
        XYInterval xy = Views.bounds(roots.get(0));
        int level = roots.get(0).getDrawingLevel();
        for (int i = 1; i < roots.size(); i++) {
            xy = xy.merge(Views.bounds(roots.get(i)));
            level = Math.max(level, roots.get(i).getDrawingLevel());
        }
        return new Segment(roots, level, xy.x().low(), xy.y().low(), xy.width(), xy.height());
    }

    /** Rootless placeholder segment, never produced by segmentation. */
    public static Segment placeholder() {
        return new Segment(Collections.emptyList(), -1, -1, -1, -1, -1);
    }

    public static long areaOf(Segment s) {
        return (long) s.getW() * s.getH();
    }

    /** Whether any root subtree holds a view important for accessibility. */
    public static boolean isImportantForA11y(Segment s) {
        for (View r : s.getRoots()) {
            if (Views.isHierarchyImportantForA11y(r)) {
                return true;
            }
        }
        return false;
    }

    public static XYInterval bounds(Segment s) {
        return XYInterval.of(x0(s), y0(s), x1(s), y1(s));
    }

    public static int x0(Segment s) { return s.getX(); }
    public static int x1(Segment s) { return s.getX() + s.getW(); }
    public static int y0(Segment s) { return s.getY(); }
    public static int y1(Segment s) { return s.getY() + s.getH(); }

    public static String xxyy(Segment s) {
        return "[" + x0(s) + ";" + x1(s) + ";" + y0(s) + ";" + y1(s) + "]";
    }
}
