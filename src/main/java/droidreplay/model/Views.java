package droidreplay.model;

import droidreplay.geometry.XYInterval;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Derived view properties used throughout segmentation and pattern
 * recognition.
 */
public final class Views {

    public static final String STATUS_BAR_ID = "android:id/statusBarBackground";
    public static final String NAV_BAR_ID    = "android:id/navigationBarBackground";

    /** Smallest width and height a view needs to be worth interacting with. */
    private static final int MIN_VALID_SIZE = 5;

    private Views() {}

    public static boolean isStatusBar(View v) {
        return STATUS_BAR_ID.equals(v.getResId());
    }

    public static boolean isNavBar(View v) {
        return NAV_BAR_ID.equals(v.getResId());
    }

    public static boolean isImportantForA11y(View v) {
        return v.getFlags().isImportant();
    }

    /** Whether the view or any descendant is important for accessibility. */
    public static boolean isHierarchyImportantForA11y(View v) {
        if (isImportantForA11y(v)) return true;
        for (View c : v.getChildren()) {
            if (isHierarchyImportantForA11y(c)) return true;
        }
        return false;
    }

    /** Number of non-empty identity properties among desc, text, resource id and hint (0 to 4). */
    public static int informativeLevelOf(View v) {
        return (v.getDesc().isEmpty() ? 0 : 1)
                + (v.getText().isEmpty() ? 0 : 1)
                + (v.getResId().isEmpty() ? 0 : 1)
                + (v.getHint().isEmpty() ? 0 : 1);
    }

    /**
     * Structural fingerprint {@code cls:max(info,2);} of the view followed by
     * those of its descendants down to {@code depth} levels. Depth 1 covers
     * only the view itself.
     */
    public static String layoutSummaryOf(View v, int depth) {
        StringBuilder sb = new StringBuilder();
        sb.append(v.getCls()).append(':').append(Math.max(informativeLevelOf(v), 2)).append(';');
        if (depth != 1) {
            for (View c : v.getChildren()) {
                sb.append(layoutSummaryOf(c, depth - 1));
            }
        }
        return sb.toString();
    }

    public static boolean isText(View v) {
        return !v.getText().isEmpty();
    }

    /** Large enough to matter: width and height at least 5 px. */
    public static boolean isValid(View v) {
        return v.getWidth() >= MIN_VALID_SIZE && v.getHeight() >= MIN_VALID_SIZE;
    }

    public static boolean isVisibleToUser(View v, DeviceInfo device) {
        if (!v.isShown()) return false;
        return XYInterval.of(0, 0, device.getWidth(), device.getHeight()).overlaps(bounds(v));
    }

    public static boolean canR2LScroll(View v) { return v.getFlags().getScroll().isLeft(); }
    public static boolean canL2RScroll(View v) { return v.getFlags().getScroll().isRight(); }
    public static boolean canB2TScroll(View v) { return v.getFlags().getScroll().isTop(); }
    public static boolean canT2BScroll(View v) { return v.getFlags().getScroll().isBottom(); }

    public static boolean hasValidChild(View v) {
        for (View c : v.getChildren()) {
            if (isValid(c)) return true;
        }
        return false;
    }

    /** Index of the view among its parent's children, or -1 for a root. */
    public static int indexOf(View v) {
        View p = v.getParent();
        return p == null ? -1 : p.getChildren().indexOf(v);
    }

    public static long areaOf(View v) {
        return (long) v.getWidth() * v.getHeight();
    }

    /** Whether {@code ancestor} is a strict ancestor of {@code v}. */
    public static boolean isChild(View v, View ancestor) {
        for (View p = v.getParent(); p != null; p = p.getParent()) {
            if (p == ancestor) return true;
        }
        return false;
    }

    /** Path from {@code ancestor} down to {@code v} inclusive, or empty when unrelated. */
    public static List<View> path(View v, View ancestor) {
        List<View> path = new ArrayList<>();
        for (View p = v; p != null; p = p.getParent()) {
            path.add(p);
            if (p == ancestor) {
                Collections.reverse(path);
                return path;
            }
        }
        return Collections.emptyList();
    }

    /** Splits {@code pkg:type/entry}; returns three empty strings when the id is malformed. */
    public static String[] splitResourceId(String resId) {
        if (resId == null || resId.isEmpty()) return new String[] {"", "", ""};
        int colon = resId.indexOf(':');
        int slash = resId.indexOf('/');
        if (colon < 0 || slash < 0 || slash < colon) return new String[] {"", "", ""};
        return new String[] {
                resId.substring(0, colon),
                resId.substring(colon + 1, slash),
                resId.substring(slash + 1)
        };
    }

    // ── Bounds ────────────────────────────────────────────────────────────

    public static XYInterval bounds(View v) {
        return XYInterval.of(x0(v), y0(v), x1(v), y1(v));
    }

    public static int x0(View v) { return v.getDrawingX(); }
    public static int x1(View v) { return v.getDrawingX() + v.getWidth(); }
    public static int y0(View v) { return v.getDrawingY(); }
    public static int y1(View v) { return v.getDrawingY() + v.getHeight(); }

    public static int xCenter(View v) { return (x0(v) + x1(v)) / 2; }
    public static int yCenter(View v) { return (y0(v) + y1(v)) / 2; }
}
