package droidreplay.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import droidreplay.geometry.XYInterval;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Snapshot of the top activity: its decor view hierarchy and its fragments.
 *
 * <p>Call {@link #prepare()} after building or deserializing a snapshot so
 * parent pointers and drawing levels are in place.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Ui {

    @JsonProperty("app")       private String app;
    @JsonProperty("activity")  private String activity;
    @JsonProperty("decor")     private View decor;
    @JsonProperty("fragments") private List<Fragment> fragments = new ArrayList<>();

    @JsonIgnore private FragmentManager fragmentManager;

    public Ui() {}

    public Ui(String app, String activity, View decor) {
        this.app      = app;
        this.activity = activity;
        this.decor    = decor;
    }

    /** Links parent pointers and computes drawing levels. */
    public Ui prepare() {
        if (decor != null) {
            decor.linkChildren();
            buildDrawingLevels();
        }
        return this;
    }

    // ── Accessors ─────────────────────────────────────────────────────────

    public String getApp()      { return app; }
    public String getActivity() { return activity; }
    public View getDecor()      { return decor; }

    public void setDecor(View decor) {
        this.decor = decor;
    }

    @JsonIgnore
    public FragmentManager getFragmentManager() {
        if (fragmentManager == null) {
            fragmentManager = new FragmentManager(fragments);
        }
        return fragmentManager;
    }

    // ── Finders ───────────────────────────────────────────────────────────

    public View findViewById(String id) {
        return decor == null ? null : ViewFinder.findViewById(decor, id);
    }

    public View findViewByHash(String hash) {
        return decor == null ? null : ViewFinder.findViewByHash(decor, hash);
    }

    public View findViewByXY(int x, int y) {
        return decor == null ? null : ViewFinder.findViewByXY(decor, x, y);
    }

    public View findViewByText(String text) {
        return findViewByText(text, false);
    }

    public View findViewByText(String text, boolean caseInsensitive) {
        return decor == null ? null : ViewFinder.findViewByText(decor, text, caseInsensitive);
    }

    public View findViewByDesc(String desc) {
        return decor == null ? null : ViewFinder.findViewByDesc(decor, desc);
    }

    public View findViewByResource(String type, String entry) {
        return decor == null ? null : ViewFinder.findViewByResource(decor, type, entry);
    }

    public List<View> findViews(Predicate<View> pred) {
        return decor == null ? new ArrayList<>() : ViewFinder.findViews(decor, pred);
    }

    // ── Drawing levels ────────────────────────────────────────────────────

    /**
     * Assigns drawing levels top-down, the way the Android Studio layout
     * inspector stacks views. Views on one level never overlap; a shown view
     * climbs from its parent's level to the first level where nothing
     * overlaps it, opening a new level when every level does. Each child of
     * the decor starts above all existing levels. Hidden views take their
     * parent's level and are not placed.
     *
     * @return the views on each level
     */
    public List<List<View>> buildDrawingLevels() {
        List<List<View>> levels = new ArrayList<>();
        if (decor == null) {
            return levels;
        }
        for (View child : decor.getChildren()) {
            assignLevel(child, levels.size(), levels);
        }
        return levels;
    }

    private static void assignLevel(View view, int base, List<List<View>> levels) {
        int level = base;
        if (view.isShown()) {
            XYInterval bounds = Views.bounds(view);
            int found = -1;
            for (int i = base; i < levels.size(); i++) {
                boolean free = true;
                for (View placed : levels.get(i)) {
                    if (Views.bounds(placed).overlaps(bounds)) {
                        free = false;
                        break;
                    }
                }
                if (free) {
                    found = i;
                    break;
                }
            }
            if (found < 0) {
                level = levels.size();
                levels.add(new ArrayList<>());
            } else {
                level = found;
            }
            levels.get(level).add(view);
        }
        view.setDrawingLevel(level);
        for (View child : view.getChildren()) {
            assignLevel(child, level, levels);
        }
    }
}
