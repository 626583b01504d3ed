package droidreplay.model;

/**
 * Fragment helpers that need the owning {@link Ui}.
 */
public final class Fragments {

    private Fragments() {}

    /** The fragment's view, or null when the fragment has no view id or the view is gone. */
    public static View viewOf(Fragment f, Ui ui) {
        if (f.getViewId() == null) return null;
        return ui.findViewById(f.getViewId());
    }

    /** A fragment is valid when its view exists and is large enough to matter. */
    public static boolean isValid(Fragment f, Ui ui) {
        View view = viewOf(f, ui);
        return view != null && Views.isValid(view);
    }

    /** The active fragment whose view is {@code v} or an ancestor of it. */
    public static Fragment findFragmentByView(View v, Ui ui) {
        return ui.getFragmentManager().findFragment(f -> {
            if (!f.isActive()) return false;
            View fv = viewOf(f, ui);
            return fv != null && (fv == v || Views.isChild(v, fv));
        });
    }
}
