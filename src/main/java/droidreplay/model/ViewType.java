package droidreplay.model;

/**
 * Widget kinds the replay algorithms distinguish. Everything else is
 * {@link #VIEW}.
 */
public enum ViewType {
    DECOR_VIEW,
    VIEW_PAGER,
    TAB_HOST,
    WEB_VIEW,
    RECYCLER_VIEW,
    LIST_VIEW,
    GRID_VIEW,
    SCROLL_VIEW,
    HORIZONTAL_SCROLL_VIEW,
    NESTED_SCROLL_VIEW,
    TOOLBAR,
    VIEW
}
