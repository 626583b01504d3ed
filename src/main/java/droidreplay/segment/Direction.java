package droidreplay.segment;

/** Orientation of a split separator. */
public enum Direction {
    /** Horizontal line; sides are top and bottom. */
    H,
    /** Vertical line; sides are left and right. */
    V,
    /** Elevation; sides are a drawing level and the views overlapping it. */
    E
}
