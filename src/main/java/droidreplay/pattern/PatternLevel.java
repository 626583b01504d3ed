package droidreplay.pattern;

/**
 * How far the playee layout departs from the recordee's, in the order the
 * recognizer tries the levels.
 */
public enum PatternLevel {
    /** The app offers another control for the same action. */
    TRANSFORM,
    /** The view was resized or moved inside a scrolling container. */
    EXPAND,
    /** The view is hidden behind a menu, tab or page. */
    REVEAL,
    /** The view sits on a screen the playee merges with or splits from another. */
    MERGE
}
