package droidreplay.segment;

/**
 * Divides a segment: either a {@link SplitSeparator} into two sides or a
 * {@link ShrinkSeparator} re-rooting the segment on fewer views.
 */
public abstract class Separator {

    Separator() {}
}
