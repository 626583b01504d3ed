package droidreplay.pattern;

import droidreplay.ContractViolationException;
import droidreplay.device.DroidInput;
import droidreplay.model.View;
import droidreplay.model.Views;
import droidreplay.select.AdaptiveSelector;

/**
 * A reason why a recorded view is not directly actionable on the playee,
 * together with the actions that work around it.
 *
 * <p>{@link #match()} checks the circumstance and remembers what it found;
 * {@link #apply(DroidInput, AdaptiveSelector)} acts on it and reports
 * whether the recorded event is consumed. A pattern that touched the app
 * is marked dirty.
 */
public abstract class Pattern {

    protected final PatternContext ctx;

    private boolean matched;
    private boolean dirty;

    protected Pattern(PatternContext ctx) {
        this.ctx = ctx;
    }

    public abstract String getName();

    /** Whether the current circumstance fits this pattern. */
    public final boolean match() {
        matched = doMatch();
        return matched;
    }

    /**
     * Applies the pattern.
     *
     * @return true when the recorded event is consumed and must not be fired
     * @throws ContractViolationException when the pattern has not matched
     * @throws droidreplay.UnsupportedCircumstanceException when an artifact
     *         the pattern relies on cannot be found
     */
    public final boolean apply(DroidInput input, AdaptiveSelector selector) {
        if (!matched) {
            throw new ContractViolationException("Pattern " + getName() + " is not satisfied, don't apply");
        }
        return doApply(input, selector);
    }

    protected abstract boolean doMatch();

    protected abstract boolean doApply(DroidInput input, AdaptiveSelector selector);

    // ── Side effects ──────────────────────────────────────────────────────

    /** Whether applying the pattern produced side effects on the app. */
    public boolean isDirty() {
        return dirty;
    }

    protected void setDirty() {
        dirty = true;
    }

    protected void clearDirty() {
        dirty = false;
    }

    /** Dismissing side effects is not supported; always false. */
    public boolean dismiss() {
        return false;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    /** Taps just inside the top-left corner of {@code v}. */
    protected static void tapCorner(DroidInput input, View v) {
        input.tap(Views.x0(v) + 1, Views.y0(v) + 1);
    }

    public PatternContext getContext() {
        return ctx;
    }

    @Override
    public String toString() {
        return getName();
    }
}
