package droidreplay.select;

import droidreplay.device.DroidInput;
import droidreplay.device.ViewMap;
import droidreplay.model.View;

import java.util.Optional;

/**
 * One step of the {@link AdaptiveSelector} cascade.
 */
public interface SelectionStrategy {

    /** Whether the recorded view carries what this strategy queries by. */
    boolean appliesTo(View view);

    /** Queries the device; empty when nothing acceptable was found. */
    Optional<ViewMap> select(DroidInput input, View view, boolean compressed);

    /**
     * When true and the strategy applied, its result is final even if
     * empty: later strategies are not consulted.
     */
    default boolean isTerminal() {
        return false;
    }
}
