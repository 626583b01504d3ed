package droidreplay.select;

import droidreplay.UnsupportedCircumstanceException;
import droidreplay.device.DroidInput;
import droidreplay.device.ViewMap;
import droidreplay.model.View;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Finds on the playee device the view corresponding to a recorded view.
 *
 * <p>Strategies run in priority order: text with another property, text
 * alone, strict description, resource entry, loose description. The first
 * strategy returning a view wins. The text-only strategy ends the cascade
 * for views with text, found or not.
 *
 * <pre>{@code
 * AdaptiveSelector selector = new AdaptiveSelector(droid.getInput());
 * Optional<ViewMap> target = selector.select(view, true);
 * }</pre>
 */
public class AdaptiveSelector {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveSelector.class);

    private final DroidInput input;
    private final List<SelectionStrategy> strategies;

    public AdaptiveSelector(DroidInput input) {
        this(input, defaultStrategies());
    }

    public AdaptiveSelector(DroidInput input, List<SelectionStrategy> strategies) {
        this.input      = input;
        this.strategies = List.copyOf(strategies);
    }

    public static List<SelectionStrategy> defaultStrategies() {
        return List.of(
                new TextAndPropertyStrategy(),
                new TextStrategy(),
                new StrictDescStrategy(),
                new ResourceEntryStrategy(),
                new LooseDescStrategy());
    }

    /**
     * @param view       recorded view; needs text, a resource id or a description
     * @param compressed query only views important for accessibility
     * @return the playee view, or empty when no strategy finds one
     * @throws UnsupportedCircumstanceException when the view has no text,
     *                                          resource id or description
     */
    public Optional<ViewMap> select(View view, boolean compressed) {
        if (view.getText().isEmpty() && view.getResId().isEmpty() && view.getDesc().isEmpty()) {
            throw new UnsupportedCircumstanceException(
                    "Cannot select " + view + ": text, resource-id and content-desc are all empty");
        }
        for (SelectionStrategy strategy : strategies) {
            if (!strategy.appliesTo(view)) continue;
            Optional<ViewMap> found = strategy.select(input, view, compressed);
            if (found.isPresent()) {
                log.debug("Selected {} for {} by {}", found.get(), view, strategy.getClass().getSimpleName());
                return found;
            }
            if (strategy.isTerminal()) {
                break;
            }
        }
        log.debug("No view selected for {}", view);
        return Optional.empty();
    }

    public DroidInput getInput() {
        return input;
    }
}
