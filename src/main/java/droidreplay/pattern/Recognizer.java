package droidreplay.pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Runs the bottom-up pattern catalog against a context. The catalog is
 * ordered from the cheapest workaround (transform the event) to the most
 * invasive one (merge screens); every pattern that matches is returned in
 * catalog order.
 */
public class Recognizer {

    private static final Logger log = LoggerFactory.getLogger(Recognizer.class);

    public static final long DEFAULT_SWIPE_DURATION_MS        = 500;
    public static final int  DEFAULT_MAX_SWIPES_PER_DIRECTION = 5;

    private final List<Function<PatternContext, BottomUpPattern>> catalog = new ArrayList<>();

    public Recognizer() {
        this(DEFAULT_SWIPE_DURATION_MS, DEFAULT_MAX_SWIPES_PER_DIRECTION, false);
    }

    /**
     * @param vagueTextDescEnabled whether text and content description may
     *                             stand in for each other
     */
    public Recognizer(long swipeDurationMs, int maxSwipesPerDirection, boolean vagueTextDescEnabled) {
        // transform
        catalog.add(NavigationUp::new);
        // expand
        catalog.add(VagueText::new);
        catalog.add(VagueTextExt::new);
        if (vagueTextDescEnabled) {
            catalog.add(VagueTextDesc::new);
        }
        catalog.add(ctx -> new Scroll(ctx, swipeDurationMs, maxSwipesPerDirection));
        // reveal
        catalog.add(MoreOptions::new);
        catalog.add(DrawerMenu::new);
        catalog.add(TabHostTab::new);
        catalog.add(TabHostContent::new);
        catalog.add(TabHost::new);
        catalog.add(DoubleSideViewPager::new);
        catalog.add(SingleSideViewPager::new);
        // merge
        catalog.add(DualFragmentGotoDescriptive::new);
        catalog.add(DualFragmentGotoDetailed::new);
        catalog.add(NewButton::new);
    }

    /** Every catalog pattern that matches {@code ctx}, in catalog order. */
    public List<Pattern> recognize(PatternContext ctx) {
        List<Pattern> matched = new ArrayList<>();
        for (Function<PatternContext, BottomUpPattern> factory : catalog) {
            BottomUpPattern p = factory.apply(ctx);
            if (p.match()) {
                log.debug("Pattern {} ({}) matches {}", p.getName(), p.getLevel(), ctx.view());
                matched.add(p);
            }
        }
        return matched;
    }

    public int getCatalogSize() {
        return catalog.size();
    }
}
