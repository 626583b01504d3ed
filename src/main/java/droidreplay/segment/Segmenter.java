package droidreplay.segment;

import droidreplay.UnreachableStateException;
import droidreplay.geometry.Interval;
import droidreplay.geometry.XYInterval;
import droidreplay.geometry.XYIntervalTree;
import droidreplay.geometry.XYIntervals;
import droidreplay.model.DeviceInfo;
import droidreplay.model.Ui;
import droidreplay.model.View;
import droidreplay.model.ViewFinder;
import droidreplay.model.Views;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Splits a UI into visually coherent segments, in the manner of VIPS
 * (vision-based page segmentation).
 *
 * <p>Each segment's roots are run through an ordered rule list that decides,
 * view by view, whether to divide it into its children, keep it whole in the
 * segment's pool, or skip it. Separators are then searched among the pooled
 * views: elevated ones where views overlap, horizontal and vertical ones in
 * the gaps between them. The best separator splits the segment in two and
 * both halves go back on the worklist.
 *
 * <pre>{@code
 * SegmentationResult result = new Segmenter().segment(ui, device);
 * for (Segment s : result.accepted()) { ... }
 * }</pre>
 */
public class Segmenter {

    private static final Logger log = LoggerFactory.getLogger(Segmenter.class);

    public static final int    DEFAULT_OPTIMAL_HV_COUNT  = 5;
    public static final double DEFAULT_VIEW_SCREEN_RATIO  = 0.04;
    public static final double DEFAULT_VIEW_SEGMENT_RATIO = 0.75;

    /** Separator size that earns the full size award, the Bootstrap gutter width. */
    static final int SIZE_RECOMMENDED      = 30;
    static final int E_RECOMMENDED         = 15;
    static final int E_RECOMMENDED_DIFF    = 5;

    static final int SCORE_BASE            = 100;
    static final int AWARD_SIZE_BEST       = 120;
    static final int AWARD_NUM             = 50;
    static final int AWARD_CLS             = 10;
    static final int AWARD_VS_PARENT       = 80;
    static final int AWARD_HS_PARENT       = 80;
    static final int AWARD_BG              = 500;
    static final int AWARD_BG_CLS          = 200;
    static final int AWARD_BG_COLOR        = 250;
    static final int AWARD_INFO            = 50;
    static final int AWARD_TEXT            = 200;

    /** Base score plus the two smallest awards. */
    static final int SCORE_THRESHOLD = scoreThreshold();

    /** Outcome of one rule for one view. */
    enum Decision { DIVIDE, KEEP, SKIP, UNDECIDED }

    /** One step of the rule cascade. */
    @FunctionalInterface
    interface Rule {
        Decision test(View v, Segment seg, List<View> pool, DeviceInfo device);
    }

    private final int optimalHvCount;
    private final double viewScreenRatio;
    private final double viewSegmentRatio;
    private final List<Rule> rules;

    public Segmenter() {
        this(DEFAULT_OPTIMAL_HV_COUNT, DEFAULT_VIEW_SCREEN_RATIO, DEFAULT_VIEW_SEGMENT_RATIO);
    }

    /**
     * @param optimalHvCount   how many horizontal/vertical separators are accepted per UI
     * @param viewScreenRatio  views below this share of the screen area are kept whole
     * @param viewSegmentRatio share of the segment area under which a view with text
     *                         children, or whose largest child is smaller, is kept whole
     */
    public Segmenter(int optimalHvCount, double viewScreenRatio, double viewSegmentRatio) {
        this.optimalHvCount   = optimalHvCount;
        this.viewScreenRatio  = viewScreenRatio;
        this.viewSegmentRatio = viewSegmentRatio;
        this.rules            = buildRules();
    }

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Segments {@code ui} as laid out on {@code device}.
     *
     * @return the root of the segment tree and the accepted leaves; leaves
     *         holding nothing important for accessibility are rejected, and
     *         the roots of accepted leaves are widened to the outermost
     *         ancestor with identical bounds
     */
    public SegmentationResult segment(Ui ui, DeviceInfo device) {
        Segment root = Segments.create(List.of(ui.getDecor()));
        List<Segment> leaves = new ArrayList<>();
        Deque<Segment> queue = new ArrayDeque<>();
        queue.add(root);
        int hvCount = 0;

        while (!queue.isEmpty()) {
            Segment seg = queue.pollFirst();
            Separator sep = divide(seg, device);

            if (sep instanceof ShrinkSeparator) {
                queue.addFirst(((ShrinkSeparator) sep).getAfter());
                seg.setSep(sep);
                log.debug("++ accept S xxyy={} level={}", Segments.xxyy(seg), seg.getLevel());
                continue;
            }

            SplitSeparator split = (SplitSeparator) sep;
            boolean hv = split != null && split.getDirection() != Direction.E;
            if (split == null
                    || (hv && split.getScore() < SCORE_THRESHOLD)
                    || (hv && hvCount >= optimalHvCount)) {
                if (split != null) {
                    log.debug("-- decline {}", split);
                }
                leaves.add(seg);
            } else {
                queue.addLast(split.getFirst());
                queue.addLast(split.getSecond());
                seg.setSep(split);
                if (hv) {
                    hvCount++;
                }
                log.debug("++ accept {}", split);
            }
        }

        for (Segment s : leaves) {
            if (!Segments.isImportantForA11y(s)) {
                s.setAccepted(false);
            }
        }

        List<Segment> accepted = new ArrayList<>();
        for (Segment s : leaves) {
            if (!s.isAccepted()) continue;
            enlarge(s);
            accepted.add(s);
        }
        log.debug("Segmented {} into {} accepted segments ({} leaves)",
                ui.getActivity(), accepted.size(), leaves.size());
        return new SegmentationResult(root, accepted);
    }

    // ── Division ──────────────────────────────────────────────────────────

    /** Best separator of {@code seg}, a shrink separator, or null when it cannot be divided. */
    Separator divide(Segment seg, DeviceInfo device) {
        List<View> pool = new ArrayList<>();
        for (View r : seg.getRoots()) {
            segView(r, seg, pool, device);
        }

        SeparatorCandidates candidates = findSeparators(seg, pool);

        if (candidates.isEmpty()) {
            Set<View> roots = identitySet(seg.getRoots());
            for (View v : pool) {
                if (!roots.contains(v)) {
                    return new ShrinkSeparator(Segments.create(pool));
                }
            }
            return null;
        }

        if (!candidates.elevated.isEmpty()) {
            double best = Double.NEGATIVE_INFINITY;
            ElevatedGap bestSep = null;
            for (ElevatedGap sep : candidates.elevated) {
                double score = scoreElevated(sep);
                if (score > best) {
                    best = score;
                    bestSep = sep;
                }
            }
            Set<View> level = identitySet(bestSep.sameLevel);
            List<View> others = new ArrayList<>();
            for (View v : pool) {
                if (!level.contains(v)) others.add(v);
            }
            return new SplitSeparator(best, Direction.E,
                    Interval.of(Segments.x0(seg), Segments.x1(seg)),
                    Interval.of(Segments.y0(seg), Segments.y1(seg)),
                    Segments.create(bestSep.sameLevel), Segments.create(others));
        }

        double best = Double.NEGATIVE_INFINITY;
        XYInterval bestSep = null;
        Direction bestDir = Direction.H;
        for (XYInterval sep : candidates.vertical) {
            double score = scoreHV(sep, Direction.V, neighbors(sep, Direction.V, pool));
            if (score > best) {
                best = score;
                bestSep = sep;
                bestDir = Direction.V;
            }
        }
        for (XYInterval sep : candidates.horizontal) {
            double score = scoreHV(sep, Direction.H, neighbors(sep, Direction.H, pool));
            if (score > best) {
                best = score;
                bestSep = sep;
                bestDir = Direction.H;
            }
        }

        List<List<View>> sides = bothSides(bestSep, bestDir, pool);
        return new SplitSeparator(best, bestDir, bestSep.x(), bestSep.y(),
                Segments.create(sides.get(0)), Segments.create(sides.get(1)));
    }

    /** Runs the rule cascade on {@code v}: dividing recurses, keeping pools, skipping drops. */
    void segView(View v, Segment seg, List<View> pool, DeviceInfo device) {
        for (Rule rule : rules) {
            switch (rule.test(v, seg, pool, device)) {
                case DIVIDE:
                    for (View c : v.getChildren()) {
                        segView(c, seg, pool, device);
                    }
                    return;
                case KEEP:
                    pool.add(v);
                    return;
                case SKIP:
                    return;
                default:
                    break;
            }
        }
        throw new UnreachableStateException("No segmentation rule decided on " + v);
    }

    // ── Separators ────────────────────────────────────────────────────────

    /** Views of one drawing level paired with the pooled views overlapping one of them. */
    static final class ElevatedGap {
        final List<View> sameLevel;
        final List<View> overlapping;

        ElevatedGap(List<View> sameLevel, List<View> overlapping) {
            this.sameLevel   = sameLevel;
            this.overlapping = overlapping;
        }
    }

    static final class SeparatorCandidates {
        final List<ElevatedGap> elevated    = new ArrayList<>();
        final List<XYInterval> horizontal   = new ArrayList<>();
        final List<XYInterval> vertical     = new ArrayList<>();

        boolean isEmpty() {
            return elevated.isEmpty() && horizontal.isEmpty() && vertical.isEmpty();
        }
    }

    /**
     * Elevated separators come from pooled views overlapping each other;
     * horizontal and vertical ones are the gaps left on each axis once every
     * pooled view's projection is removed, except gaps on the segment border.
     */
    static SeparatorCandidates findSeparators(Segment seg, List<View> pool) {
        XYInterval segBounds = Segments.bounds(seg);
        XYIntervals rest = new XYIntervals(segBounds);
        XYIntervalTree<View> tree = new XYIntervalTree<>();
        tree.insert(segBounds, null);
        for (View v : pool) {
            XYInterval bounds = Views.bounds(v);
            tree.insert(bounds, v);
            rest.remove(bounds);
        }

        SeparatorCandidates found = new SeparatorCandidates();
        for (View v : pool) {
            List<View> overlapping = new ArrayList<>();
            for (View w : tree.query(Views.bounds(v))) {
                if (w != v) overlapping.add(w);
            }
            if (!overlapping.isEmpty()) {
                List<View> sameLevel = new ArrayList<>();
                for (View w : pool) {
                    if (w.getDrawingLevel() == v.getDrawingLevel()) sameLevel.add(w);
                }
                found.elevated.add(new ElevatedGap(sameLevel, overlapping));
            }
        }

        Interval segX = segBounds.x();
        Interval segY = segBounds.y();
        for (Interval inv : rest.xs()) {
            if (inv.low() == segX.low() || inv.high() == segX.high()) continue;
            found.vertical.add(new XYInterval(inv, segY));
        }
        for (Interval inv : rest.ys()) {
            if (inv.low() == segY.low() || inv.high() == segY.high()) continue;
            found.horizontal.add(new XYInterval(segX, inv));
        }
        return found;
    }

    /** Views touching the separator on each side. */
    static List<List<View>> neighbors(XYInterval sep, Direction dir, List<View> pool) {
        List<View> s1 = new ArrayList<>();
        List<View> s2 = new ArrayList<>();
        if (dir == Direction.H) {
            for (View v : pool) {
                if (sep.y().low() == Views.y1(v)) {
                    s1.add(v);
                } else if (sep.y().high() == Views.y0(v)) {
                    s2.add(v);
                }
            }
        } else {
            for (View v : pool) {
                if (sep.x().low() == Views.x1(v)) {
                    s1.add(v);
                } else if (sep.x().high() == Views.x0(v)) {
                    s2.add(v);
                }
            }
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            throw new UnreachableStateException("No neighbor views found for separator " + sep);
        }
        return List.of(s1, s2);
    }

    /** All views on each side of the separator: [left, right] for V, [top, bottom] for H. */
    static List<List<View>> bothSides(XYInterval sep, Direction dir, List<View> pool) {
        List<View> s1 = new ArrayList<>();
        List<View> s2 = new ArrayList<>();
        if (dir == Direction.H) {
            for (View v : pool) {
                if (sep.y().low() >= Views.y1(v)) {
                    s1.add(v);
                } else if (sep.y().high() <= Views.y0(v)) {
                    s2.add(v);
                }
            }
        } else {
            for (View v : pool) {
                if (sep.x().low() >= Views.x1(v)) {
                    s1.add(v);
                } else if (sep.x().high() <= Views.x0(v)) {
                    s2.add(v);
                }
            }
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            throw new UnreachableStateException("No views found on both sides of separator " + sep);
        }
        return List.of(s1, s2);
    }

    // ── Scoring ───────────────────────────────────────────────────────────

    /**
     * Wider separators score higher, as do separators with unbalanced sides
     * and separators whose sides differ in class, scroll container,
     * background or informativeness.
     */
    static double scoreHV(XYInterval sep, Direction dir, List<List<View>> sides) {
        double score = SCORE_BASE;
        Interval across = dir == Direction.V ? sep.x() : sep.y();
        score += Math.min((across.high() - across.low() + 1) / (double) SIZE_RECOMMENDED * 100,
                AWARD_SIZE_BEST);

        List<View> s1 = sides.get(0);
        List<View> s2 = sides.get(1);
        if (s1.size() != s2.size()) {
            score += AWARD_NUM;
        }
        for (View a : s1) {
            for (View b : s2) {
                if (!a.getCls().equals(b.getCls())) {
                    score += AWARD_CLS;
                }

                View vScroll = ViewFinder.findVScrollableParent(a);
                if (vScroll != null && vScroll != ViewFinder.findVScrollableParent(b)) {
                    score += AWARD_VS_PARENT;
                }
                View hScroll = ViewFinder.findHScrollableParent(a);
                if (hScroll != null && hScroll != ViewFinder.findHScrollableParent(b)) {
                    score += AWARD_HS_PARENT;
                }

                boolean diffBgClass = !a.getBgClass().equals(b.getBgClass());
                boolean diffBgColor = !Objects.equals(a.getBgColor(), b.getBgColor());
                if (diffBgClass && diffBgColor) {
                    score += AWARD_BG;
                } else if (diffBgClass) {
                    score += AWARD_BG_CLS;
                } else if (diffBgColor) {
                    score += AWARD_BG_COLOR;
                }

                if (Views.isText(a) != Views.isText(b)) {
                    score += AWARD_TEXT + AWARD_INFO;
                } else if (Views.informativeLevelOf(a) != Views.informativeLevelOf(b)) {
                    score += AWARD_INFO;
                }
            }
        }
        return score;
    }

    static double scoreElevated(ElevatedGap sep) {
        int n1 = sep.sameLevel.size();
        int n2 = sep.overlapping.size();
        double score = SCORE_BASE;
        score += Math.min((n1 + n2) / (double) E_RECOMMENDED, 1) * 100;
        score += Math.min(Math.abs(n1 - n2) / (double) E_RECOMMENDED_DIFF, 1) * 100;
        return score;
    }

    private static int scoreThreshold() {
        int[] awards = {
                AWARD_SIZE_BEST, AWARD_NUM, AWARD_CLS, AWARD_VS_PARENT, AWARD_HS_PARENT,
                AWARD_BG, AWARD_BG_CLS, AWARD_BG_COLOR, AWARD_INFO, AWARD_TEXT
        };
        int min1 = Integer.MAX_VALUE;
        int min2 = Integer.MAX_VALUE;
        for (int a : awards) {
            if (a < min1) {
                min2 = min1;
                min1 = a;
            } else if (a < min2) {
                min2 = a;
            }
        }
        return SCORE_BASE + min1 + min2;
    }

    // ── Rules ─────────────────────────────────────────────────────────────

    private List<Rule> buildRules() {
        List<Rule> list = new ArrayList<>();
        // system bars
        list.add((v, s, p, d) -> Views.isNavBar(v) || Views.isStatusBar(v) ? Decision.SKIP : Decision.UNDECIDED);
        list.add((v, s, p, d) -> !Views.isVisibleToUser(v, d) ? Decision.SKIP : Decision.UNDECIDED);
        list.add((v, s, p, d) -> !Views.isValid(v) ? Decision.SKIP : Decision.UNDECIDED);
        // uninformative leaf
        list.add((v, s, p, d) -> v.getChildren().isEmpty()
                && Views.informativeLevelOf(v) == 0
                && !Views.isImportantForA11y(v) ? Decision.SKIP : Decision.UNDECIDED);
        list.add((v, s, p, d) -> Views.informativeLevelOf(v) >= 2 ? Decision.KEEP : Decision.UNDECIDED);
        list.add((v, s, p, d) -> v.getChildren().isEmpty()
                && (Views.isImportantForA11y(v) || Views.isText(v)) ? Decision.KEEP : Decision.UNDECIDED);
        list.add((v, s, p, d) -> v.getChildren().isEmpty() ? Decision.SKIP : Decision.UNDECIDED);
        list.add((v, s, p, d) -> !Views.isText(v) && !Views.hasValidChild(v) ? Decision.SKIP : Decision.UNDECIDED);
        list.add(Segmenter::singleValidChild);
        list.add(Segmenter::homogeneousLayout);
        list.add((v, s, p, d) -> s.getRoots().size() == 1 && s.getRoots().get(0) == v
                ? Decision.DIVIDE : Decision.UNDECIDED);
        list.add((v, s, p, d) -> Views.areaOf(v) < (double) d.getWidth() * d.getHeight() * viewScreenRatio
                ? Decision.KEEP : Decision.UNDECIDED);
        list.add((v, s, p, d) -> {
            long sum = 0;
            for (View c : v.getChildren()) sum += Views.areaOf(c);
            return sum > Views.areaOf(v) ? Decision.DIVIDE : Decision.UNDECIDED;
        });
        list.add(Segmenter::differentBackground);
        list.add((v, s, p, d) -> Views.areaOf(v) < Segments.areaOf(s) * viewSegmentRatio
                && v.getChildren().stream().anyMatch(Views::isText) ? Decision.KEEP : Decision.UNDECIDED);
        list.add((v, s, p, d) -> {
            long max = -1;
            for (View c : v.getChildren()) max = Math.max(max, Views.areaOf(c));
            return max < Segments.areaOf(s) * viewSegmentRatio ? Decision.KEEP : Decision.UNDECIDED;
        });
        list.add(Segmenter::previousSiblingsKept);
        list.add((v, s, p, d) -> Decision.KEEP);
        return Collections.unmodifiableList(list);
    }

    private static Decision singleValidChild(View v, Segment s, List<View> pool, DeviceInfo d) {
        View valid = null;
        int count = 0;
        for (View c : v.getChildren()) {
            if (Views.isValid(c)) {
                valid = c;
                count++;
            }
        }
        return count == 1 && !Views.isText(valid) ? Decision.DIVIDE : Decision.UNDECIDED;
    }

    /** More than three children sharing a layout, with at most two outliers. */
    private static Decision homogeneousLayout(View v, Segment s, List<View> pool, DeviceInfo d) {
        List<View> children = v.getChildren();
        if (children.size() <= 3) {
            return Decision.UNDECIDED;
        }
        Set<String> layouts = new HashSet<>();
        for (View c : children) {
            layouts.add(Views.layoutSummaryOf(c, 3));
        }
        int diff = layouts.size() - 1;
        int same = children.size() - diff;
        return same > diff && diff <= 2 ? Decision.KEEP : Decision.UNDECIDED;
    }

    /** A ripple child over a colour parent counts as the same background. */
    private static Decision differentBackground(View v, Segment s, List<View> pool, DeviceInfo d) {
        for (View c : v.getChildren()) {
            if ("ColorDrawable".equals(v.getBgClass()) && "RippleDrawable".equals(c.getBgClass())) {
                continue;
            }
            if (!c.getBgClass().equals(v.getBgClass()) || !Objects.equals(c.getBgColor(), v.getBgColor())) {
                return Decision.DIVIDE;
            }
        }
        return Decision.UNDECIDED;
    }

    private static Decision previousSiblingsKept(View v, Segment s, List<View> pool, DeviceInfo d) {
        List<View> siblings = v.getParent() == null ? Collections.emptyList() : v.getParent().getChildren();
        if (siblings.indexOf(v) == 0) {
            return Decision.UNDECIDED;
        }
        Set<View> pooled = identitySet(pool);
        for (View sib : siblings) {
            if (sib == v) {
                break;
            }
            if (!pooled.contains(sib)) {
                return Decision.UNDECIDED;
            }
        }
        return Decision.KEEP;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    /** Widens each root to its outermost ancestor with the same bounds, dropping duplicates. */
    private static void enlarge(Segment s) {
        Set<View> added = identitySet(Collections.emptyList());
        List<View> enlarged = new ArrayList<>();
        for (View r : s.getRoots()) {
            XYInterval bounds = Views.bounds(r);
            View p = r;
            while (p.getParent() != null && bounds.equals(Views.bounds(p.getParent()))) {
                p = p.getParent();
            }
            if (added.add(p)) {
                enlarged.add(p);
            }
        }
        s.replaceRoots(enlarged);
    }

    private static Set<View> identitySet(List<View> views) {
        Set<View> set = Collections.newSetFromMap(new IdentityHashMap<>());
        set.addAll(views);
        return set;
    }
}
