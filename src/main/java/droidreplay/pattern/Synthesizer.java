package droidreplay.pattern;

import droidreplay.UnreachableStateException;
import droidreplay.device.ViewMap;
import droidreplay.match.SegmentMatch;
import droidreplay.match.SegmentMatcher;
import droidreplay.model.DeviceInfo;
import droidreplay.model.EventQueue;
import droidreplay.model.Ui;
import droidreplay.model.View;
import droidreplay.model.Views;
import droidreplay.model.XYEvent;
import droidreplay.segment.Segment;
import droidreplay.segment.SegmentationResult;
import droidreplay.segment.Segmenter;
import droidreplay.select.AdaptiveSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Works out which patterns may make a recorded XY event fireable on the
 * playee when its view cannot be selected directly.
 *
 * <p>Candidates come in order: skipping ahead when a later event is already
 * fireable, then revealing a playee view that exists but is not visible,
 * then every bottom-up pattern recognized between the matched segments of
 * both screens.
 */
public class Synthesizer {

    private static final Logger log = LoggerFactory.getLogger(Synthesizer.class);

    private final Segmenter segmenter;
    private final SegmentMatcher matcher;
    private final AdaptiveSelector selector;
    private final Recognizer recognizer;
    private final int lookaheadK;

    public Synthesizer(Segmenter segmenter, SegmentMatcher matcher, AdaptiveSelector selector,
                       Recognizer recognizer, int lookaheadK) {
        this.segmenter  = segmenter;
        this.matcher    = matcher;
        this.selector   = selector;
        this.recognizer = recognizer;
        this.lookaheadK = lookaheadK;
    }

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Candidate patterns for {@code event} targeting recordee view {@code view}.
     *
     * @throws UnreachableStateException when the view or its segment cannot be
     *         located on either side
     */
    public List<Pattern> synthesize(EventQueue queue, XYEvent event, View view,
                                    Ui rUi, Ui pUi, DeviceInfo rDev, DeviceInfo pDev) {
        PatternContext unsegmented = new PatternContext(event, view, queue,
                new PatternContext.Side(SegmentMatch.NO_MATCH, rUi, rDev),
                new PatternContext.Side(SegmentMatch.NO_MATCH, pUi, pDev));

        Lookahead lookahead = new Lookahead(unsegmented, lookaheadK, selector);
        if (lookahead.match()) {
            log.debug("Lookahead matched, dropping {} events", lookahead.getPopCount());
            return List.of(lookahead);
        }

        List<Pattern> patterns = new ArrayList<>();
        Optional<ViewMap> vm = selector.select(view, false);
        if (vm.isPresent() && !vm.get().isImportant()) {
            View pv = findPlayeeView(vm.get(), pUi);
            if (pv == null) {
                throw new UnreachableStateException("Cannot find view on playee tree");
            }
            Invisible invisible = new Invisible(unsegmented, pv);
            if (invisible.match()) {
                patterns.add(invisible);
            }
        }
        patterns.addAll(synthesizeBottomUp(queue, event, view, rUi, pUi, rDev, pDev));
        return patterns;
    }

    /** Segments and matches both screens and runs the recognizer on the recorded view's segment pair. */
    public List<Pattern> synthesizeBottomUp(EventQueue queue, XYEvent event, View view,
                                            Ui rUi, Ui pUi, DeviceInfo rDev, DeviceInfo pDev) {
        SegmentationResult rRes = segmenter.segment(rUi, rDev);
        SegmentationResult pRes = segmenter.segment(pUi, pDev);
        SegmentMatch match = matcher.match(pRes.accepted(), rRes.accepted());

        Segment rSeg = findSegByView(rRes.accepted(), view);
        Segment pSeg = match.getPerfectMatch(rSeg);
        if (pSeg == null) {
            throw new UnreachableStateException("Segment " + rSeg + " is missing from the match");
        }
        if (pSeg == SegmentMatch.NO_MATCH) {
            SegmentMatch.BestMatches best = match.getBestMatches(rSeg);
            if (best.segments().isEmpty()) {
                throw new UnreachableStateException("No playee segment matches " + rSeg);
            }
            if (best.segments().size() > 1) {
                log.warn("{} playee segments tie at score {} for {}, taking the first",
                        best.segments().size(), best.score(), rSeg);
            }
            pSeg = best.segments().get(0);
        }
        log.debug("Recordee segment {} matched with playee segment {}", rSeg, pSeg);

        PatternContext ctx = new PatternContext(event, view, queue,
                new PatternContext.Side(rSeg, rUi, rDev),
                new PatternContext.Side(pSeg, pUi, pDev));
        return recognizer.recognize(ctx);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    /** The segment with a root that is {@code v} or one of its ancestors. */
    static Segment findSegByView(List<Segment> segments, View v) {
        for (Segment s : segments) {
            for (View root : s.getRoots()) {
                if (root == v || Views.isChild(v, root)) {
                    return s;
                }
            }
        }
        throw new UnreachableStateException("No segment contains " + v);
    }

    /** Locates the playee counterpart of a selected view by its most specific property. */
    static View findPlayeeView(ViewMap vm, Ui pUi) {
        if (!vm.getText().isEmpty()) {
            View found = pUi.findViewByText(vm.getText());
            return found != null ? found : pUi.findViewByText(vm.getText(), true);
        } else if (!vm.getResourceId().isEmpty()) {
            return pUi.findViewByResource(vm.getResourceType(), vm.getResourceEntry());
        } else if (!vm.getContentDesc().isEmpty()) {
            return pUi.findViewByDesc(vm.getContentDesc());
        }
        ViewMap.Bounds b = vm.getBounds();
        return pUi.findViewByXY(b.getLeft() + 1, b.getTop() + 1);
    }
}
