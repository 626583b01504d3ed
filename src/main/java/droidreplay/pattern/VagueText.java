package droidreplay.pattern;

import droidreplay.UnreachableStateException;
import droidreplay.device.DroidInput;
import droidreplay.device.EventTranslator;
import droidreplay.model.View;
import droidreplay.model.Views;
import droidreplay.model.XYEvent;
import droidreplay.segment.SegmentFinder;
import droidreplay.select.AdaptiveSelector;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * A resized view whose text grew or got truncated. On a wider playee the
 * playee text is expected to start with the recorded text, on a narrower
 * one the recorded text starts with the playee text. Among the candidates
 * in the playee segment, the one closest in text length is fired with the
 * recorded event's gesture.
 */
public class VagueText extends BottomUpPattern {

    protected final List<View> found = new ArrayList<>();

    public VagueText(PatternContext ctx) {
        super(ctx);
    }

    @Override
    public String getName() {
        return "vague-text";
    }

    @Override
    public PatternLevel getLevel() {
        return PatternLevel.EXPAND;
    }

    @Override
    protected boolean doMatch() {
        found.clear();
        if (ctx.view().getText().isEmpty()) {
            return false;
        }
        found.addAll(SegmentFinder.findViews(ctx.playee().segment(), this::isVagueMatch));
        return !found.isEmpty();
    }

    @Override
    protected boolean doApply(DroidInput input, AdaptiveSelector selector) {
        int length = ctx.view().getText().length();
        View matched = found.stream()
                .min(Comparator.comparingInt(w -> Math.abs(w.getText().length() - length)))
                .orElseThrow(() -> new UnreachableStateException("No vague text candidate to fire"));
        fire(input, matched);
        setDirty();
        return true;
    }

    public List<View> getFound() {
        return found;
    }

    /** Visible playee view whose text extends or truncates the recorded text. */
    protected boolean isVagueMatch(View w) {
        String text = ctx.view().getText();
        if (!Views.isVisibleToUser(w, ctx.playee().device()) || w.getText().isEmpty()) {
            return false;
        }
        return isExpanded() ? w.getText().startsWith(text) : text.startsWith(w.getText());
    }

    /** Whether the playee screen is at least as wide as the recordee's. */
    protected boolean isExpanded() {
        return ctx.recordee().device().getWidth() <= ctx.playee().device().getWidth();
    }

    /** Replays the recorded gesture on {@code target}, swipes scaled to the playee screen. */
    protected void fire(DroidInput input, View target) {
        if (!(ctx.event() instanceof XYEvent)) {
            throw new UnreachableStateException("Cannot fire " + ctx.event().describe() + " on a view");
        }
        new EventTranslator(input, ctx.recordee().device(), ctx.playee().device())
                .fire((XYEvent) ctx.event(), target);
    }
}
