package droidreplay.pattern;

import droidreplay.model.View;
import droidreplay.segment.BottomUpFinder;

/** {@link VagueText} searching outward from the playee segment, taking the first candidate met. */
public class VagueTextExt extends VagueText {

    public VagueTextExt(PatternContext ctx) {
        super(ctx);
    }

    @Override
    public String getName() {
        return "vague-text-ext";
    }

    @Override
    protected boolean doMatch() {
        found.clear();
        if (ctx.view().getText().isEmpty()) {
            return false;
        }
        View w = BottomUpFinder.findView(ctx.playee().segment(), this::isVagueMatch);
        if (w != null) {
            found.add(w);
        }
        return !found.isEmpty();
    }
}
