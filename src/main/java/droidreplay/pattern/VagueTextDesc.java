package droidreplay.pattern;

import droidreplay.model.View;
import droidreplay.model.Views;
import droidreplay.text.BowModel;
import droidreplay.text.Vectors;
import droidreplay.text.Words;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * A label shown as text on one device and only as content description on
 * the other. The recorded text is looked up among playee descriptions, or
 * the recorded description among playee texts; the most similar candidate
 * by bag of words wins.
 */
public class VagueTextDesc extends VagueText {

    public VagueTextDesc(PatternContext ctx) {
        super(ctx);
    }

    @Override
    public String getName() {
        return "vague-text-desc";
    }

    @Override
    protected boolean doMatch() {
        found.clear();
        View v = ctx.view();
        if (v.getText().isEmpty() && v.getDesc().isEmpty()) {
            return false;
        }
        String label = v.getText().isEmpty() ? v.getDesc() : v.getText();
        Function<View, String> prop = v.getText().isEmpty() ? View::getText : View::getDesc;

        List<View> candidates = new ArrayList<>(ctx.playee().ui().findViews(w -> {
            String other = prop.apply(w);
            return Views.isVisibleToUser(w, ctx.playee().device())
                    && !other.isEmpty()
                    && (Words.wordsInclude(other, label) || Words.wordsInclude(label, other));
        }));
        if (Words.splitAsWords(label).size() == 1) {
            candidates.removeIf(w -> !Words.splitAsWords(prop.apply(w)).contains(label));
        }
        if (candidates.isEmpty()) {
            return false;
        }

        List<String> corpus = new ArrayList<>();
        corpus.add(label + " " + v.getResEntry());
        for (View w : candidates) {
            corpus.add(prop.apply(w) + " " + w.getResEntry());
        }
        BowModel model = new BowModel(corpus);
        int index = Vectors.closest(model.vector(0), model.vectors().subList(1, corpus.size()));
        found.add(candidates.get(index));
        return true;
    }
}
