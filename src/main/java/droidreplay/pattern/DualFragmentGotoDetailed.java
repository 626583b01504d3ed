package droidreplay.pattern;

import droidreplay.UnsupportedCircumstanceException;
import droidreplay.device.DroidInput;
import droidreplay.model.Fragment;
import droidreplay.model.Fragments;
import droidreplay.model.Ui;
import droidreplay.model.View;
import droidreplay.model.ViewFinder;
import droidreplay.model.Views;
import droidreplay.select.AdaptiveSelector;

import java.util.Comparator;
import java.util.List;

/**
 * The recorded view is in the details of a master/detail layout while the
 * playee shows the list. The list item selected on the recordee is found on
 * the playee by a text unique to it and tapped; the event is retried.
 */
public class DualFragmentGotoDetailed extends DualFragment {

    private Fragment detailed;

    public DualFragmentGotoDetailed(PatternContext ctx) {
        super(ctx);
    }

    @Override
    public String getName() {
        return "dual-fragment-goto-detailed";
    }

    @Override
    protected boolean doMatch() {
        Ui rUi = ctx.recordee().ui();
        detailed = rUi.getFragmentManager().findFragment(f -> {
            if (!f.isActive() || f.getViewId() == null || !Fragments.isValid(f, rUi)) return false;
            View fv = Fragments.viewOf(f, rUi);
            return fv == ctx.view() || Views.isChild(ctx.view(), fv);
        });
        return detailed != null && !isDescriptivePreview(detailed, rUi, ctx.recordee().device());
    }

    @Override
    protected boolean doApply(DroidInput input, AdaptiveSelector selector) {
        Ui rUi = ctx.recordee().ui();
        List<Fragment> siblings = rUi.getFragmentManager().findFragments(f -> f != detailed
                && f.isActive() && isShowing(f, rUi));

        Fragment descriptive = null;
        View content = null;
        for (Fragment f : siblings) {
            content = ViewFinder.findView(Fragments.viewOf(f, rUi), DualFragment::isList);
            if (content != null) {
                descriptive = f;
                break;
            }
        }
        if (content == null) {
            throw new UnsupportedCircumstanceException("No descriptive fragment with a list found");
        }

        View selected = null;
        for (View c : content.getChildren()) {
            if (c.getFlags().isSelected()) {
                selected = c;
                break;
            }
        }
        if (selected == null) {
            throw new UnsupportedCircumstanceException("No selected item in descriptive list");
        }

        String text = uniqueText(content, selected);
        View pContent = findPlayeeContent(content, descriptive);
        if (pContent == null) {
            throw new UnsupportedCircumstanceException("No list found on playee");
        }
        View pSelected = ViewFinder.findViewByText(pContent, text);
        if (pSelected == null) {
            throw new UnsupportedCircumstanceException("Item '" + text + "' not found in playee list");
        }
        tapCorner(input, pSelected);
        setDirty();
        return false;
    }

    public Fragment getDetailed() {
        return detailed;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private static boolean isShowing(Fragment f, Ui ui) {
        return !f.isHidden() && !f.isDetached() && f.getViewId() != null && Fragments.isValid(f, ui);
    }

    /**
     * First text of the selected item that no other item contains, or the
     * longest text when every one is shared.
     */
    static String uniqueText(View content, View selected) {
        List<View> texts = ViewFinder.findViews(selected, Views::isText);
        if (texts.isEmpty()) {
            throw new UnsupportedCircumstanceException("Selected item has no text");
        }
        for (View t : texts) {
            boolean shared = false;
            for (View other : content.getChildren()) {
                if (other == selected) continue;
                if (ViewFinder.findView(other, w -> w.getText().contains(t.getText())) != null) {
                    shared = true;
                    break;
                }
            }
            if (!shared) {
                return t.getText();
            }
        }
        return texts.stream()
                .max(Comparator.comparingInt(t -> t.getText().length()))
                .map(View::getText)
                .orElseThrow();
    }

    /** The playee list: by view id, else through the matching fragment. */
    private View findPlayeeContent(View content, Fragment descriptive) {
        Ui pUi = ctx.playee().ui();
        if (!content.getId().isEmpty()) {
            View byId = pUi.findViewById(content.getId());
            if (byId != null) return byId;
        }
        Fragment pFrag = pUi.getFragmentManager().findFragmentById(descriptive.getFragmentId());
        if (pFrag == null) {
            pFrag = pUi.getFragmentManager().findFragment(f -> f.isActive()
                    && f.getCls().equals(descriptive.getCls()) && isShowing(f, pUi));
        }
        if (pFrag == null) return null;
        View fv = Fragments.viewOf(pFrag, pUi);
        return fv == null ? null : ViewFinder.findView(fv, DualFragment::isList);
    }
}
