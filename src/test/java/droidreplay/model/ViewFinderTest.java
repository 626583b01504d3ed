package droidreplay.model;

import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.List;

import static droidreplay.model.ViewBuilder.decor;
import static droidreplay.model.ViewBuilder.ui;
import static droidreplay.model.ViewBuilder.view;
import static org.assertj.core.api.Assertions.assertThat;

public class ViewFinderTest {

    private Ui ui;
    private View toolbar;
    private View save;
    private View icon;

    @BeforeMethod
    public void setUp() {
        ui = ui(decor(1080, 1920)
                .child(view(0, 0, 1080, 200).resId("com.example:id/toolbar").desc("Toolbar")
                        .child(view(100, 50, 300, 150).text("Save").resId("com.example:id/btn_save").clickable())
                        .child(view(400, 50, 500, 150).clickable()))
                .child(view(0, 200, 1080, 1920).resId("com.example:id/content")
                        .child(view(0, 200, 1080, 400).text("Inbox"))
                        .child(view(0, 400, 1080, 600).text("Sent").hidden())));
        toolbar = ui.getDecor().getChildren().get(0);
        save    = toolbar.getChildren().get(0);
        icon    = toolbar.getChildren().get(1);
    }

    // ── Property searches ─────────────────────────────────────────────────

    @Test(description = "Property searches find views by text, resource and description")
    public void findByProperties() {
        assertThat(ui.findViewByText("Save")).isSameAs(save);
        assertThat(ui.findViewByText("save")).isNull();
        assertThat(ui.findViewByText("save", true)).isSameAs(save);
        assertThat(ui.findViewByResource("id", "btn_save")).isSameAs(save);
        assertThat(ui.findViewByDesc("Toolbar")).isSameAs(toolbar);
    }

    @Test(description = "Indices are followed child by child; out-of-range indices give null")
    public void findViewByIndices_followsPath() {
        View decorView = ui.getDecor();
        assertThat(ViewFinder.findViewByIndices(decorView, List.of(0, 1))).isSameAs(icon);
        assertThat(ViewFinder.findViewByIndices(decorView, List.of(0, 5))).isNull();
        assertThat(ViewFinder.findViewByIndices(decorView, List.of())).isSameAs(decorView);
    }

    @Test(description = "findParent skips the view itself and returns the nearest matching ancestor")
    public void findParent_nearestAncestor() {
        assertThat(ViewFinder.findParent(save, p -> !p.getResId().isEmpty())).isSameAs(toolbar);
        assertThat(ViewFinder.findParent(save, p -> p == save)).isNull();
    }

    // ── By point ──────────────────────────────────────────────────────────

    @Test(description = "Point hits are ordered deepest first")
    public void findViewsByXY_deepestFirst() {
        List<View> hits = ViewFinder.findViewsByXY(ui.getDecor(), 150, 100, true);
        assertThat(hits).containsExactly(save, toolbar, ui.getDecor());
    }

    @Test(description = "A view with text wins at a point")
    public void findViewByXY_prefersText() {
        assertThat(ui.findViewByXY(150, 100)).isSameAs(save);
    }

    @Test(description = "An informative ancestor does not beat the deepest hit")
    public void findViewByXY_ancestorDoesNotWin() {
        assertThat(ui.findViewByXY(450, 100)).isSameAs(icon);
    }

    @Test(description = "Hidden views are not hit when only visible views count")
    public void findViewByXY_hiddenIgnored() {
        View hit = ui.findViewByXY(500, 500);
        assertThat(hit.getText()).isEmpty();
        assertThat(hit.getResEntry()).isEqualTo("content");
    }

    // ── Scrollable ancestors ──────────────────────────────────────────────

    @Test(description = "List containers count as vertically scrollable, flagged views as horizontally")
    public void scrollableParents() {
        View item = view(0, 0, 100, 100).text("item").build();
        View list = ViewBuilder.of(ViewType.LIST_VIEW, 0, 0, 1080, 1000).child(item).build();
        View pager = view(0, 0, 1080, 1000).scroll(true, false, false, false).child(list).build();
        pager.linkChildren();

        assertThat(ViewFinder.findVScrollableParent(item)).isSameAs(list);
        assertThat(ViewFinder.findHScrollableParent(item)).isSameAs(pager);
    }
}
