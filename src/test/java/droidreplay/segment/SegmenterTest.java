package droidreplay.segment;

import droidreplay.model.DeviceInfo;
import droidreplay.model.Ui;
import droidreplay.model.View;
import org.testng.annotations.Test;

import java.util.List;

import static droidreplay.model.ViewBuilder.decor;
import static droidreplay.model.ViewBuilder.device;
import static droidreplay.model.ViewBuilder.ui;
import static droidreplay.model.ViewBuilder.view;
import static org.assertj.core.api.Assertions.assertThat;

public class SegmenterTest {

    private final DeviceInfo phone = device(1080, 1920);

    private static Ui inbox() {
        return ui(decor(1080, 1920)
                .child(view(0, 0, 1080, 200).bgColor(0xFFFF0000L)
                        .child(view(40, 50, 500, 150).text("Inbox")))
                .child(view(0, 300, 1080, 1900).bgColor(0xFFFFFFFFL)
                        .child(view(0, 300, 1080, 500).text("First"))
                        .child(view(0, 600, 1080, 800).text("Second"))));
    }

    @Test(description = "Gaps between text rows become horizontal separators, one accepted segment per row")
    public void segment_splitsAtGaps() {
        Ui ui = inbox();

        SegmentationResult result = new Segmenter().segment(ui, phone);

        List<Segment> accepted = result.accepted();
        assertThat(accepted).hasSize(3);
        assertThat(accepted.get(0).getRoots()).containsExactly(ui.findViewByText("Inbox"));
        assertThat(accepted.get(1).getRoots()).containsExactly(ui.findViewByText("First"));
        assertThat(accepted.get(2).getRoots()).containsExactly(ui.findViewByText("Second"));

        Segment root = result.root();
        assertThat(root.isAccepted()).isFalse();
        assertThat(root.getSep()).isInstanceOf(SplitSeparator.class);
        assertThat(((SplitSeparator) root.getSep()).getDirection()).isEqualTo(Direction.H);
        assertThat(SegmentFinder.findAccepts(root)).containsExactlyElementsOf(accepted);
    }

    @Test(description = "Accepted segments stay inside the screen and have a parent in the tree")
    public void segment_acceptedAreLeaves() {
        SegmentationResult result = new Segmenter().segment(inbox(), phone);

        for (Segment s : result.accepted()) {
            assertThat(s.getSep()).isNull();
            assertThat(s.getParent()).isNotNull();
            assertThat(Segments.x0(s)).isGreaterThanOrEqualTo(0);
            assertThat(Segments.y1(s)).isLessThanOrEqualTo(1920);
        }
    }

    @Test(description = "Too few separators allowed leaves the screen as fewer, larger segments")
    public void segment_respectsSeparatorBudget() {
        SegmentationResult result = new Segmenter(1, Segmenter.DEFAULT_VIEW_SCREEN_RATIO,
                Segmenter.DEFAULT_VIEW_SEGMENT_RATIO).segment(inbox(), phone);

        assertThat(result.accepted()).hasSize(2);
        assertThat(result.accepted().get(1).getRoots()).hasSize(2);
    }

    @Test(description = "A screen with nothing important for accessibility yields no accepted segment")
    public void segment_nothingImportant() {
        Ui ui = ui(decor(1080, 1920).unimportant()
                .child(view(0, 0, 1080, 1920).unimportant()));

        SegmentationResult result = new Segmenter().segment(ui, phone);

        assertThat(result.accepted()).isEmpty();
        assertThat(result.root().isAccepted()).isFalse();
    }

    @Test(description = "System bars are never part of a segment")
    public void segment_skipsSystemBars() {
        Ui ui = ui(decor(1080, 1920)
                .child(view(0, 0, 1080, 60).resId(droidreplay.model.Views.STATUS_BAR_ID))
                .child(view(0, 100, 1080, 300).text("Title"))
                .child(view(0, 400, 1080, 600).text("Body")));

        SegmentationResult result = new Segmenter().segment(ui, phone);

        for (Segment s : result.accepted()) {
            for (View r : s.getRoots()) {
                assertThat(r.getResId()).isNotEqualTo(droidreplay.model.Views.STATUS_BAR_ID);
            }
        }
        assertThat(result.accepted()).hasSize(2);
    }
}
