package droidreplay.segment;

import droidreplay.ContractViolationException;
import droidreplay.geometry.Interval;
import droidreplay.model.View;
import org.testng.annotations.Test;

import java.util.List;

import static droidreplay.model.ViewBuilder.view;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SegmentTest {

    private static SplitSeparator split(Segment first, Segment second) {
        return new SplitSeparator(200, Direction.H, Interval.of(0, 100), Interval.of(50, 60), first, second);
    }

    @Test(description = "A segment spans the merged bounds of its roots")
    public void create_mergesBounds() {
        View a = view(10, 20, 110, 60).build();
        View b = view(50, 80, 300, 120).build();

        Segment s = Segments.create(List.of(a, b));

        assertThat(Segments.xxyy(s)).isEqualTo("[10;300;20;120]");
        assertThat(Segments.areaOf(s)).isEqualTo(290L * 100);
    }

    @Test(description = "A segment needs at least one root")
    public void create_withoutRoots_throws() {
        assertThatThrownBy(() -> Segments.create(List.of()))
                .isInstanceOf(ContractViolationException.class);
    }

    @Test(description = "Setting a separator rejects the parent and accepts its children")
    public void setSep_acceptsChildren() {
        Segment parent = Segments.create(List.of(view(0, 0, 100, 100).build()));
        Segment top    = Segments.create(List.of(view(0, 0, 100, 50).build()));
        Segment bottom = Segments.create(List.of(view(0, 60, 100, 100).build()));
        top.setAccepted(false);

        parent.setSep(split(top, bottom));

        assertThat(parent.isAccepted()).isFalse();
        assertThat(parent.getChildren()).containsExactly(top, bottom);
        assertThat(top.isAccepted()).isTrue();
        assertThat(top.getParent()).isSameAs(parent);
        assertThat(top.getSiblings()).containsExactly(bottom);

        parent.delSep(true);

        assertThat(parent.isAccepted()).isTrue();
        assertThat(parent.getChildren()).isEmpty();
        assertThat(top.getParent()).isNull();
    }

    @Test(description = "A segment cannot become its own child")
    public void setSep_selfChild_throws() {
        Segment s = Segments.create(List.of(view(0, 0, 100, 100).build()));
        assertThatThrownBy(() -> s.setSep(new ShrinkSeparator(s)))
                .isInstanceOf(ContractViolationException.class);
        assertThat(s.isAccepted()).isTrue();
    }
}
