package droidreplay.pattern;

import droidreplay.UnsupportedCircumstanceException;
import droidreplay.device.DroidInput;
import droidreplay.device.ViewMap;
import droidreplay.model.DeviceInfo;
import droidreplay.model.TapEvent;
import droidreplay.model.Ui;
import droidreplay.model.View;
import droidreplay.model.ViewBuilder;
import droidreplay.model.ViewType;
import droidreplay.select.AdaptiveSelector;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.Optional;

import static droidreplay.model.ViewBuilder.decor;
import static droidreplay.model.ViewBuilder.device;
import static droidreplay.model.ViewBuilder.ui;
import static droidreplay.model.ViewBuilder.view;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class ViewPagerTest {

    @Mock private DroidInput input;
    @Mock private AdaptiveSelector selector;

    private AutoCloseable mocks;
    private final DeviceInfo phone = device(1080, 1920);

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    private static ViewBuilder pager() {
        return ViewBuilder.of(ViewType.VIEW_PAGER, 0, 200, 1080, 1800).resId("com.example:id/pager");
    }

    private PatternContext context(Ui recordee, Ui playee) {
        View recorded = recordee.findViewByText("Weekly report");
        return PatternContexts.of(new TapEvent(recordee, 540, 500, 0), recorded, recordee, phone, playee, phone);
    }

    @Test(description = "The playee page holding the recorded view is tapped")
    public void doubleSide_tapsPageWithView() {
        Ui recordee = ui(decor(1080, 1920).child(pager()
                .child(view(0, 200, 1080, 1800).child(view(0, 400, 1080, 600).text("Weekly report")))));
        Ui playee = ui(decor(1080, 1920).child(pager()
                .child(view(0, 200, 1080, 1800).child(view(0, 400, 1080, 600).text("Daily report")))
                .child(view(1080, 200, 2160, 1800).child(view(1080, 400, 2160, 600).text("Weekly report")))));
        DoubleSideViewPager pattern = new DoubleSideViewPager(context(recordee, playee));

        assertThat(pattern.match()).isTrue();
        assertThat(pattern.getPlayeePager().getResEntry()).isEqualTo("pager");
        assertThat(pattern.apply(input, selector)).isFalse();

        verify(input).tap(1081, 401);
    }

    @Test(description = "Text is searched on every page before resource ids are")
    public void doubleSide_textBeforeResourceAcrossPages() {
        Ui recordee = ui(decor(1080, 1920).child(pager()
                .child(view(0, 200, 1080, 1800)
                        .child(view(0, 400, 1080, 600).text("Weekly report").resId("com.example:id/report")))));
        Ui playee = ui(decor(1080, 1920).child(pager()
                .child(view(0, 200, 1080, 1800)
                        .child(view(0, 400, 1080, 600).text("Daily report").resId("com.example:id/report")))
                .child(view(1080, 200, 2160, 1800)
                        .child(view(1080, 400, 2160, 600).text("Weekly report")))));
        DoubleSideViewPager pattern = new DoubleSideViewPager(context(recordee, playee));

        assertThat(pattern.match()).isTrue();
        assertThat(pattern.apply(input, selector)).isFalse();

        verify(input).tap(1081, 401);
        verify(input, never()).tap(1, 401);
    }

    @Test(description = "A page without the recorded view anywhere is unsupported")
    public void doubleSide_missingPage_throws() {
        Ui recordee = ui(decor(1080, 1920).child(pager()
                .child(view(0, 200, 1080, 1800).child(view(0, 400, 1080, 600).text("Weekly report")))));
        Ui playee = ui(decor(1080, 1920).child(pager()
                .child(view(0, 200, 1080, 1800).child(view(0, 400, 1080, 600).text("Daily report")))));
        DoubleSideViewPager pattern = new DoubleSideViewPager(context(recordee, playee));

        assertThat(pattern.match()).isTrue();
        assertThatThrownBy(() -> pattern.apply(input, selector))
                .isInstanceOf(UnsupportedCircumstanceException.class);
    }

    @Test(description = "Only the playee pages the content: pages are tapped until the view can be selected")
    public void singleSide_tapsPagesInTurn() {
        Ui recordee = ui(decor(1080, 1920)
                .child(view(0, 400, 1080, 600).text("Weekly report")));
        Ui playee = ui(decor(1080, 1920).child(pager()
                .child(view(0, 200, 540, 1800).text("Daily"))
                .child(view(540, 200, 1080, 1800).child(view(540, 400, 1080, 600).text("Weekly report")))));
        when(selector.select(any(View.class), anyBoolean()))
                .thenReturn(Optional.empty(), Optional.of(new ViewMap()));
        SingleSideViewPager pattern = new SingleSideViewPager(context(recordee, playee));

        assertThat(pattern.match()).isTrue();
        assertThat(new DoubleSideViewPager(pattern.getContext()).match()).isFalse();
        assertThat(pattern.apply(input, selector)).isFalse();

        verify(input).tap(1, 201);
        verify(input).tap(541, 201);
    }

    @Test(description = "A recorded view absent from the whole playee screen does not match")
    public void singleSide_viewAbsent_noMatch() {
        Ui recordee = ui(decor(1080, 1920).child(view(0, 400, 1080, 600).text("Weekly report")));
        Ui playee = ui(decor(1080, 1920).child(pager().child(view(0, 200, 1080, 1800).text("Daily"))));

        assertThat(new SingleSideViewPager(context(recordee, playee)).match()).isFalse();
    }
}
