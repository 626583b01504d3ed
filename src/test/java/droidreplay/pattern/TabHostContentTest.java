package droidreplay.pattern;

import droidreplay.UnsupportedCircumstanceException;
import droidreplay.device.DroidInput;
import droidreplay.device.SelectOptions;
import droidreplay.device.ViewMap;
import droidreplay.model.DeviceInfo;
import droidreplay.model.TapEvent;
import droidreplay.model.Ui;
import droidreplay.model.ViewBuilder;
import droidreplay.select.AdaptiveSelector;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.List;

import static droidreplay.model.ViewBuilder.decor;
import static droidreplay.model.ViewBuilder.device;
import static droidreplay.model.ViewBuilder.ui;
import static droidreplay.model.ViewBuilder.view;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class TabHostContentTest {

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

    private PatternContext context(boolean withStrip, ViewBuilder playeeDecor) {
        ViewBuilder recordeeDecor = decor(1080, 1920);
        if (withStrip) {
            recordeeDecor.child(view(0, 0, 1080, 200).resId("android:id/tabs")
                    .child(view(0, 0, 540, 200).text("Home"))
                    .child(view(540, 0, 1080, 200).text("Settings").selected()));
        }
        recordeeDecor.child(view(0, 200, 1080, 1920).resId("android:id/tabcontent")
                .child(view(0, 300, 1080, 400).text("Dark mode")));
        Ui recordee = ui(recordeeDecor);
        Ui playee = ui(playeeDecor);
        return PatternContexts.of(new TapEvent(recordee, 540, 350, 0), recordee.findViewByText("Dark mode"),
                recordee, phone, playee, phone);
    }

    @Test(description = "The tab selected on the recordee is tapped on the playee")
    public void selectedTabShown_tapsIt() {
        TabHostContent pattern = new TabHostContent(context(true, decor(1080, 1920)
                .child(view(0, 0, 540, 200).text("Home"))
                .child(view(540, 0, 1080, 200).text("Settings"))));

        assertThat(pattern.match()).isTrue();
        assertThat(pattern.apply(input, selector)).isFalse();

        verify(input).tap(541, 1);
        verify(input, never()).select(any(SelectOptions.class));
    }

    @Test(description = "Another tab is tapped to bring the strip around, then the selected one")
    public void selectedTabHidden_tapsSiblingThenSelected() {
        ViewMap settings = new ViewMap();
        settings.setText("Settings");
        settings.setBounds(new ViewMap.Bounds(600, 0, 1000, 200));
        when(input.select(any(SelectOptions.class))).thenReturn(List.of(settings));
        TabHostContent pattern = new TabHostContent(context(true, decor(1080, 1920)
                .child(view(0, 0, 540, 200).text("Home"))));

        assertThat(pattern.match()).isTrue();
        assertThat(pattern.apply(input, selector)).isFalse();

        verify(input).tap(1, 1);
        verify(input).tap(601, 1);
    }

    @Test(description = "Content without a tab strip on the recordee is unsupported")
    public void noStrip_throws() {
        TabHostContent pattern = new TabHostContent(context(false, decor(1080, 1920)
                .child(view(0, 0, 540, 200).text("Home"))));

        assertThat(pattern.match()).isTrue();
        assertThatThrownBy(() -> pattern.apply(input, selector))
                .isInstanceOf(UnsupportedCircumstanceException.class)
                .hasMessageContaining("No TabHosts");
    }
}
