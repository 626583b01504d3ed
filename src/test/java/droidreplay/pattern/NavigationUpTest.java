package droidreplay.pattern;

import droidreplay.ContractViolationException;
import droidreplay.device.DroidInput;
import droidreplay.model.DeviceInfo;
import droidreplay.model.TapEvent;
import droidreplay.model.Ui;
import droidreplay.select.AdaptiveSelector;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import static droidreplay.model.ViewBuilder.decor;
import static droidreplay.model.ViewBuilder.device;
import static droidreplay.model.ViewBuilder.ui;
import static droidreplay.model.ViewBuilder.view;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

public class NavigationUpTest {

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

    private PatternContext contextFor(String desc) {
        Ui recordee = ui(decor(1080, 1920)
                .child(view(0, 0, 150, 150).desc(desc).clickable()));
        Ui playee = ui(decor(1080, 1920).child(view(0, 0, 1080, 200).text("Title")));
        return PatternContexts.of(new TapEvent(recordee, 75, 75, 0), recordee.findViewByDesc(desc),
                recordee, phone, playee, phone);
    }

    @Test(description = "A back button is replayed as the back key and consumes the event")
    public void back_pressesBackKey() {
        NavigationUp pattern = new NavigationUp(contextFor("Back"));

        assertThat(pattern.match()).isTrue();
        assertThat(pattern.apply(input, selector)).isTrue();

        verify(input).pressBack();
        assertThat(pattern.isDirty()).isTrue();
        assertThat(pattern.getLevel()).isEqualTo(PatternLevel.TRANSFORM);
    }

    @Test(description = "Other descriptions do not match")
    public void otherDesc_noMatch() {
        assertThat(new NavigationUp(contextFor("Share")).match()).isFalse();
    }

    @Test(description = "Applying a pattern that has not matched is a contract violation")
    public void applyBeforeMatch_throws() {
        NavigationUp pattern = new NavigationUp(contextFor("Back"));

        assertThatThrownBy(() -> pattern.apply(input, selector))
                .isInstanceOf(ContractViolationException.class)
                .hasMessageContaining("navigation-up");
        verifyNoInteractions(input);
        assertThat(pattern.dismiss()).isFalse();
    }
}
