package droidreplay.pattern;

import droidreplay.device.DroidInput;
import droidreplay.model.DeviceInfo;
import droidreplay.model.TapEvent;
import droidreplay.model.Ui;
import droidreplay.model.View;
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
import static org.mockito.Mockito.verify;

public class VagueTextTest {

    @Mock private DroidInput input;
    @Mock private AdaptiveSelector selector;

    private AutoCloseable mocks;
    private final DeviceInfo narrow = device(720, 1280);
    private final DeviceInfo wide   = device(1080, 1920);

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    private static PatternContext context(String recordedText, DeviceInfo rDev, Ui playee, DeviceInfo pDev) {
        Ui recordee = ui(decor(rDev.getWidth(), rDev.getHeight())
                .child(view(100, 100, 400, 200).text(recordedText).clickable()));
        View recorded = recordee.findViewByText(recordedText);
        return PatternContexts.of(new TapEvent(recordee, 150, 150, 0), recorded, recordee, rDev, playee, pDev);
    }

    @Test(description = "On a wider playee the candidate extending the text and closest in length is tapped")
    public void wider_picksClosestExtension() {
        Ui playee = ui(decor(1080, 1920)
                .child(view(100, 300, 700, 400).text("Save as template"))
                .child(view(100, 100, 500, 200).text("Save draft"))
                .child(view(100, 500, 500, 600).text("Cancel"))
                .child(view(100, 700, 500, 800).text("Save").hidden()));
        VagueText pattern = new VagueText(context("Save", narrow, playee, wide));

        assertThat(pattern.match()).isTrue();
        assertThat(pattern.getFound()).extracting(View::getText).containsExactly("Save as template", "Save draft");

        assertThat(pattern.apply(input, selector)).isTrue();
        verify(input).tap(101, 101);
        assertThat(pattern.isDirty()).isTrue();
    }

    @Test(description = "On a narrower playee the truncated text closest in length is tapped")
    public void narrower_picksClosestTruncation() {
        Ui playee = ui(decor(720, 1280)
                .child(view(10, 10, 100, 60).text("Sa"))
                .child(view(10, 100, 200, 160).text("Save")));
        VagueText pattern = new VagueText(context("Save draft", wide, playee, narrow));

        assertThat(pattern.match()).isTrue();
        assertThat(pattern.apply(input, selector)).isTrue();

        verify(input).tap(11, 101);
    }

    @Test(description = "A recorded view without text never matches")
    public void noText_noMatch() {
        Ui recordee = ui(decor(1080, 1920).child(view(0, 0, 100, 100).desc("icon")));
        Ui playee = ui(decor(1080, 1920).child(view(0, 0, 100, 100).text("Anything")));
        VagueText pattern = new VagueText(PatternContexts.of(new TapEvent(recordee, 5, 5, 0),
                recordee.findViewByDesc("icon"), recordee, wide, playee, wide));

        assertThat(pattern.match()).isFalse();
        assertThat(new VagueTextExt(pattern.getContext()).match()).isFalse();
    }

    @Test(description = "The outward search keeps only the first candidate met")
    public void ext_firstCandidate() {
        Ui playee = ui(decor(1080, 1920)
                .child(view(100, 100, 500, 200).text("Save draft"))
                .child(view(100, 300, 500, 400).text("Save")));
        VagueTextExt pattern = new VagueTextExt(context("Save", wide, playee, wide));

        assertThat(pattern.match()).isTrue();
        assertThat(pattern.getFound()).extracting(View::getText).containsExactly("Save draft");
    }

    @Test(description = "Recorded text found as a playee description is tapped")
    public void desc_textShownAsDescription() {
        Ui playee = ui(decor(1080, 1920)
                .child(view(900, 1700, 1000, 1800).desc("Compose").clickable())
                .child(view(100, 100, 500, 200).desc("Compose later")));
        VagueTextDesc pattern = new VagueTextDesc(context("Compose", wide, playee, wide));

        assertThat(pattern.match()).isTrue();
        assertThat(pattern.getFound()).extracting(View::getDesc).containsExactly("Compose");

        assertThat(pattern.apply(input, selector)).isTrue();
        verify(input).tap(901, 1701);
    }
}
