package droidreplay.pattern;

import droidreplay.model.DeviceInfo;
import droidreplay.model.TapEvent;
import droidreplay.model.Ui;
import droidreplay.model.ViewBuilder;
import droidreplay.model.ViewType;
import org.testng.annotations.Test;

import java.util.List;

import static droidreplay.model.ViewBuilder.decor;
import static droidreplay.model.ViewBuilder.device;
import static droidreplay.model.ViewBuilder.ui;
import static droidreplay.model.ViewBuilder.view;
import static org.assertj.core.api.Assertions.assertThat;

public class RecognizerTest {

    private final DeviceInfo phone = device(1080, 1920);

    @Test(description = "The text/description stand-in is only in the catalog when enabled")
    public void catalogSize() {
        assertThat(new Recognizer().getCatalogSize()).isEqualTo(14);
        assertThat(new Recognizer(500, 5, true).getCatalogSize()).isEqualTo(15);
    }

    @Test(description = "A back button is recognized as navigating up and nothing else")
    public void recognize_backButton() {
        Ui recordee = ui(decor(1080, 1920).child(view(0, 50, 150, 150).desc("Back").clickable()));
        Ui playee = ui(decor(1080, 1920).child(view(0, 0, 1080, 200).text("Title")));
        PatternContext ctx = PatternContexts.of(new TapEvent(recordee, 75, 100, 0),
                recordee.findViewByDesc("Back"), recordee, phone, playee, phone);

        List<Pattern> patterns = new Recognizer().recognize(ctx);

        assertThat(patterns).extracting(Pattern::getName).containsExactly("navigation-up");
    }

    @Test(description = "Matching patterns come back in catalog order, cheapest first")
    public void recognize_catalogOrder() {
        Ui recordee = ui(decor(1080, 1920)
                .child(ViewBuilder.of(ViewType.LIST_VIEW, 0, 200, 1080, 1800).resId("com.example:id/list")
                        .child(view(0, 200, 1080, 400).text("Save"))));
        Ui playee = ui(decor(1080, 1920)
                .child(ViewBuilder.of(ViewType.LIST_VIEW, 0, 200, 1080, 1800).resId("com.example:id/list")
                        .scroll(false, true, false, false)
                        .child(view(0, 200, 1080, 400).text("Save draft")))
                .child(view(980, 50, 1060, 150).desc("More options").clickable()));
        PatternContext ctx = PatternContexts.of(new TapEvent(recordee, 540, 300, 0),
                recordee.findViewByText("Save"), recordee, phone, playee, phone);

        List<Pattern> patterns = new Recognizer().recognize(ctx);

        assertThat(patterns).extracting(Pattern::getName)
                .containsExactly("vague-text", "vague-text-ext", "scroll", "more-options");
    }
}
