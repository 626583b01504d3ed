package droidreplay.player;

import org.testng.annotations.Test;

import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

public class PlayerConfigTest {

    @Test(description = "The bundled config.properties carries the documented defaults")
    public void classpathConfig_defaults() {
        PlayerConfig config = new PlayerConfig();

        assertThat(config.getLookaheadK()).isEqualTo(3);
        assertThat(config.getMaxAttempts()).isEqualTo(5);
        assertThat(config.isSkipUntranslatable()).isTrue();
        assertThat(config.isTimeSensitive()).isFalse();
        assertThat(config.getSwipeDurationMs()).isEqualTo(500L);
        assertThat(config.getViewSegmentRatio()).isEqualTo(0.75);
    }

    @Test(description = "Missing keys fall back to defaults")
    public void emptyProperties_defaults() {
        PlayerConfig config = new PlayerConfig(new Properties());

        assertThat(config.getLookaheadK()).isEqualTo(3);
        assertThat(config.getMaxAttempts()).isEqualTo(5);
        assertThat(config.isSkipUntranslatable()).isTrue();
        assertThat(config.getStepDelayMs()).isZero();
        assertThat(config.getMaxSwipesPerDirection()).isEqualTo(5);
        assertThat(config.getOptimalHvCount()).isEqualTo(5);
        assertThat(config.getViewScreenRatio()).isEqualTo(0.04);
        assertThat(config.isVagueTextDescEnabled()).isFalse();
    }

    @Test(description = "Explicit values override defaults and surrounding blanks are ignored")
    public void overrides() {
        Properties props = new Properties();
        props.setProperty(PlayerConfig.KEY_LOOKAHEAD_K, " 7 ");
        props.setProperty(PlayerConfig.KEY_SKIP_UNTRANSLATABLE, "false");
        props.setProperty(PlayerConfig.KEY_STEP_DELAY, "250");
        props.setProperty(PlayerConfig.KEY_VIEW_SCREEN_RATIO, "0.1");

        PlayerConfig config = new PlayerConfig(props);

        assertThat(config.getLookaheadK()).isEqualTo(7);
        assertThat(config.isSkipUntranslatable()).isFalse();
        assertThat(config.getStepDelayMs()).isEqualTo(250L);
        assertThat(config.getViewScreenRatio()).isEqualTo(0.1);
    }

    @Test(description = "Unparsable numbers fall back to defaults")
    public void invalidValues_fallBack() {
        Properties props = new Properties();
        props.setProperty(PlayerConfig.KEY_MAX_ATTEMPTS, "many");
        props.setProperty(PlayerConfig.KEY_SWIPE_DURATION, "1.5s");
        props.setProperty(PlayerConfig.KEY_VIEW_SEGMENT_RATIO, "");

        PlayerConfig config = new PlayerConfig(props);

        assertThat(config.getMaxAttempts()).isEqualTo(5);
        assertThat(config.getSwipeDurationMs()).isEqualTo(500L);
        assertThat(config.getViewSegmentRatio()).isEqualTo(0.75);
    }

    @Test(description = "The recognizer factory adds the description matcher only when enabled")
    public void createRecognizer_honoursVagueTextDesc() {
        Properties props = new Properties();
        assertThat(new PlayerConfig(props).createRecognizer().getCatalogSize()).isEqualTo(14);

        props.setProperty(PlayerConfig.KEY_VAGUE_TEXT_DESC, "true");
        assertThat(new PlayerConfig(props).createRecognizer().getCatalogSize()).isEqualTo(15);
        assertThat(new PlayerConfig(props).createSegmenter()).isNotNull();
    }
}
