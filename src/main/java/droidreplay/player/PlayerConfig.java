package droidreplay.player;

import droidreplay.pattern.Recognizer;
import droidreplay.segment.Segmenter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Reads {@code config.properties} from the classpath and exposes typed replay
 * settings with defaults.
 *
 * <p>Any value can be overridden by a {@code config.local.properties} file on
 * the classpath.
 */
public class PlayerConfig {

    private static final Logger log = LoggerFactory.getLogger(PlayerConfig.class);

    private static final String CONFIG_FILE       = "config.properties";
    private static final String CONFIG_LOCAL_FILE = "config.local.properties";

    // Property keys
    static final String KEY_LOOKAHEAD_K          = "player.lookahead.k";
    static final String KEY_MAX_ATTEMPTS         = "player.event.max.attempts";
    static final String KEY_SKIP_UNTRANSLATABLE  = "player.skip.untranslatable";
    static final String KEY_TIME_SENSITIVE       = "player.time.sensitive";
    static final String KEY_STEP_DELAY           = "player.step.delay.ms";
    static final String KEY_SWIPE_DURATION       = "scroll.swipe.duration.ms";
    static final String KEY_MAX_SWIPES           = "scroll.max.swipes.per.direction";
    static final String KEY_OPTIMAL_HV_COUNT     = "segment.optimal.hv.count";
    static final String KEY_VIEW_SCREEN_RATIO    = "segment.view.screen.ratio";
    static final String KEY_VIEW_SEGMENT_RATIO   = "segment.view.segment.ratio";
    static final String KEY_VAGUE_TEXT_DESC      = "recognizer.vague.text.desc.enabled";

    // Defaults
    private static final int     DEFAULT_LOOKAHEAD_K         = 3;
    private static final int     DEFAULT_MAX_ATTEMPTS        = 5;
    private static final boolean DEFAULT_SKIP_UNTRANSLATABLE = true;
    private static final boolean DEFAULT_TIME_SENSITIVE      = false;
    private static final long    DEFAULT_STEP_DELAY          = 0L;
    private static final boolean DEFAULT_VAGUE_TEXT_DESC     = false;

    private final Properties props;

    /**
     * Loads configuration from the classpath.
     * {@code config.local.properties} values override {@code config.properties}.
     *
     * @throws IllegalStateException if the base config.properties cannot be loaded
     */
    public PlayerConfig() {
        props = new Properties();

        try (InputStream base = getClass().getClassLoader()
                .getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                throw new IOException("Classpath resource not found: " + CONFIG_FILE);
            }
            props.load(base);
            log.debug("Loaded base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load " + CONFIG_FILE, e);
        }

        try (InputStream local = getClass().getClassLoader()
                .getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}, using base config only: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
    }

    /** Accepts an already-populated {@link Properties}; used by tests. */
    PlayerConfig(Properties props) {
        this.props = props;
    }

    // ── Accessors ──────────────────────────────────────────────────────────

    /** Queued events the lookahead pattern inspects (default: 3). */
    public int getLookaheadK() {
        return getInt(KEY_LOOKAHEAD_K, DEFAULT_LOOKAHEAD_K);
    }

    /** Synthesis attempts per event before giving up on it (default: 5). */
    public int getMaxAttempts() {
        return getInt(KEY_MAX_ATTEMPTS, DEFAULT_MAX_ATTEMPTS);
    }

    /** Whether an untranslatable event is skipped rather than aborting the run (default: true). */
    public boolean isSkipUntranslatable() {
        return getBool(KEY_SKIP_UNTRANSLATABLE, DEFAULT_SKIP_UNTRANSLATABLE);
    }

    /** Whether the recorded gaps between events are waited out (default: false). */
    public boolean isTimeSensitive() {
        return getBool(KEY_TIME_SENSITIVE, DEFAULT_TIME_SENSITIVE);
    }

    /** Fixed pause after every event in milliseconds (default: 0). */
    public long getStepDelayMs() {
        return getLong(KEY_STEP_DELAY, DEFAULT_STEP_DELAY);
    }

    public long getSwipeDurationMs() {
        return getLong(KEY_SWIPE_DURATION, Recognizer.DEFAULT_SWIPE_DURATION_MS);
    }

    public int getMaxSwipesPerDirection() {
        return getInt(KEY_MAX_SWIPES, Recognizer.DEFAULT_MAX_SWIPES_PER_DIRECTION);
    }

    public int getOptimalHvCount() {
        return getInt(KEY_OPTIMAL_HV_COUNT, Segmenter.DEFAULT_OPTIMAL_HV_COUNT);
    }

    public double getViewScreenRatio() {
        return getDouble(KEY_VIEW_SCREEN_RATIO, Segmenter.DEFAULT_VIEW_SCREEN_RATIO);
    }

    public double getViewSegmentRatio() {
        return getDouble(KEY_VIEW_SEGMENT_RATIO, Segmenter.DEFAULT_VIEW_SEGMENT_RATIO);
    }

    /** Whether text and content description may stand in for each other (default: false). */
    public boolean isVagueTextDescEnabled() {
        return getBool(KEY_VAGUE_TEXT_DESC, DEFAULT_VAGUE_TEXT_DESC);
    }

    // ── Factories ─────────────────────────────────────────────────────────

    public Segmenter createSegmenter() {
        return new Segmenter(getOptimalHvCount(), getViewScreenRatio(), getViewSegmentRatio());
    }

    public Recognizer createRecognizer() {
        return new Recognizer(getSwipeDurationMs(), getMaxSwipesPerDirection(), isVagueTextDescEnabled());
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private long getLong(String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private double getDouble(String key, double defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid number for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private boolean getBool(String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        return Boolean.parseBoolean(raw.trim());
    }
}
