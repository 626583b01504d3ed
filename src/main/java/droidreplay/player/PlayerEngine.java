package droidreplay.player;

import droidreplay.ReplayException;
import droidreplay.UnreachableStateException;
import droidreplay.UnsupportedCircumstanceException;
import droidreplay.device.Droid;
import droidreplay.device.DroidInput;
import droidreplay.device.EventTranslator;
import droidreplay.device.ViewMap;
import droidreplay.match.SegmentMatcher;
import droidreplay.model.DeviceInfo;
import droidreplay.model.EventQueue;
import droidreplay.model.KeyEvent;
import droidreplay.model.Recording;
import droidreplay.model.ReplayEvent;
import droidreplay.model.TextEvent;
import droidreplay.model.Ui;
import droidreplay.model.View;
import droidreplay.model.XYEvent;
import droidreplay.pattern.Pattern;
import droidreplay.pattern.Synthesizer;
import droidreplay.select.AdaptiveSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Replays a {@link Recording} on a playee device.
 *
 * <p>For each event the engine:
 * <ol>
 *   <li>Forwards key and text events as they are.</li>
 *   <li>Resolves the recordee view at the recorded point of an XY event.</li>
 *   <li>Fires the event on the playee view the selector finds, when it is
 *       visible and important for accessibility.</li>
 *   <li>Otherwise synthesizes candidate patterns and applies them in order
 *       until one consumes the event; when none does, the event is put back
 *       and retried.</li>
 *   <li>Sleeps for pacing, per configuration.</li>
 * </ol>
 *
 * <p>An event the patterns cannot handle is skipped or aborts the run,
 * per {@link PlayerConfig#isSkipUntranslatable()}. Contract violations and
 * unreachable states always abort.
 */
public class PlayerEngine {

    private static final Logger log = LoggerFactory.getLogger(PlayerEngine.class);

    private final Droid droid;
    private final PlayerConfig config;
    private final AdaptiveSelector selector;
    private final Synthesizer synthesizer;

    // ── Constructor ───────────────────────────────────────────────────────

    /** Creates an engine configured from the classpath {@code config.properties}. */
    public PlayerEngine(Droid droid) {
        this(droid, new PlayerConfig());
    }

    public PlayerEngine(Droid droid, PlayerConfig config) {
        this.droid       = droid;
        this.config      = config;
        this.selector    = new AdaptiveSelector(droid.getInput());
        this.synthesizer = new Synthesizer(config.createSegmenter(), new SegmentMatcher(), selector,
                config.createRecognizer(), config.getLookaheadK());
    }

    /** Accepts pre-built collaborators so tests can inject mocks. */
    PlayerEngine(Droid droid, PlayerConfig config, AdaptiveSelector selector, Synthesizer synthesizer) {
        this.droid       = droid;
        this.config      = config;
        this.selector    = selector;
        this.synthesizer = synthesizer;
    }

    // ── Playback ──────────────────────────────────────────────────────────

    /**
     * Replays every event of {@code recording} in recorded order.
     *
     * @return a {@link PlaybackResult} summarising the run
     */
    public PlaybackResult play(Recording recording) {
        EventQueue queue = new EventQueue(recording.getEvents());
        DeviceInfo rDev = recording.getDevice();
        DeviceInfo pDev = droid.getDeviceInfo();
        EventTranslator translator = new EventTranslator(droid.getInput(), rDev, pDev);
        int total = queue.size();

        log.info("Starting playback of '{}' recorded on {}, playing on {} ({} events)",
                recording.getApp(), rDev, pDev, total);

        Map<ReplayEvent, Integer> attempts = new IdentityHashMap<>();
        List<EventOutcome> outcomes = new ArrayList<>();
        int step = 0;
        long lastT = -1;

        while (!queue.isEmpty()) {
            ReplayEvent event = queue.pop();
            int attempt = attempts.merge(event, 1, Integer::sum);
            if (attempt == 1) {
                step++;
                log.info("Step {}/{}: {}", step, total, event.describe());
            }

            try {
                if (attempt == 1 && config.isTimeSensitive() && lastT >= 0 && event.getT() > lastT) {
                    Thread.sleep(event.getT() - lastT);
                }
                lastT = event.getT();

                int sizeBefore = queue.size();
                boolean consumed = playEvent(queue, event, translator, rDev, pDev);
                if (!consumed) {
                    if (attempt >= config.getMaxAttempts()) {
                        throw new UnsupportedCircumstanceException("Event " + event.describe()
                                + " still not fireable after " + attempt + " attempts");
                    }
                    log.debug("Event {} not consumed yet, retrying ({}/{})",
                            event.describe(), attempt, config.getMaxAttempts());
                    queue.push(event);
                    continue;
                }
                int dropped = Math.max(0, sizeBefore - queue.size());
                outcomes.add(EventOutcome.played(step, event, attempt, dropped));

                long delay = config.getStepDelayMs();
                if (delay > 0) {
                    Thread.sleep(delay);
                }

            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                String reason = "Playback interrupted at step " + step;
                log.error(reason, ie);
                outcomes.add(EventOutcome.failed(step, event, attempt, reason));
                return new PlaybackResult(false, total, outcomes, reason);

            } catch (UnsupportedCircumstanceException uce) {
                String reason = "Event " + event.describe() + " could not be translated: " + uce.getMessage();
                if (config.isSkipUntranslatable()) {
                    log.warn("{}, skipping", reason);
                    outcomes.add(EventOutcome.skipped(step, event, attempt, uce.getMessage()));
                    continue;
                }
                log.error(reason, uce);
                outcomes.add(EventOutcome.failed(step, event, attempt, reason));
                return new PlaybackResult(false, total, outcomes, reason);

            } catch (ReplayException re) {
                String reason = "Replay failure at step " + step + " (" + event.describe() + "): " + re.getMessage();
                log.error(reason, re);
                outcomes.add(EventOutcome.failed(step, event, attempt, reason));
                return new PlaybackResult(false, total, outcomes, reason);
            }
        }

        PlaybackResult result = new PlaybackResult(true, total, outcomes, null);
        log.info("Playback of '{}' completed: {}", recording.getApp(), result);
        return result;
    }

    // ── Event dispatch ────────────────────────────────────────────────────

    /** Plays one event; returns whether it is consumed. */
    private boolean playEvent(EventQueue queue, ReplayEvent event, EventTranslator translator,
                              DeviceInfo rDev, DeviceInfo pDev) {
        DroidInput input = droid.getInput();
        if (event instanceof KeyEvent) {
            input.key(((KeyEvent) event).getCode());
            return true;
        }
        if (event instanceof TextEvent) {
            input.text(((TextEvent) event).getText());
            return true;
        }
        if (!(event instanceof XYEvent)) {
            throw new UnreachableStateException("Unknown event type: " + event.describe());
        }

        XYEvent xy = (XYEvent) event;
        Ui rUi = xy.getUi();
        View view = rUi.findViewByXY(xy.getX(), xy.getY());
        if (view == null) {
            throw new UnreachableStateException(
                    "No visible view found on recordee tree at (" + xy.getX() + ", " + xy.getY() + ")");
        }

        Optional<ViewMap> vm = selector.select(view, true);
        if (vm.isPresent() && vm.get().isVisible() && vm.get().isImportant()) {
            log.debug("Firing {} on {}", xy.describe(), vm.get());
            translator.fireAtCenter(xy, vm.get());
            return true;
        }

        Ui pUi = droid.fetchTopUi();
        List<Pattern> patterns = synthesizer.synthesize(queue, xy, view, rUi, pUi, rDev, pDev);
        if (patterns.isEmpty()) {
            throw new UnsupportedCircumstanceException("No pattern is recognized");
        }
        UnsupportedCircumstanceException last = null;
        boolean applied = false;
        for (Pattern p : patterns) {
            try {
                boolean consumed = p.apply(input, selector);
                applied = true;
                log.info("Applied pattern {} to {} (consumed={})", p.getName(), view, consumed);
                if (consumed) {
                    return true;
                }
            } catch (UnsupportedCircumstanceException e) {
                log.debug("Pattern {} not applicable: {}", p.getName(), e.getMessage());
                last = e;
            }
        }
        if (!applied) {
            throw last;
        }
        return false;
    }

    // ═════════════════════════════════════════════════════════════════════
    // Results
    // ═════════════════════════════════════════════════════════════════════

    /** What happened to one recorded event. */
    public static final class EventOutcome {

        public enum Status { PLAYED, SKIPPED, FAILED }

        private final int step;
        private final String event;
        private final Status status;
        private final int attempts;
        private final int dropped;
        private final String reason;

        private EventOutcome(int step, String event, Status status, int attempts, int dropped, String reason) {
            this.step     = step;
            this.event    = event;
            this.status   = status;
            this.attempts = attempts;
            this.dropped  = dropped;
            this.reason   = reason;
        }

        static EventOutcome played(int step, ReplayEvent e, int attempts, int dropped) {
            return new EventOutcome(step, e.describe(), Status.PLAYED, attempts, dropped, null);
        }

        static EventOutcome skipped(int step, ReplayEvent e, int attempts, String reason) {
            return new EventOutcome(step, e.describe(), Status.SKIPPED, attempts, 0, reason);
        }

        static EventOutcome failed(int step, ReplayEvent e, int attempts, String reason) {
            return new EventOutcome(step, e.describe(), Status.FAILED, attempts, 0, reason);
        }

        public int getStep()        { return step; }
        public String getEvent()    { return event; }
        public Status getStatus()   { return status; }
        public int getAttempts()    { return attempts; }

        /** Later events the lookahead dropped while playing this one. */
        public int getDropped()     { return dropped; }

        /** Why the event was skipped or failed, or {@code null} when played. */
        public String getReason()   { return reason; }

        @Override
        public String toString() {
            return String.format("#%d %s %s (attempts=%d%s)", step, status, event, attempts,
                    reason == null ? "" : ", " + reason);
        }
    }

    /**
     * Immutable summary of a playback run.
     */
    public static final class PlaybackResult {

        private final boolean success;
        private final int totalEvents;
        private final List<EventOutcome> outcomes;
        private final String failureReason;

        public PlaybackResult(boolean success, int totalEvents, List<EventOutcome> outcomes,
                              String failureReason) {
            this.success       = success;
            this.totalEvents   = totalEvents;
            this.outcomes      = Collections.unmodifiableList(new ArrayList<>(outcomes));
            this.failureReason = failureReason;
        }

        /** True when the run reached the end of the recording. */
        public boolean isSuccess()               { return success; }

        public int getTotalEvents()              { return totalEvents; }

        public List<EventOutcome> getOutcomes()  { return outcomes; }

        /** Human-readable reason the run aborted, or {@code null} on success. */
        public String getFailureReason()         { return failureReason; }

        public int getPlayed()   { return count(EventOutcome.Status.PLAYED); }
        public int getSkipped()  { return count(EventOutcome.Status.SKIPPED); }
        public int getFailures() { return count(EventOutcome.Status.FAILED); }

        private int count(EventOutcome.Status status) {
            return (int) outcomes.stream().filter(o -> o.getStatus() == status).count();
        }

        @Override
        public String toString() {
            return success
                    ? String.format("PlaybackResult{SUCCESS, %d played, %d skipped of %d events}",
                                    getPlayed(), getSkipped(), totalEvents)
                    : String.format("PlaybackResult{FAILED after %d played: %s}",
                                    getPlayed(), failureReason);
        }
    }
}
