package droidreplay.device;

import droidreplay.model.DeviceInfo;
import droidreplay.model.Ui;
import droidreplay.model.View;
import droidreplay.model.ViewFinder;
import droidreplay.model.Views;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Dry-run device backed by a static UI dump.
 *
 * <p>{@code select} answers from the dump; actions do not change the screen
 * and are appended to an action log instead, one line per action
 * ({@code tap 12 40}, {@code swipe 540 1200 0 -600 500}, {@code key 4}).
 * Call {@link #setUi(Ui)} to move to another screen.
 */
public class OfflineDroid implements Droid, DroidInput {

    private static final Logger log = LoggerFactory.getLogger(OfflineDroid.class);

    private final DeviceInfo device;
    private final List<String> actions = new ArrayList<>();
    private Ui ui;

    public OfflineDroid(DeviceInfo device, Ui ui) {
        this.device = device;
        this.ui     = ui;
    }

    // ── Droid ─────────────────────────────────────────────────────────────

    @Override
    public DeviceInfo getDeviceInfo() {
        return device;
    }

    @Override
    public Ui fetchTopUi() {
        if (ui == null) {
            throw new DeviceException("No UI dump loaded for " + device);
        }
        return ui;
    }

    @Override
    public DroidInput getInput() {
        return this;
    }

    public void setUi(Ui ui) {
        this.ui = ui;
    }

    /** Actions performed so far, oldest first. */
    public List<String> getActions() {
        return Collections.unmodifiableList(actions);
    }

    // ── DroidInput ────────────────────────────────────────────────────────

    @Override
    public void tap(int x, int y) {
        record("tap " + x + " " + y);
    }

    @Override
    public void longTap(int x, int y) {
        record("long-tap " + x + " " + y);
    }

    @Override
    public void doubleTap(int x, int y) {
        record("double-tap " + x + " " + y);
    }

    @Override
    public void swipe(int x, int y, int dx, int dy, long durationMs) {
        record("swipe " + x + " " + y + " " + dx + " " + dy + " " + durationMs);
    }

    @Override
    public void key(int code) {
        record("key " + code);
    }

    @Override
    public void text(String text) {
        record("text " + text);
    }

    @Override
    public List<ViewMap> select(SelectOptions options) {
        View decor = fetchTopUi().getDecor();
        List<ViewMap> found = new ArrayList<>();
        for (View v : ViewFinder.findViews(decor, w -> matches(w, options))) {
            found.add(ViewMaps.of(v, device));
        }
        log.debug("select {} -> {} view(s)", options, found.size());
        return found;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private void record(String action) {
        actions.add(action);
        log.info("[offline] {}", action);
    }

    private static boolean matches(View v, SelectOptions options) {
        if (v.isDecor()) return false;
        if (options.isCompressed() && !Views.isImportantForA11y(v)) return false;
        return containsIgnoreCase(v.getText(), options.getTextContains())
                && containsIgnoreCase(v.getResId(), options.getResIdContains())
                && containsIgnoreCase(v.getDesc(), options.getDescContains());
    }

    private static boolean containsIgnoreCase(String value, String wanted) {
        if (wanted == null) return true;
        return value.toLowerCase(Locale.ROOT).contains(wanted.toLowerCase(Locale.ROOT));
    }
}
