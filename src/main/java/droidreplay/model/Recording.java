package droidreplay.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A recorded session: the recordee device, the UI dumps captured along the
 * way and the ordered input events that reference them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Recording {

    public static final String CURRENT_SCHEMA_VERSION = "1.0";

    @JsonProperty("schemaVersion") private String schemaVersion = CURRENT_SCHEMA_VERSION;
    @JsonProperty("app")           private String app;
    @JsonProperty("recordedAt")    private Instant recordedAt;
    @JsonProperty("device")        private DeviceInfo device;
    @JsonProperty("uis")           private Map<String, Ui> uis = new LinkedHashMap<>();
    @JsonProperty("events")        private List<ReplayEvent> events = new ArrayList<>();

    public Recording() {}

    public Recording(String app, DeviceInfo device) {
        this.app        = app;
        this.device     = device;
        this.recordedAt = Instant.now();
    }

    /** Registers a UI dump under {@code key}. */
    public void addUi(String key, Ui ui) {
        uis.put(key, ui);
    }

    /** Appends an event; XY events get their UI key filled in from the registered dumps. */
    public void addEvent(ReplayEvent event) {
        if (event instanceof XYEvent) {
            XYEvent xy = (XYEvent) event;
            if (xy.getUiKey() == null && xy.getUi() != null) {
                for (Map.Entry<String, Ui> e : uis.entrySet()) {
                    if (e.getValue() == xy.getUi()) {
                        xy.setUiKey(e.getKey());
                        break;
                    }
                }
            }
        }
        events.add(event);
    }

    @JsonIgnore
    public int getEventCount() {
        return events.size();
    }

    // ── Getters ───────────────────────────────────────────────────────────

    public String getSchemaVersion()  { return schemaVersion; }
    public String getApp()            { return app; }
    public Instant getRecordedAt()    { return recordedAt; }
    public DeviceInfo getDevice()     { return device; }
    public Map<String, Ui> getUis()   { return uis; }
    public List<ReplayEvent> getEvents() { return events; }

    // ── Setters ───────────────────────────────────────────────────────────

    public void setSchemaVersion(String schemaVersion) { this.schemaVersion = schemaVersion; }
    public void setApp(String app)                     { this.app = app; }
    public void setRecordedAt(Instant recordedAt)      { this.recordedAt = recordedAt; }
    public void setDevice(DeviceInfo device)           { this.device = device; }
}
