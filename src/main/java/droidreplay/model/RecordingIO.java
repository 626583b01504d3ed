package droidreplay.model;

import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads and writes {@link Recording} files and standalone {@link Ui} dumps.
 *
 * <p>On read a recording is validated against {@code recording-schema.json},
 * its schema version is checked, every UI dump is prepared (parent links
 * and drawing levels) and every XY event is bound to the dump it names.
 *
 * <p>On write the JSON is pretty-printed.
 */
public class RecordingIO {

    private static final Logger log = LoggerFactory.getLogger(RecordingIO.class);
    private static final String SCHEMA_RESOURCE = "/recording-schema.json";

    /** Shared ObjectMapper, thread-safe after configuration. */
    private static final ObjectMapper MAPPER;

    static {
        MAPPER = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
        // dumps write null for absent strings; the model uses ""
        MAPPER.configOverride(String.class)
                .setSetterInfo(JsonSetter.Value.forValueNulls(Nulls.AS_EMPTY));
    }

    /** Loaded once from the classpath; null if the schema resource is missing. */
    private static volatile JsonSchema JSON_SCHEMA = null;

    private RecordingIO() {}

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Reads, validates and links a {@link Recording}.
     *
     * @throws IOException               if the file cannot be read or parsed
     * @throws SchemaValidationException if the JSON does not satisfy the schema
     *                                   or an event names an unknown UI dump
     * @throws SchemaVersionException    if the schema version is not supported
     */
    public static Recording read(Path path) throws IOException {
        log.debug("Reading recording from: {}", path);
        String json = Files.readString(path);
        validateSchema(json, path.toString());
        Recording recording = fromJson(json);
        log.info("Loaded recording of '{}' with {} events and {} UI dumps from {}",
                recording.getApp(), recording.getEventCount(), recording.getUis().size(), path);
        return recording;
    }

    /** Reads a single UI dump (no schema validation) and prepares it. */
    public static Ui readUi(Path path) throws IOException {
        log.debug("Reading UI dump from: {}", path);
        Ui ui = MAPPER.readValue(path.toFile(), Ui.class);
        return ui.prepare();
    }

    /** Reads a device description. */
    public static DeviceInfo readDevice(Path path) throws IOException {
        return MAPPER.readValue(path.toFile(), DeviceInfo.class);
    }

    /**
     * Writes a {@link Recording} as pretty-printed JSON; parent directories
     * are created.
     */
    public static void write(Recording recording, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(path.toFile(), recording);
        log.info("Wrote recording of '{}' ({} events) to {}", recording.getApp(),
                recording.getEventCount(), path);
    }

    public static void writeUi(Ui ui, Path path) throws IOException {
        MAPPER.writeValue(path.toFile(), ui);
    }

    public static String toJson(Recording recording) throws IOException {
        return MAPPER.writeValueAsString(recording);
    }

    /**
     * Deserializes and links a {@link Recording} from a JSON string without
     * schema validation. Use {@link #read(Path)} for validated loading.
     */
    public static Recording fromJson(String json) throws IOException {
        Recording recording = MAPPER.readValue(json, Recording.class);
        if (!Recording.CURRENT_SCHEMA_VERSION.equals(recording.getSchemaVersion())) {
            throw new SchemaVersionException(
                    "Unsupported schema version: " + recording.getSchemaVersion()
                    + " (expected: " + Recording.CURRENT_SCHEMA_VERSION + ")");
        }
        link(recording);
        return recording;
    }

    /** Returns the shared ObjectMapper. */
    public static ObjectMapper getMapper() { return MAPPER; }

    // ── Linking ───────────────────────────────────────────────────────────

    private static void link(Recording recording) {
        Map<String, Ui> uis = recording.getUis();
        for (Ui ui : uis.values()) {
            ui.prepare();
        }
        List<ReplayEvent> events = recording.getEvents();
        for (int i = 0; i < events.size(); i++) {
            if (!(events.get(i) instanceof XYEvent)) continue;
            XYEvent event = (XYEvent) events.get(i);
            Ui ui = event.getUiKey() == null ? null : uis.get(event.getUiKey());
            if (ui == null) {
                throw new SchemaValidationException(
                        "Event " + i + " (" + event.describe() + ") references unknown UI dump '"
                        + event.getUiKey() + "'");
            }
            event.setUi(ui);
        }
    }

    // ── Schema validation ─────────────────────────────────────────────────

    private static void validateSchema(String json, String source) throws IOException {
        JsonSchema schema = getSchema();
        if (schema == null) {
            log.warn("recording-schema.json not found on classpath, skipping schema validation");
            return;
        }
        Set<ValidationMessage> errors = schema.validate(MAPPER.readTree(json));
        if (!errors.isEmpty()) {
            StringBuilder sb = new StringBuilder("Schema validation failed for ").append(source).append(":\n");
            errors.forEach(e -> sb.append("  ").append(e.getMessage()).append("\n"));
            throw new SchemaValidationException(sb.toString());
        }
    }

    private static JsonSchema getSchema() {
        if (JSON_SCHEMA == null) {
            synchronized (RecordingIO.class) {
                if (JSON_SCHEMA == null) {
                    try (InputStream is = RecordingIO.class.getResourceAsStream(SCHEMA_RESOURCE)) {
                        if (is == null) {
                            log.warn("Schema resource not found: {}", SCHEMA_RESOURCE);
                            return null;
                        }
                        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
                        JSON_SCHEMA = factory.getSchema(is);
                        log.debug("JSON schema loaded from classpath: {}", SCHEMA_RESOURCE);
                    } catch (IOException e) {
                        log.warn("Failed to load schema: {}", e.getMessage());
                    }
                }
            }
        }
        return JSON_SCHEMA;
    }

    // ── Exceptions ────────────────────────────────────────────────────────

    public static class SchemaVersionException extends RuntimeException {
        public SchemaVersionException(String msg) { super(msg); }
    }

    public static class SchemaValidationException extends RuntimeException {
        public SchemaValidationException(String msg) { super(msg); }
    }
}
