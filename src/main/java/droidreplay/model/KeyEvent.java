package droidreplay.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A hardware or soft key press, e.g. {@code KEYCODE_BACK} (code 4).
 */
public class KeyEvent extends ReplayEvent {

    public static final int KEYCODE_BACK = 4;

    @JsonProperty("code") private int code;
    @JsonProperty("key")  private String key;

    public KeyEvent() {}

    public KeyEvent(int code, String key, long t) {
        super(t);
        this.code = code;
        this.key  = key;
    }

    public int getCode()   { return code; }
    public String getKey() { return key; }

    @Override
    public String describe() {
        return "key(" + (key == null ? String.valueOf(code) : key) + ")";
    }
}
