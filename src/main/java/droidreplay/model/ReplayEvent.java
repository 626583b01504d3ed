package droidreplay.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A recorded user input. {@code t} is the capture time in milliseconds since
 * the recording started.
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TapEvent.class,       name = "tap"),
        @JsonSubTypes.Type(value = LongTapEvent.class,   name = "long-tap"),
        @JsonSubTypes.Type(value = DoubleTapEvent.class, name = "double-tap"),
        @JsonSubTypes.Type(value = SwipeEvent.class,     name = "swipe"),
        @JsonSubTypes.Type(value = KeyEvent.class,       name = "key"),
        @JsonSubTypes.Type(value = TextEvent.class,      name = "text")
})
public abstract class ReplayEvent {

    @JsonProperty("t") private long t;

    protected ReplayEvent() {}

    protected ReplayEvent(long t) {
        this.t = t;
    }

    public long getT()       { return t; }
    public void setT(long t) { this.t = t; }

    /** Short human-readable form used in logs. */
    public abstract String describe();

    @Override
    public String toString() {
        return describe();
    }
}
