package droidreplay.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Text typed into the focused view.
 */
public class TextEvent extends ReplayEvent {

    @JsonProperty("text") private String text;

    public TextEvent() {}

    public TextEvent(String text, long t) {
        super(t);
        this.text = text;
    }

    public String getText() { return text; }

    @Override
    public String describe() {
        return "text('" + text + "')";
    }
}
