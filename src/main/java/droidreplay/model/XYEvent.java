package droidreplay.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An event fired at a screen point. It keeps a reference to the recordee
 * {@link Ui} that was on screen when it was captured; in JSON that is the
 * key of the recording's UI dump.
 */
public abstract class XYEvent extends ReplayEvent {

    @JsonProperty("x")  private int x;
    @JsonProperty("y")  private int y;
    @JsonProperty("ui") private String uiKey;

    @JsonIgnore private Ui recordeeUi;

    protected XYEvent() {}

    protected XYEvent(Ui ui, int x, int y, long t) {
        super(t);
        this.recordeeUi = ui;
        this.x = x;
        this.y  = y;
    }

    public int getX()        { return x; }
    public int getY()        { return y; }
    public String getUiKey() { return uiKey; }
    public Ui getUi()        { return recordeeUi; }

    public void setUiKey(String uiKey) { this.uiKey = uiKey; }
    public void setUi(Ui ui)           { this.recordeeUi = ui; }
}
