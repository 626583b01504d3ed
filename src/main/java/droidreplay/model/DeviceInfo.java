package droidreplay.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Static properties of an Android device: identity, screen size in pixels
 * and density.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DeviceInfo {

    @JsonProperty("board")   private String board;
    @JsonProperty("brand")   private String brand;
    @JsonProperty("model")   private String model;
    @JsonProperty("abi")     private String abi;
    @JsonProperty("width")   private int width;
    @JsonProperty("height")  private int height;
    @JsonProperty("dpi")     private int dpi;
    @JsonProperty("sdk")     private int sdk;
    @JsonProperty("release") private String release;

    public DeviceInfo() {}

    public DeviceInfo(String model, int width, int height, int dpi) {
        this.model  = model;
        this.width  = width;
        this.height = height;
        this.dpi    = dpi;
    }

    // ── Getters ───────────────────────────────────────────────────────────

    public String getBoard()   { return board; }
    public String getBrand()   { return brand; }
    public String getModel()   { return model; }
    public String getAbi()     { return abi; }
    public int getWidth()      { return width; }
    public int getHeight()     { return height; }
    public int getDpi()        { return dpi; }
    public int getSdk()        { return sdk; }
    public String getRelease() { return release; }

    // ── Setters ───────────────────────────────────────────────────────────

    public void setBoard(String board)     { this.board = board; }
    public void setBrand(String brand)     { this.brand = brand; }
    public void setModel(String model)     { this.model = model; }
    public void setAbi(String abi)         { this.abi = abi; }
    public void setWidth(int width)        { this.width = width; }
    public void setHeight(int height)      { this.height = height; }
    public void setDpi(int dpi)            { this.dpi = dpi; }
    public void setSdk(int sdk)            { this.sdk = sdk; }
    public void setRelease(String release) { this.release = release; }

    @Override
    public String toString() {
        return (model == null ? "device" : model) + "[" + width + "x" + height + "@" + dpi + "dpi]";
    }
}
