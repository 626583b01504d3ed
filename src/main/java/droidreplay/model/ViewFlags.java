package droidreplay.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Android view flags as dumped by the recorder. JSON keys use the compact
 * single-letter form of the dump ({@code V}, {@code f}, {@code F}, ...).
 */
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
public class ViewFlags {

    /** {@code View.VISIBLE}, {@code View.GONE}, {@code View.INVISIBLE}. */
    public enum Visibility { V, G, I }

    /** Directions in which the view can still scroll its content. */
    @JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
            getterVisibility = JsonAutoDetect.Visibility.NONE,
            isGetterVisibility = JsonAutoDetect.Visibility.NONE,
            setterVisibility = JsonAutoDetect.Visibility.NONE)
    public static class Scroll {
        @JsonProperty("l") private boolean left;
        @JsonProperty("t") private boolean top;
        @JsonProperty("r") private boolean right;
        @JsonProperty("b") private boolean bottom;

        public Scroll() {}

        public Scroll(boolean left, boolean top, boolean right, boolean bottom) {
            this.left   = left;
            this.top    = top;
            this.right  = right;
            this.bottom = bottom;
        }

        /** Content can move right to left. */
        public boolean isLeft()   { return left; }
        /** Content can move bottom to top. */
        public boolean isTop()    { return top; }
        /** Content can move left to right. */
        public boolean isRight()  { return right; }
        /** Content can move top to bottom. */
        public boolean isBottom() { return bottom; }
    }

    @JsonProperty("V")  private Visibility visibility = Visibility.V;
    @JsonProperty("f")  private boolean focusable;
    @JsonProperty("F")  private boolean focused;
    @JsonProperty("S")  private boolean selected;
    @JsonProperty("E")  private boolean enabled = true;
    @JsonProperty("d")  private boolean willDraw = true;
    @JsonProperty("s")  private Scroll scroll = new Scroll();
    @JsonProperty("c")  private boolean clickable;
    @JsonProperty("lc") private boolean longClickable;
    @JsonProperty("cc") private boolean contextClickable;
    @JsonProperty("a")  private boolean important = true;

    // ── Getters ───────────────────────────────────────────────────────────

    public Visibility getVisibility()   { return visibility; }
    public boolean isFocusable()        { return focusable; }
    public boolean isFocused()          { return focused; }
    public boolean isSelected()         { return selected; }
    public boolean isEnabled()          { return enabled; }
    public boolean isWillDraw()         { return willDraw; }
    public Scroll getScroll()           { return scroll; }
    public boolean isClickable()        { return clickable; }
    public boolean isLongClickable()    { return longClickable; }
    public boolean isContextClickable() { return contextClickable; }
    /** Important for accessibility. */
    public boolean isImportant()        { return important; }

    // ── Setters ───────────────────────────────────────────────────────────

    public void setVisibility(Visibility visibility)       { this.visibility = visibility; }
    public void setFocusable(boolean focusable)             { this.focusable = focusable; }
    public void setFocused(boolean focused)                 { this.focused = focused; }
    public void setSelected(boolean selected)               { this.selected = selected; }
    public void setEnabled(boolean enabled)                 { this.enabled = enabled; }
    public void setWillDraw(boolean willDraw)               { this.willDraw = willDraw; }
    public void setScroll(Scroll scroll)                    { this.scroll = scroll; }
    public void setClickable(boolean clickable)             { this.clickable = clickable; }
    public void setLongClickable(boolean longClickable)     { this.longClickable = longClickable; }
    public void setContextClickable(boolean contextClickable) { this.contextClickable = contextClickable; }
    public void setImportant(boolean important)             { this.important = important; }
}
