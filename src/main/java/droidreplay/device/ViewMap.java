package droidreplay.device;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Flat description of a view on the playee device as reported by the
 * automation transport's {@code select}. Attribute names follow the
 * uiautomator hierarchy dump.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ViewMap {

    /** Screen bounds of the view. */
    public static class Bounds {
        @JsonProperty("left")   private int left;
        @JsonProperty("top")    private int top;
        @JsonProperty("right")  private int right;
        @JsonProperty("bottom") private int bottom;

        public Bounds() {}

        public Bounds(int left, int top, int right, int bottom) {
            this.left   = left;
            this.top    = top;
            this.right  = right;
            this.bottom = bottom;
        }

        public int getLeft()   { return left; }
        public int getTop()    { return top; }
        public int getRight()  { return right; }
        public int getBottom() { return bottom; }

        public int centerX() { return (left + right) / 2; }
        public int centerY() { return (top + bottom) / 2; }

        @Override
        public String toString() {
            return "[" + left + "," + top + "][" + right + "," + bottom + "]";
        }
    }

    @JsonProperty("index")             private int index;
    @JsonProperty("package")           private String pkg = "";
    @JsonProperty("class")             private String cls = "";
    @JsonProperty("resource-id")       private String resourceId = "";
    @JsonProperty("resource-pkg")      private String resourcePkg = "";
    @JsonProperty("resource-type")     private String resourceType = "";
    @JsonProperty("resource-entry")    private String resourceEntry = "";
    @JsonProperty("visible")           private boolean visible;
    @JsonProperty("text")              private String text = "";
    @JsonProperty("content-desc")      private String contentDesc = "";
    @JsonProperty("clickable")         private boolean clickable;
    @JsonProperty("long-clickable")    private boolean longClickable;
    @JsonProperty("context-clickable") private boolean contextClickable;
    @JsonProperty("scrollable")        private boolean scrollable;
    @JsonProperty("focusable")         private boolean focusable;
    @JsonProperty("focused")           private boolean focused;
    @JsonProperty("selected")          private boolean selected;
    @JsonProperty("enabled")           private boolean enabled = true;
    @JsonProperty("important")         private boolean important = true;
    @JsonProperty("background")        private String background;
    @JsonProperty("bounds")            private Bounds bounds = new Bounds();

    // ── Getters ───────────────────────────────────────────────────────────

    public int getIndex()               { return index; }
    public String getPkg()              { return pkg; }
    public String getCls()              { return cls; }
    public String getResourceId()       { return resourceId; }
    public String getResourcePkg()      { return resourcePkg; }
    public String getResourceType()     { return resourceType; }
    public String getResourceEntry()    { return resourceEntry; }
    public boolean isVisible()          { return visible; }
    public String getText()             { return text; }
    public String getContentDesc()      { return contentDesc; }
    public boolean isClickable()        { return clickable; }
    public boolean isLongClickable()    { return longClickable; }
    public boolean isContextClickable() { return contextClickable; }
    public boolean isScrollable()       { return scrollable; }
    public boolean isFocusable()        { return focusable; }
    public boolean isFocused()          { return focused; }
    public boolean isSelected()         { return selected; }
    public boolean isEnabled()          { return enabled; }
    /** Important for accessibility. */
    public boolean isImportant()        { return important; }
    public String getBackground()       { return background; }
    public Bounds getBounds()           { return bounds; }

    // ── Setters ───────────────────────────────────────────────────────────

    public void setIndex(int index)                         { this.index = index; }
    public void setPkg(String pkg)                          { this.pkg = pkg; }
    public void setCls(String cls)                          { this.cls = cls; }
    public void setResourceId(String resourceId)            { this.resourceId = resourceId; }
    public void setResourcePkg(String resourcePkg)          { this.resourcePkg = resourcePkg; }
    public void setResourceType(String resourceType)        { this.resourceType = resourceType; }
    public void setResourceEntry(String resourceEntry)      { this.resourceEntry = resourceEntry; }
    public void setVisible(boolean visible)                 { this.visible = visible; }
    public void setText(String text)                        { this.text = text; }
    public void setContentDesc(String contentDesc)          { this.contentDesc = contentDesc; }
    public void setClickable(boolean clickable)             { this.clickable = clickable; }
    public void setLongClickable(boolean longClickable)     { this.longClickable = longClickable; }
    public void setContextClickable(boolean contextClickable) { this.contextClickable = contextClickable; }
    public void setScrollable(boolean scrollable)           { this.scrollable = scrollable; }
    public void setFocusable(boolean focusable)             { this.focusable = focusable; }
    public void setFocused(boolean focused)                 { this.focused = focused; }
    public void setSelected(boolean selected)               { this.selected = selected; }
    public void setEnabled(boolean enabled)                 { this.enabled = enabled; }
    public void setImportant(boolean important)             { this.important = important; }
    public void setBackground(String background)            { this.background = background; }
    public void setBounds(Bounds bounds)                    { this.bounds = bounds; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(cls).append(bounds);
        if (!text.isEmpty())          sb.append(" text='").append(text).append('\'');
        if (!contentDesc.isEmpty())   sb.append(" desc='").append(contentDesc).append('\'');
        if (!resourceEntry.isEmpty()) sb.append(" res=").append(resourceEntry);
        return sb.toString();
    }
}
