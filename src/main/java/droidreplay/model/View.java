package droidreplay.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One node of a dumped Android view hierarchy.
 *
 * <p>Drawing happens in three steps, and the coordinates exposed here follow
 * them:
 * <ol>
 *   <li>layout: {@code left/top/right/bottom} are absolute pixel bounds
 *       after layout;</li>
 *   <li>translation: {@code translationX/Y/Z} are absolute (they already
 *       include the ancestors' translation);</li>
 *   <li>scroll: {@code scrollX/Y} are absolute scroll offsets the view
 *       applies to its children.</li>
 * </ol>
 * The on-screen position is therefore
 * {@code drawingX = left + translationX - parent.scrollX}, likewise for y.
 *
 * <p>The parent pointer and drawing level are not serialized. After reading a
 * tree, {@link #linkChildren()} restores parents and
 * {@link Ui#buildDrawingLevels()} computes the levels.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonAutoDetect(fieldVisibility = JsonAutoDetect.Visibility.ANY,
        getterVisibility = JsonAutoDetect.Visibility.NONE,
        isGetterVisibility = JsonAutoDetect.Visibility.NONE,
        setterVisibility = JsonAutoDetect.Visibility.NONE)
public class View {

    @JsonProperty("type")         private ViewType type = ViewType.VIEW;
    @JsonProperty("package")      private String pkg = "";
    @JsonProperty("class")        private String cls = "";
    @JsonProperty("id")           private String id = "";
    @JsonProperty("hash")         private String hash = "";
    @JsonProperty("flags")        private ViewFlags flags = new ViewFlags();
    @JsonProperty("shown")        private boolean shown = true;
    @JsonProperty("bgClass")      private String bgClass = "";
    @JsonProperty("bgColor")      private Long bgColor;
    @JsonProperty("foreground")   private String foreground;

    @JsonProperty("left")         private int left;
    @JsonProperty("top")          private int top;
    @JsonProperty("right")        private int right;
    @JsonProperty("bottom")       private int bottom;
    @JsonProperty("elevation")    private double elevation;
    @JsonProperty("translationX") private int translationX;
    @JsonProperty("translationY") private int translationY;
    @JsonProperty("translationZ") private double translationZ;
    @JsonProperty("scrollX")      private int scrollX;
    @JsonProperty("scrollY")      private int scrollY;

    @JsonProperty("resPkg")       private String resPkg = "";
    @JsonProperty("resType")      private String resType = "";
    @JsonProperty("resEntry")     private String resEntry = "";
    @JsonProperty("desc")         private String desc = "";
    @JsonProperty("text")         private String text = "";
    @JsonProperty("tag")          private String tag = "";
    @JsonProperty("tip")          private String tip = "";
    @JsonProperty("hint")         private String hint = "";

    /** Current page, only for {@link ViewType#VIEW_PAGER}. */
    @JsonProperty("currPage")     private Integer currPage;
    /** Current tab, only for {@link ViewType#TAB_HOST}. */
    @JsonProperty("currTab")      private Integer currTab;

    @JsonProperty("children")     private List<View> children = new ArrayList<>();

    @JsonIgnore private View parent;
    @JsonIgnore private int drawingLevel = -1;

    public View() {}

    public View(ViewType type, String cls) {
        this.type = type;
        this.cls  = cls;
    }

    // ── Tree ──────────────────────────────────────────────────────────────

    public View getParent() {
        return parent;
    }

    public List<View> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /** Other children of this view's parent, in order. */
    public List<View> getSiblings() {
        if (parent == null) return Collections.emptyList();
        List<View> siblings = new ArrayList<>(parent.children);
        siblings.remove(this);
        return siblings;
    }

    public void addChild(View child) {
        child.parent = this;
        children.add(child);
    }

    public void removeChild(View child) {
        if (child.parent != this) return;
        child.parent = null;
        children.remove(child);
    }

    /** Restores parent pointers of the whole subtree after deserialization. */
    public void linkChildren() {
        for (View child : children) {
            child.parent = this;
            child.linkChildren();
        }
    }

    public boolean isDecor() {
        return type == ViewType.DECOR_VIEW;
    }

    // ── Geometry ──────────────────────────────────────────────────────────

    public int getWidth()  { return right - left; }
    public int getHeight() { return bottom - top; }

    public int getX() { return left + translationX; }
    public int getY() { return top + translationY; }
    public double getZ() { return elevation + translationZ; }

    public int getDrawingX() {
        return getX() - (parent == null ? 0 : parent.scrollX);
    }

    public int getDrawingY() {
        return getY() - (parent == null ? 0 : parent.scrollY);
    }

    public int getDrawingLevel()                 { return drawingLevel; }
    public void setDrawingLevel(int drawingLevel) { this.drawingLevel = drawingLevel; }

    // ── Identity ──────────────────────────────────────────────────────────

    /** {@code package:type/entry}, or empty when the view has no resource id. */
    public String getResId() {
        if (resPkg.isEmpty() && resType.isEmpty() && resEntry.isEmpty()) {
            return "";
        }
        return resPkg + ":" + resType + "/" + resEntry;
    }

    /** Background descriptor, class plus colour, used to compare backgrounds. */
    public String getBackground() {
        return bgClass + "/#" + (bgColor == null ? "nnnn" : Long.toHexString(bgColor));
    }

    // ── Getters ───────────────────────────────────────────────────────────

    public ViewType getType()        { return type; }
    public String getPkg()           { return pkg; }
    public String getCls()           { return cls; }
    public String getId()            { return id; }
    public String getHash()          { return hash; }
    public ViewFlags getFlags()      { return flags; }
    public boolean isShown()         { return shown; }
    public String getBgClass()       { return bgClass; }
    public Long getBgColor()         { return bgColor; }
    public String getForeground()    { return foreground; }
    public int getLeft()             { return left; }
    public int getTop()              { return top; }
    public int getRight()            { return right; }
    public int getBottom()           { return bottom; }
    public double getElevation()     { return elevation; }
    public int getTranslationX()     { return translationX; }
    public int getTranslationY()     { return translationY; }
    public double getTranslationZ()  { return translationZ; }
    public int getScrollX()          { return scrollX; }
    public int getScrollY()          { return scrollY; }
    public String getResPkg()        { return resPkg; }
    public String getResType()       { return resType; }
    public String getResEntry()      { return resEntry; }
    public String getDesc()          { return desc; }
    public String getText()          { return text; }
    public String getTag()           { return tag; }
    public String getTip()           { return tip; }
    public String getHint()          { return hint; }
    public Integer getCurrPage()     { return currPage; }
    public Integer getCurrTab()      { return currTab; }

    // ── Setters ───────────────────────────────────────────────────────────

    public void setType(ViewType type)                { this.type = type; }
    public void setPkg(String pkg)                    { this.pkg = pkg; }
    public void setCls(String cls)                    { this.cls = cls; }
    public void setId(String id)                      { this.id = id; }
    public void setHash(String hash)                  { this.hash = hash; }
    public void setFlags(ViewFlags flags)             { this.flags = flags; }
    public void setShown(boolean shown)               { this.shown = shown; }
    public void setBgClass(String bgClass)            { this.bgClass = bgClass; }
    public void setBgColor(Long bgColor)              { this.bgColor = bgColor; }
    public void setForeground(String foreground)      { this.foreground = foreground; }
    public void setElevation(double elevation)        { this.elevation = elevation; }
    public void setTranslationX(int translationX)     { this.translationX = translationX; }
    public void setTranslationY(int translationY)     { this.translationY = translationY; }
    public void setTranslationZ(double translationZ)  { this.translationZ = translationZ; }
    public void setScrollX(int scrollX)               { this.scrollX = scrollX; }
    public void setScrollY(int scrollY)               { this.scrollY = scrollY; }
    public void setResPkg(String resPkg)              { this.resPkg = resPkg; }
    public void setResType(String resType)            { this.resType = resType; }
    public void setResEntry(String resEntry)          { this.resEntry = resEntry; }
    public void setDesc(String desc)                  { this.desc = desc; }
    public void setText(String text)                  { this.text = text; }
    public void setTag(String tag)                    { this.tag = tag; }
    public void setTip(String tip)                    { this.tip = tip; }
    public void setHint(String hint)                  { this.hint = hint; }
    public void setCurrPage(Integer currPage)         { this.currPage = currPage; }
    public void setCurrTab(Integer currTab)           { this.currTab = currTab; }

    public void setBounds(int left, int top, int right, int bottom) {
        this.left   = left;
        this.top    = top;
        this.right  = right;
        this.bottom = bottom;
    }

    /** Sets {@code package:type/entry} from a full resource id; an unparsable id clears all three. */
    public void setResId(String resId) {
        String[] parts = Views.splitResourceId(resId);
        this.resPkg   = parts[0];
        this.resType  = parts[1];
        this.resEntry = parts[2];
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(cls.isEmpty() ? type.name() : cls);
        sb.append('{').append(left).append(',').append(top).append(',')
          .append(right).append(',').append(bottom);
        if (!text.isEmpty())     sb.append(" text='").append(text).append('\'');
        if (!desc.isEmpty())     sb.append(" desc='").append(desc).append('\'');
        if (!resEntry.isEmpty()) sb.append(" res=").append(resEntry);
        return sb.append('}').toString();
    }
}
