package droidreplay.device;

/**
 * Filters for {@link DroidInput#select(SelectOptions)}. Every non-null
 * filter must hold; matching is a case-insensitive substring test.
 */
public class SelectOptions {

    private String textContains;
    private String resIdContains;
    private String descContains;
    private boolean compressed;

    public static SelectOptions create(boolean compressed) {
        return new SelectOptions().compressed(compressed);
    }

    public SelectOptions textContains(String text) {
        this.textContains = text;
        return this;
    }

    public SelectOptions resIdContains(String resId) {
        this.resIdContains = resId;
        return this;
    }

    public SelectOptions descContains(String desc) {
        this.descContains = desc;
        return this;
    }

    /** Only views important for accessibility are reported when set. */
    public SelectOptions compressed(boolean compressed) {
        this.compressed = compressed;
        return this;
    }

    public String getTextContains()  { return textContains; }
    public String getResIdContains() { return resIdContains; }
    public String getDescContains()  { return descContains; }
    public boolean isCompressed()    { return compressed; }

    @Override
    public String toString() {
        return "SelectOptions{text=" + textContains + ", resId=" + resIdContains
                + ", desc=" + descContains + ", compressed=" + compressed + "}";
    }
}
