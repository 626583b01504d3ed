package droidreplay.model;

/**
 * Fluent builder for hand-made view trees in tests. Bounds are absolute;
 * views are shown, enabled and important for accessibility unless told
 * otherwise.
 */
public final class ViewBuilder {

    private final View view;

    private ViewBuilder(ViewType type, String cls) {
        this.view = new View(type, cls);
    }

    public static ViewBuilder view(int left, int top, int right, int bottom) {
        return new ViewBuilder(ViewType.VIEW, "android.view.View").bounds(left, top, right, bottom);
    }

    public static ViewBuilder decor(int width, int height) {
        return new ViewBuilder(ViewType.DECOR_VIEW, "com.android.internal.policy.DecorView")
                .bounds(0, 0, width, height);
    }

    public static ViewBuilder of(ViewType type, int left, int top, int right, int bottom) {
        return new ViewBuilder(type, type.name()).bounds(left, top, right, bottom);
    }

    public ViewBuilder bounds(int left, int top, int right, int bottom) {
        view.setBounds(left, top, right, bottom);
        return this;
    }

    public ViewBuilder cls(String cls)      { view.setCls(cls);      return this; }
    public ViewBuilder id(String id)        { view.setId(id);        return this; }
    public ViewBuilder text(String text)    { view.setText(text);    return this; }
    public ViewBuilder desc(String desc)    { view.setDesc(desc);    return this; }
    public ViewBuilder resId(String resId)  { view.setResId(resId);  return this; }
    public ViewBuilder bgColor(long color)  { view.setBgColor(color); return this; }

    public ViewBuilder clickable() {
        view.getFlags().setClickable(true);
        return this;
    }

    public ViewBuilder selected() {
        view.getFlags().setSelected(true);
        return this;
    }

    public ViewBuilder unimportant() {
        view.getFlags().setImportant(false);
        return this;
    }

    public ViewBuilder hidden() {
        view.setShown(false);
        view.getFlags().setVisibility(ViewFlags.Visibility.G);
        return this;
    }

    public ViewBuilder scroll(boolean left, boolean top, boolean right, boolean bottom) {
        view.getFlags().setScroll(new ViewFlags.Scroll(left, top, right, bottom));
        return this;
    }

    public ViewBuilder child(ViewBuilder child) {
        view.addChild(child.build());
        return this;
    }

    public ViewBuilder child(View child) {
        view.addChild(child);
        return this;
    }

    public View build() {
        return view;
    }

    /** Wraps {@code decor} in a prepared {@link Ui}. */
    public static Ui ui(ViewBuilder decor) {
        return new Ui("com.example.app", "MainActivity", decor.build()).prepare();
    }

    public static DeviceInfo device(int width, int height) {
        return new DeviceInfo("test-" + width + "x" + height, width, height, 420);
    }
}
