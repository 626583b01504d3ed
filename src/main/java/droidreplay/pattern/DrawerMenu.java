package droidreplay.pattern;

import droidreplay.model.View;
import droidreplay.model.ViewFinder;
import droidreplay.text.Words;

/**
 * Navigation drawer that was open on the recordee and is closed on the
 * playee. The recorded view must sit inside the drawer layout
 * ({@code drawer_menu} or {@code drawer_content}) and the recordee must
 * hold a clickable button closing the drawer, visible or not.
 */
public class DrawerMenu extends RevealButton {

    static final String OPEN_DESC = "Open navigation drawer";

    private View menuLayout;
    private View closeButton;

    public DrawerMenu(PatternContext ctx) {
        super(ctx);
    }

    @Override
    public String getName() {
        return "drawer-menu";
    }

    @Override
    protected boolean doMatch() {
        menuLayout = ViewFinder.findParent(ctx.view(), w -> Words.containsAll(w.getResEntry(), "drawer", "menu")
                || Words.containsAll(w.getResEntry(), "drawer", "content"));
        if (menuLayout == null) {
            return false;
        }
        closeButton = ViewFinder.findView(ctx.recordee().ui().getDecor(), w -> w.getFlags().isClickable()
                && !w.getDesc().isEmpty()
                && Words.containsAll(w.getDesc(), "close", "drawer"));
        return closeButton != null && super.doMatch();
    }

    @Override
    protected boolean isButton(View w) {
        return OPEN_DESC.equals(w.getDesc()) || Words.containsAll(w.getDesc(), "open", "drawer");
    }

    public View getMenuLayout() {
        return menuLayout;
    }

    public View getCloseButton() {
        return closeButton;
    }
}
