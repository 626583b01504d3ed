package droidreplay.device;

import droidreplay.model.DeviceInfo;
import droidreplay.model.View;
import droidreplay.model.Views;

/**
 * Builds {@link ViewMap}s from dumped views, the way a uiautomator-style
 * transport reports them.
 */
public final class ViewMaps {

    private ViewMaps() {}

    public static ViewMap of(View v, DeviceInfo device) {
        ViewMap vm = new ViewMap();
        vm.setIndex(Math.max(Views.indexOf(v), 0));
        vm.setPkg(v.getPkg());
        vm.setCls(v.getCls());
        vm.setResourceId(v.getResId());
        vm.setResourcePkg(v.getResPkg());
        vm.setResourceType(v.getResType());
        vm.setResourceEntry(v.getResEntry());
        vm.setVisible(Views.isVisibleToUser(v, device));
        vm.setText(v.getText());
        vm.setContentDesc(v.getDesc());
        vm.setClickable(v.getFlags().isClickable());
        vm.setLongClickable(v.getFlags().isLongClickable());
        vm.setContextClickable(v.getFlags().isContextClickable());
        vm.setScrollable(Views.canB2TScroll(v) || Views.canT2BScroll(v)
                || Views.canL2RScroll(v) || Views.canR2LScroll(v));
        vm.setFocusable(v.getFlags().isFocusable());
        vm.setFocused(v.getFlags().isFocused());
        vm.setSelected(v.getFlags().isSelected());
        vm.setEnabled(v.getFlags().isEnabled());
        vm.setImportant(Views.isImportantForA11y(v));
        vm.setBackground(v.getBackground());
        vm.setBounds(new ViewMap.Bounds(Views.x0(v), Views.y0(v), Views.x1(v), Views.y1(v)));
        return vm;
    }
}
