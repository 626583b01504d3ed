package droidreplay.pattern;

import droidreplay.device.DroidInput;
import droidreplay.model.DeviceInfo;
import droidreplay.model.TapEvent;
import droidreplay.model.Ui;
import droidreplay.model.ViewBuilder;
import droidreplay.select.AdaptiveSelector;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import static droidreplay.model.ViewBuilder.decor;
import static droidreplay.model.ViewBuilder.device;
import static droidreplay.model.ViewBuilder.ui;
import static droidreplay.model.ViewBuilder.view;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

public class RevealButtonTest {

    @Mock private DroidInput input;
    @Mock private AdaptiveSelector selector;

    private AutoCloseable mocks;
    private final DeviceInfo phone = device(1080, 1920);

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    private PatternContext context(ViewBuilder recordeeDecor, ViewBuilder playeeDecor) {
        Ui recordee = ui(recordeeDecor.child(view(0, 400, 1080, 500).text("Archive")));
        Ui playee = ui(playeeDecor);
        return PatternContexts.of(new TapEvent(recordee, 540, 450, 0), recordee.findViewByText("Archive"),
                recordee, phone, playee, phone);
    }

    @Test(description = "A visible overflow button is tapped to reveal the menu; the event is retried")
    public void moreOptions_tapsOverflow() {
        MoreOptions pattern = new MoreOptions(context(decor(1080, 1920),
                decor(1080, 1920).child(view(980, 50, 1060, 150).desc("More options").clickable())));

        assertThat(pattern.match()).isTrue();
        assertThat(pattern.getButton().getDesc()).isEqualTo("More options");
        assertThat(pattern.apply(input, selector)).isFalse();

        verify(input).tap(981, 51);
        assertThat(pattern.isDirty()).isTrue();
        assertThat(pattern.getLevel()).isEqualTo(PatternLevel.REVEAL);
    }

    @Test(description = "A button that cannot be clicked does not count")
    public void moreOptions_notClickable() {
        MoreOptions pattern = new MoreOptions(context(decor(1080, 1920),
                decor(1080, 1920).child(view(980, 50, 1060, 150).desc("More options"))));

        assertThat(pattern.match()).isFalse();
    }

    /** Recorded "Archive" item placed in a layout with resource id {@code layoutResId}. */
    private PatternContext drawerContext(String layoutResId, ViewBuilder closeButton, ViewBuilder playeeDecor) {
        Ui recordee = ui(decor(1080, 1920)
                .child(view(0, 0, 800, 1920).resId(layoutResId)
                        .child(view(0, 400, 800, 500).text("Archive")))
                .child(closeButton));
        Ui playee = ui(playeeDecor);
        return PatternContexts.of(new TapEvent(recordee, 400, 450, 0), recordee.findViewByText("Archive"),
                recordee, phone, playee, phone);
    }

    private static ViewBuilder playeeWithOpener() {
        return decor(1080, 1920).child(view(0, 50, 150, 150).desc("Open navigation drawer").clickable());
    }

    @Test(description = "The drawer opener is tapped only when the recordee showed an open drawer")
    public void drawerMenu_needsOpenDrawerOnRecordee() {
        DrawerMenu closedOnBoth = new DrawerMenu(drawerContext("com.example:id/drawer_menu",
                view(800, 50, 900, 150).desc("Search").clickable(), playeeWithOpener()));
        assertThat(closedOnBoth.match()).isFalse();

        DrawerMenu pattern = new DrawerMenu(drawerContext("com.example:id/drawer_menu",
                view(800, 50, 900, 150).desc("Close navigation drawer").clickable(), playeeWithOpener()));
        assertThat(pattern.match()).isTrue();
        assertThat(pattern.getMenuLayout().getResEntry()).isEqualTo("drawer_menu");
        assertThat(pattern.apply(input, selector)).isFalse();
        verify(input).tap(1, 51);
    }

    @Test(description = "A recorded view outside any drawer layout is not a drawer item")
    public void drawerMenu_needsDrawerLayout() {
        DrawerMenu pattern = new DrawerMenu(drawerContext("com.example:id/main_list",
                view(800, 50, 900, 150).desc("Close navigation drawer").clickable(), playeeWithOpener()));

        assertThat(pattern.match()).isFalse();
        assertThat(pattern.getMenuLayout()).isNull();
    }

    @Test(description = "A hidden close button on the recordee still marks the drawer as open")
    public void drawerMenu_hiddenCloseButton() {
        DrawerMenu pattern = new DrawerMenu(drawerContext("com.example:id/drawer_content",
                view(800, 50, 900, 150).desc("Close navigation drawer").clickable().hidden(), playeeWithOpener()));

        assertThat(pattern.match()).isTrue();
        assertThat(pattern.getCloseButton().isShown()).isFalse();
    }

    @Test(description = "A New button searched outward from the playee segment is tapped")
    public void newButton_tapsCreator() {
        NewButton pattern = new NewButton(context(decor(1080, 1920),
                decor(1080, 1920)
                        .child(view(0, 0, 1080, 200).text("Notes"))
                        .child(view(900, 1700, 1040, 1840).desc("Add note").clickable())));

        assertThat(pattern.match()).isTrue();
        assertThat(pattern.getLevel()).isEqualTo(PatternLevel.MERGE);
        assertThat(pattern.apply(input, selector)).isFalse();
        verify(input).tap(901, 1701);
    }
}
