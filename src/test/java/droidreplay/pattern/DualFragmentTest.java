package droidreplay.pattern;

import droidreplay.UnsupportedCircumstanceException;
import droidreplay.device.DroidInput;
import droidreplay.model.DeviceInfo;
import droidreplay.model.Fragment;
import droidreplay.model.TapEvent;
import droidreplay.model.Ui;
import droidreplay.model.View;
import droidreplay.model.ViewBuilder;
import droidreplay.model.ViewType;
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
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;

public class DualFragmentTest {

    @Mock private DroidInput input;
    @Mock private AdaptiveSelector selector;

    private AutoCloseable mocks;
    private final DeviceInfo tablet = device(1080, 1920);
    private Ui recordee;

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        recordee = ui(decor(1080, 1920)
                .child(view(0, 0, 540, 1920).id("list_frag")
                        .child(ViewBuilder.of(ViewType.LIST_VIEW, 0, 0, 540, 1920).id("mail_list")
                                .child(view(0, 0, 540, 200).text("Inbox"))
                                .child(view(0, 200, 540, 400).text("Sent").selected())))
                .child(view(540, 0, 1080, 1920).id("detail_frag")
                        .child(view(540, 0, 1080, 200).text("Subject: hello"))));
        recordee.getFragmentManager().add(activeFragment("MailListFragment", "list_frag"));
        recordee.getFragmentManager().add(activeFragment("MailDetailFragment", "detail_frag"));
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    private static Fragment activeFragment(String cls, String id) {
        Fragment f = new Fragment(cls, Integer.toHexString(id.hashCode()), "container", id);
        f.setActive(true);
        return f;
    }

    private PatternContext context(String recordedText, Ui playee) {
        View recorded = recordee.findViewByText(recordedText);
        return PatternContexts.of(new TapEvent(recordee, 10, 10, 0), recorded, recordee, tablet, playee, tablet);
    }

    @Test(description = "A view in the list pane while the playee shows details goes back first")
    public void gotoDescriptive_pressesBack() {
        Ui playee = ui(decor(1080, 1920).child(view(0, 0, 1080, 200).text("Subject: hello")));
        DualFragmentGotoDescriptive pattern = new DualFragmentGotoDescriptive(context("Inbox", playee));

        assertThat(pattern.match()).isTrue();
        assertThat(new DualFragmentGotoDetailed(pattern.getContext()).match()).isFalse();
        assertThat(pattern.apply(input, selector)).isFalse();

        verify(input).pressBack();
    }

    @Test(description = "A view in the detail pane while the playee shows the list opens the selected item")
    public void gotoDetailed_tapsSelectedItem() {
        Ui playee = ui(decor(1080, 1920)
                .child(ViewBuilder.of(ViewType.LIST_VIEW, 0, 0, 1080, 1920).id("mail_list")
                        .child(view(0, 0, 1080, 200).text("Inbox"))
                        .child(view(0, 200, 1080, 400).text("Sent"))));
        DualFragmentGotoDetailed pattern = new DualFragmentGotoDetailed(context("Subject: hello", playee));

        assertThat(pattern.match()).isTrue();
        assertThat(pattern.getDetailed().getFragmentId()).isEqualTo("detail_frag");
        assertThat(new DualFragmentGotoDescriptive(pattern.getContext()).match()).isFalse();
        assertThat(pattern.apply(input, selector)).isFalse();

        verify(input).tap(1, 201);
    }

    @Test(description = "The selected item missing from the playee list is unsupported")
    public void gotoDetailed_itemMissing_throws() {
        Ui playee = ui(decor(1080, 1920)
                .child(ViewBuilder.of(ViewType.LIST_VIEW, 0, 0, 1080, 1920).id("mail_list")
                        .child(view(0, 0, 1080, 200).text("Inbox"))));
        DualFragmentGotoDetailed pattern = new DualFragmentGotoDetailed(context("Subject: hello", playee));

        assertThat(pattern.match()).isTrue();
        assertThatThrownBy(() -> pattern.apply(input, selector))
                .isInstanceOf(UnsupportedCircumstanceException.class);
    }

    @Test(description = "The identifying text is the first one no other item contains, else the longest")
    public void uniqueText_prefersUnshared() {
        View content = ViewBuilder.of(ViewType.LIST_VIEW, 0, 0, 540, 1000)
                .child(view(0, 0, 540, 200).child(view(0, 0, 540, 100).text("Mail"))
                        .child(view(0, 100, 540, 200).text("Inbox")))
                .child(view(0, 200, 540, 400).child(view(0, 200, 540, 300).text("Mail"))
                        .child(view(0, 300, 540, 400).text("Sent items")))
                .build();
        View selected = content.getChildren().get(1);

        assertThat(DualFragmentGotoDetailed.uniqueText(content, selected)).isEqualTo("Sent items");

        View shared = ViewBuilder.of(ViewType.LIST_VIEW, 0, 0, 540, 1000)
                .child(view(0, 0, 540, 100).text("Mail Inbox"))
                .child(view(0, 100, 540, 200).child(view(0, 100, 540, 150).text("Mail"))
                        .child(view(0, 150, 540, 200).text("Inbox")))
                .build();
        assertThat(DualFragmentGotoDetailed.uniqueText(shared, shared.getChildren().get(1))).isEqualTo("Inbox");
    }
}
