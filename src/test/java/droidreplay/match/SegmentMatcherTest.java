package droidreplay.match;

import droidreplay.segment.Segment;
import droidreplay.segment.Segments;
import org.testng.annotations.Test;

import java.util.List;

import static droidreplay.model.ViewBuilder.view;
import static org.assertj.core.api.Assertions.assertThat;

public class SegmentMatcherTest {

    private static Segment textSegment(String text) {
        return Segments.create(List.of(view(0, 0, 100, 100).text(text).build()));
    }

    @Test(description = "Segments pair by shared words; the surplus segment pairs with padding")
    public void match_pairsBySimilarity() {
        Segment inbox    = textSegment("Inbox");
        Segment compose  = textSegment("Compose message");
        Segment settings = textSegment("Settings");
        Segment settings2 = textSegment("Settings");
        Segment inbox2    = textSegment("Inbox");

        SegmentMatch match = new SegmentMatcher().match(
                List.of(inbox, compose, settings), List.of(settings2, inbox2));

        assertThat(match.size()).isEqualTo(3);
        assertThat(match.getPerfectMatch(inbox)).isSameAs(inbox2);
        assertThat(match.getPerfectMatch(settings)).isSameAs(settings2);
        assertThat(match.getPerfectMatch(compose)).isSameAs(SegmentMatch.NO_MATCH);
        assertThat(match.getPerfectMatch(inbox2)).isSameAs(inbox);
        assertThat(match.getScore(0, 1)).isEqualTo(SegmentMatcher.SCALE);
    }

    @Test(description = "Swapping the sides gives the same pairing")
    public void match_symmetric() {
        Segment a1 = textSegment("Inbox");
        Segment a2 = textSegment("Compose message");
        Segment b1 = textSegment("Settings");
        Segment b2 = textSegment("Inbox");

        SegmentMatch forward  = new SegmentMatcher().match(List.of(a1, a2), List.of(b1, b2));
        SegmentMatch backward = new SegmentMatcher().match(List.of(b1, b2), List.of(a1, a2));

        assertThat(forward.getPerfectMatch(a1)).isSameAs(b2);
        assertThat(backward.getPerfectMatch(a1)).isSameAs(b2);
        assertThat(backward.getPerfectMatch(b2)).isSameAs(a1);
    }

    @Test(description = "Best matches collect every segment tied at the top score")
    public void getBestMatches_ties() {
        Segment inbox   = textSegment("Inbox");
        Segment compose = textSegment("Compose message");
        Segment other   = textSegment("Inbox");

        SegmentMatch match = new SegmentMatcher().match(List.of(inbox, compose), List.of(other));

        SegmentMatch.BestMatches best = match.getBestMatches(inbox);
        assertThat(best.score()).isEqualTo(SegmentMatcher.SCALE);
        assertThat(best.segments()).containsExactly(other);

        SegmentMatch.BestMatches none = match.getBestMatches(compose);
        assertThat(none.score()).isZero();
        assertThat(none.segments()).hasSize(2);

        assertThat(match.getBestMatches(textSegment("elsewhere")).segments()).isEmpty();
    }

    @Test(description = "A segment on neither side has no perfect match")
    public void getPerfectMatch_unknown() {
        SegmentMatch match = new SegmentMatcher().match(List.of(textSegment("a b")), List.of(textSegment("c d")));
        assertThat(match.getPerfectMatch(textSegment("zzz"))).isNull();
    }
}
