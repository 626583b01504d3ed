package droidreplay.geometry;

import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

public class IntervalTreeTest {

    @Test(description = "Query returns exactly the stored intervals that strictly overlap")
    public void query_matchesBruteForce() {
        Random random = new Random(42);
        IntervalTree<Integer> tree = new IntervalTree<>();
        List<Interval> stored = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            int lo = random.nextInt(1000);
            Interval iv = Interval.of(lo, lo + random.nextInt(200));
            stored.add(iv);
            tree.insert(iv, i);
        }
        assertThat(tree.size()).isEqualTo(200);

        for (int q = 0; q < 100; q++) {
            int lo = random.nextInt(1100);
            Interval query = Interval.of(lo, lo + random.nextInt(150));
            List<Integer> expected = new ArrayList<>();
            for (int i = 0; i < stored.size(); i++) {
                if (stored.get(i).overlaps(query)) expected.add(i);
            }
            assertThat(tree.queryData(query)).as("query %s", query).containsExactlyInAnyOrderElementsOf(expected);
        }
    }

    @Test(description = "Touching and zero-width intervals are never reported")
    public void query_touchingNotReported() {
        IntervalTree<String> tree = new IntervalTree<>();
        tree.insert(Interval.of(0, 10), "left");
        tree.insert(Interval.of(20, 30), "right");
        tree.insert(Interval.of(15, 15), "point");

        assertThat(tree.queryData(Interval.of(10, 20))).isEmpty();
        assertThat(tree.queryData(Interval.of(9, 21))).containsExactly("left", "right");
        assertThat(tree.queryData(Interval.of(5, 5))).isEmpty();
    }

    @Test(description = "The same interval stored twice is reported twice")
    public void query_duplicatesKept() {
        IntervalTree<String> tree = new IntervalTree<>();
        Interval iv = Interval.of(0, 10);
        tree.insert(iv, "a");
        tree.insert(iv, "b");
        assertThat(tree.query(Interval.of(2, 3))).hasSize(2);
    }

    @Test(description = "2-D query intersects both axes and never returns null payloads")
    public void xyQuery_intersectsAxes() {
        XYIntervalTree<String> tree = new XYIntervalTree<>();
        tree.insert(XYInterval.of(0, 0, 1080, 1920), null);
        tree.insert(XYInterval.of(0, 0, 100, 100), "topLeft");
        tree.insert(XYInterval.of(500, 0, 600, 100), "topMiddle");
        tree.insert(XYInterval.of(0, 500, 100, 600), "middleLeft");

        Set<String> hits = Set.copyOf(tree.query(XYInterval.of(50, 50, 550, 80)));
        assertThat(hits).containsExactlyInAnyOrder("topLeft", "topMiddle");
        assertThat(tree.query(XYInterval.of(200, 200, 300, 300))).isEmpty();
    }
}
