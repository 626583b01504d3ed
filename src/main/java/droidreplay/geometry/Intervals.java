package droidreplay.geometry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Mutable ordered set of 1-D intervals supporting subtraction.
 *
 * <p>{@link #remove(Interval)} keeps the zero-width members it produces at the
 * borders of the removed range. Two views that touch leave such a member
 * between them, and the segmenter uses it as a zero-width separator.
 */
public class Intervals implements Iterable<Interval> {

    private final List<Interval> members;

    public Intervals(Interval... members) {
        this.members = new ArrayList<>(Arrays.asList(members));
    }

    public Intervals(List<Interval> members) {
        this.members = new ArrayList<>(members);
    }

    public void add(Interval interval) {
        members.add(interval);
    }

    public int size() {
        return members.size();
    }

    public Interval get(int index) {
        return members.get(index);
    }

    public List<Interval> asList() {
        return Collections.unmodifiableList(members);
    }

    @Override
    public Iterator<Interval> iterator() {
        return asList().iterator();
    }

    /**
     * Subtracts {@code removed} from every member.
     *
     * <p>A member covering the removed range is split in two, unless the
     * removed range is zero-width and sits on the member's border. A member
     * covered by the removed range shrinks to the uncovered side, or is
     * dropped when strictly covered. A member crossing the removed range is
     * truncated at the removed range's far bound.
     */
    public void remove(Interval removed) {
        List<Interval> result = new ArrayList<>(members.size() + 1);
        for (Interval member : members) {
            Interval.Cover memberCovers = member.cover(removed);
            if (memberCovers != Interval.Cover.NONE) {
                boolean onBorder = removed.isEmpty()
                        && (removed.low() == member.low() || removed.low() == member.high());
                if (onBorder) {
                    result.add(member);
                } else {
                    result.add(new Interval(member.low(), removed.low()));
                    result.add(new Interval(removed.high(), member.high()));
                }
                continue;
            }

            Interval.Cover removedCovers = removed.cover(member);
            switch (removedCovers) {
                case SAME_HIGH:
                    result.add(new Interval(removed.high(), member.high()));
                    continue;
                case SAME_LOW:
                    result.add(new Interval(member.low(), removed.low()));
                    continue;
                case STRICT:
                    continue;
                default:
                    break;
            }

            switch (member.cross(removed)) {
                case LOW_INSIDE:
                    result.add(new Interval(removed.high(), member.high()));
                    break;
                case HIGH_INSIDE:
                    result.add(new Interval(member.low(), removed.low()));
                    break;
                default:
                    result.add(member);
            }
        }
        members.clear();
        members.addAll(result);
    }

    @Override
    public String toString() {
        return members.toString();
    }
}
