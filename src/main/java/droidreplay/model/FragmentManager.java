package droidreplay.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * All fragments added to an activity, active or not.
 */
public class FragmentManager {

    private final List<Fragment> added;

    public FragmentManager(List<Fragment> added) {
        this.added = added == null ? new ArrayList<>() : added;
    }

    public List<Fragment> getAdded() {
        return Collections.unmodifiableList(added);
    }

    public List<Fragment> getActive() {
        return findFragments(Fragment::isActive);
    }

    public void add(Fragment fragment) {
        added.add(fragment);
    }

    public Fragment findFragment(Predicate<Fragment> pred) {
        for (Fragment f : added) {
            if (pred.test(f)) return f;
        }
        return null;
    }

    public List<Fragment> findFragments(Predicate<Fragment> pred) {
        List<Fragment> found = new ArrayList<>();
        for (Fragment f : added) {
            if (pred.test(f)) found.add(f);
        }
        return found;
    }

    public Fragment findFragmentById(String fragmentId) {
        return findFragment(f -> fragmentId != null && fragmentId.equals(f.getFragmentId()));
    }
}
