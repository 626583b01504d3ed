package droidreplay.segment;

import droidreplay.ContractViolationException;
import droidreplay.model.View;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rectangular region of a UI rooted at one or more view subtrees.
 *
 * <p>Segments form a tree through their {@link Separator}: a split separator
 * has two child segments, a shrink separator one. A segment is accepted when
 * created, becomes rejected as soon as a separator is set (its children are
 * accepted instead), and can be accepted again through {@link #delSep(boolean)}.
 */
public class Segment {

    private final List<View> roots;
    private final int level;
    private final int x;
    private final int y;
    private final int w;
    private final int h;

    private boolean accepted = true;
    private Segment parent;
    private Separator sep;

    Segment(List<View> roots, int level, int x, int y, int w, int h) {
        this.roots = new ArrayList<>(roots);
        this.level = level;
        this.x     = x;
        this.y     = y;
        this.w     = w;
        this.h     = h;
    }

    // ── Tree ──────────────────────────────────────────────────────────────

    public Segment getParent() {
        return parent;
    }

    public Separator getSep() {
        return sep;
    }

    /** Two sides of a split separator, the shrunk segment of a shrink separator, or nothing. */
    public List<Segment> getChildren() {
        return childrenOf(sep);
    }

    public List<Segment> getSiblings() {
        if (parent == null) {
            return Collections.emptyList();
        }
        List<Segment> siblings = new ArrayList<>(parent.getChildren());
        siblings.remove(this);
        return siblings;
    }

    /** Attaches {@code sep}, accepting its segments and rejecting this one. */
    public void setSep(Separator sep) {
        List<Segment> children = childrenOf(sep);
        if (children.contains(this)) {
            throw new ContractViolationException("A segment cannot be its own child");
        }
        this.sep = sep;
        this.accepted = false;
        for (Segment child : children) {
            child.parent   = this;
            child.accepted = true;
        }
    }

    /** Detaches the separator and its children; the segment becomes accepted when {@code accept}. */
    public void delSep(boolean accept) {
        if (sep == null) {
            return;
        }
        for (Segment child : getChildren()) {
            child.parent = null;
        }
        this.sep = null;
        this.accepted = accept;
    }

    // ── Roots ─────────────────────────────────────────────────────────────

    public List<View> getRoots() {
        return Collections.unmodifiableList(roots);
    }

    void replaceRoots(List<View> newRoots) {
        roots.clear();
        roots.addAll(newRoots);
    }

    private static List<Segment> childrenOf(Separator sep) {
        if (sep == null) {
            return Collections.emptyList();
        }
        if (sep instanceof SplitSeparator) {
            SplitSeparator split = (SplitSeparator) sep;
            return List.of(split.getFirst(), split.getSecond());
        }
        return List.of(((ShrinkSeparator) sep).getAfter());
    }

    // ── Getters ───────────────────────────────────────────────────────────

    public boolean isAccepted() { return accepted; }
    public int getLevel()       { return level; }
    public int getX()           { return x; }
    public int getY()           { return y; }
    public int getW()           { return w; }
    public int getH()           { return h; }

    public void setAccepted(boolean accepted) { this.accepted = accepted; }

    @Override
    public String toString() {
        return "Segment{xywh=[" + x + "," + y + "," + w + "," + h + "], level=" + level
                + ", roots=" + roots.size() + ", accepted=" + accepted + "}";
    }
}
