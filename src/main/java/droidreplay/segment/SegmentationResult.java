package droidreplay.segment;

import java.util.List;

/**
 * Outcome of segmenting one UI: the root of the segment tree and its
 * accepted leaves in discovery order.
 */
public record SegmentationResult(Segment root, List<Segment> accepted) {

    public SegmentationResult {
        accepted = List.copyOf(accepted);
    }
}
