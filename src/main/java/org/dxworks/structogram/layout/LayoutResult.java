package org.dxworks.structogram.layout;

import java.util.List;
import java.util.Optional;

/**
 * Geometry of a laid-out subtree in a single coordinate space.
 */
public final class LayoutResult {
    public final List<Box> boxes;
    public final List<LineSegment> lines;
    public final List<TextLabel> labels;
    public final double totalHeight;

    public LayoutResult(List<Box> boxes, List<LineSegment> lines, List<TextLabel> labels, double totalHeight) {
        this.boxes = List.copyOf(boxes);
        this.lines = List.copyOf(lines);
        this.labels = List.copyOf(labels);
        this.totalHeight = totalHeight;
    }

    public Optional<Box> findBox(String id) {
        return boxes.stream().filter(box -> box.id.equals(id)).findFirst();
    }
}
