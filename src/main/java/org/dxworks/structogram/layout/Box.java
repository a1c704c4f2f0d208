package org.dxworks.structogram.layout;

/**
 * Placed extent of one identified node, excluding the nodes that follow it.
 */
public final class Box {
    public final String id;
    public final String nodeType;
    public final double x;
    public final double y;
    public final double width;
    public final double height;

    public Box(String id, String nodeType, double x, double y, double width, double height) {
        this.id = id;
        this.nodeType = nodeType;
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    @Override
    public String toString() {
        return nodeType + "[" + id + "] at (" + x + ", " + y + ") " + width + "x" + height;
    }
}
