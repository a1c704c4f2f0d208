package org.dxworks.structogram.model;

/**
 * One structural field of a node together with its current value.
 * {@code index} is the position inside {@code cases} and {@code -1} for single-valued fields.
 */
public final class NodeSlot {
    public final Slot slot;
    public final int index;
    public final Node child;

    public NodeSlot(Slot slot, int index, Node child) {
        this.slot = slot;
        this.index = index;
        this.child = child;
    }

    static NodeSlot of(Slot slot, Node child) {
        return new NodeSlot(slot, -1, child);
    }
}
