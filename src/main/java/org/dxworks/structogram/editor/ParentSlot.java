package org.dxworks.structogram.editor;

import org.dxworks.structogram.model.Node;
import org.dxworks.structogram.model.Slot;

/**
 * Where a node hangs in its tree: the parent, the field holding it and, for {@code cases},
 * the position in the list. A {@code null} parent means the node is the root.
 */
public final class ParentSlot {
    public final Node parent;
    public final Slot slot;
    public final int index;
    public final Node child;

    public ParentSlot(Node parent, Slot slot, int index, Node child) {
        this.parent = parent;
        this.slot = slot;
        this.index = index;
        this.child = child;
    }

    public boolean isRoot() {
        return parent == null;
    }
}
