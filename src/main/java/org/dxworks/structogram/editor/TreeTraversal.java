package org.dxworks.structogram.editor;

import org.dxworks.structogram.model.Node;
import org.dxworks.structogram.model.NodeSlot;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Depth-first search over every structural field of a tree, in {@link Node#slots()} order.
 * The first node carrying the requested identifier wins.
 */
public final class TreeTraversal {

    private TreeTraversal() {
        // utility class
    }

    public static Optional<Node> findNode(Node tree, String id) {
        return findPath(tree, id).map(path -> path.isEmpty() ? tree : path.get(path.size() - 1).child);
    }

    /** The slot holding the identified node; for the root, a slot with a {@code null} parent. */
    public static Optional<ParentSlot> findParentSlot(Node tree, String id) {
        return findPath(tree, id).map(path -> path.isEmpty()
                ? new ParentSlot(null, null, -1, tree)
                : path.get(path.size() - 1));
    }

    /**
     * Steps from the root down to the identified node. An empty list means the root itself
     * carries the identifier.
     */
    public static Optional<List<ParentSlot>> findPath(Node tree, String id) {
        if (tree == null || id == null) {
            return Optional.empty();
        }
        List<ParentSlot> path = new ArrayList<>();
        return search(tree, id, path) ? Optional.of(path) : Optional.empty();
    }

    private static boolean search(Node node, String id, List<ParentSlot> path) {
        if (id.equals(node.id())) {
            return true;
        }
        for (NodeSlot slot : node.slots()) {
            if (slot.child == null) continue;
            path.add(new ParentSlot(node, slot.slot, slot.index, slot.child));
            if (search(slot.child, id, path)) {
                return true;
            }
            path.remove(path.size() - 1);
        }
        return false;
    }

    /**
     * Rebuilds the nodes along {@code path} so that the node at its end is replaced by
     * {@code replacement}. Everything off the path is shared with the original tree.
     */
    public static Node replace(List<ParentSlot> path, Node replacement) {
        Node current = replacement;
        for (int i = path.size() - 1; i >= 0; i--) {
            ParentSlot step = path.get(i);
            current = step.parent.withSlot(step.slot, step.index, current);
        }
        return current;
    }

    public static boolean contains(Node tree, String id) {
        return findPath(tree, id).isPresent();
    }
}
