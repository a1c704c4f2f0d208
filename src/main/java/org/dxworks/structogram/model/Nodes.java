package org.dxworks.structogram.model;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Small helpers shared by the tree consumers.
 */
public final class Nodes {

    private Nodes() {
        // utility class
    }

    public static boolean isMarker(Node node) {
        return node instanceof InsertionPoint || node instanceof EmptyMarker;
    }

    /** The canonical empty chain: an insertion point leading into the terminating marker. */
    public static InsertionPoint emptyChain(IdGenerator ids) {
        return new InsertionPoint(ids.next(), new EmptyMarker(ids.next()));
    }

    /** True when the chain starting at {@code node} holds at least one non-marker node. */
    public static boolean hasContent(Node node) {
        for (Node current = node; current != null; current = current.follow()) {
            if (!isMarker(current)) {
                return true;
            }
        }
        return false;
    }

    public static String textOrEmpty(Node node) {
        String text = node.text();
        return text == null ? "" : text;
    }

    /** Immutable copy of {@code list} without its null entries; null stays null. */
    public static <T> List<T> copyWithoutNulls(List<T> list) {
        if (list == null) return null;
        return list.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList());
    }

    public static Set<String> collectIds(Node root) {
        Set<String> ids = new HashSet<>();
        collectIds(root, ids);
        return ids;
    }

    private static void collectIds(Node node, Set<String> ids) {
        if (node == null) return;
        if (node.id() != null) {
            ids.add(node.id());
        }
        for (NodeSlot slot : node.slots()) {
            collectIds(slot.child, ids);
        }
    }
}
