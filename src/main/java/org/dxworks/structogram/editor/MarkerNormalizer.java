package org.dxworks.structogram.editor;

import org.dxworks.structogram.model.CaseLabel;
import org.dxworks.structogram.model.EmptyMarker;
import org.dxworks.structogram.model.IdGenerator;
import org.dxworks.structogram.model.InsertionPoint;
import org.dxworks.structogram.model.Node;
import org.dxworks.structogram.model.NodeSlot;
import org.dxworks.structogram.model.Nodes;
import org.dxworks.structogram.model.Slot;
import org.dxworks.structogram.model.Switch;

/**
 * Conversions between the clean exchange form of a tree and the editable form, in which every
 * chain position is an insertion point and every chain ends with {@code InsertionPoint -> EmptyMarker}.
 */
public final class MarkerNormalizer {

    static final String ID_PREFIX = "__ed_";
    private static final String DEFAULT_CASE_TEXT = "Default";

    private MarkerNormalizer() {
        // utility class
    }

    /**
     * Puts an insertion point in front of every content node and at the end of every chain.
     * Runs of consecutive insertion points collapse to the last one, so the operation is
     * idempotent. Existing identifiers are kept; new markers get fresh ones.
     */
    public static Node wrapWithInsertionPoints(Node tree) {
        IdGenerator ids = IdGenerator.forTree(ID_PREFIX, tree);
        return wrapChain(tree, ids);
    }

    private static Node wrapChain(Node node, IdGenerator ids) {
        if (node == null) {
            return Nodes.emptyChain(ids);
        }
        if (node instanceof InsertionPoint insertionPoint) {
            if (insertionPoint.followElement instanceof InsertionPoint) {
                return wrapChain(insertionPoint.followElement, ids);
            }
            return insertionPoint.withFollowElement(wrapContent(insertionPoint.followElement, ids));
        }
        return new InsertionPoint(ids.next(), wrapContent(node, ids));
    }

    private static Node wrapContent(Node node, IdGenerator ids) {
        if (node == null) {
            return new EmptyMarker(ids.next());
        }
        if (node instanceof EmptyMarker) {
            return node;
        }
        if (node instanceof InsertionPoint) {
            return wrapChain(node, ids);
        }

        Node result = node;
        if (node instanceof Switch sw && sw.defaultCase == null) {
            result = sw.withDefault(sw.defaultEnabled, new CaseLabel(ids.next(), DEFAULT_CASE_TEXT, null));
        }
        for (NodeSlot slot : result.slots()) {
            Node wrapped;
            if (slot.slot == Slot.FOLLOW) {
                wrapped = wrapChain(slot.child, ids);
            } else if (slot.child instanceof CaseLabel caseLabel) {
                wrapped = caseLabel.withSlot(Slot.FOLLOW, -1, wrapChain(caseLabel.followElement, ids));
            } else {
                wrapped = wrapChain(slot.child, ids);
            }
            result = result.withSlot(slot.slot, slot.index, wrapped);
        }
        return result;
    }

    /**
     * Removes every insertion point, empty marker and identifier. Empty chains become
     * {@code null}; a tree without content yields {@code null}.
     */
    public static Node stripMarkers(Node tree) {
        return stripChain(tree);
    }

    private static Node stripChain(Node node) {
        if (node == null || node instanceof EmptyMarker) {
            return null;
        }
        if (node instanceof InsertionPoint) {
            return stripChain(node.follow());
        }
        Node result = node.withId(null);
        for (NodeSlot slot : node.slots()) {
            if (slot.child == null) continue;
            Node stripped = slot.child instanceof CaseLabel caseLabel
                    ? caseLabel.withId(null).withSlot(Slot.FOLLOW, -1, stripChain(caseLabel.followElement))
                    : stripChain(slot.child);
            result = result.withSlot(slot.slot, slot.index, stripped);
        }
        return result;
    }

    /** Gives every node without an identifier a fresh one; existing identifiers are untouched. */
    public static Node ensureIdentifiers(Node tree) {
        if (tree == null) {
            return null;
        }
        return ensure(tree, IdGenerator.forTree(ID_PREFIX, tree));
    }

    private static Node ensure(Node node, IdGenerator ids) {
        Node result = node.id() == null ? node.withId(ids.next()) : node;
        for (NodeSlot slot : node.slots()) {
            if (slot.child == null) continue;
            Node child = ensure(slot.child, ids);
            if (child != slot.child) {
                result = result.withSlot(slot.slot, slot.index, child);
            }
        }
        return result;
    }
}
