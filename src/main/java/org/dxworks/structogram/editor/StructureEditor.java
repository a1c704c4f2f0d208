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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Structural edits on editable trees.
 * <p>
 * Every operation returns a new tree and leaves its input untouched; only the nodes between
 * the root and the edited position are copied. When an identifier cannot be found, or the
 * edit does not apply to the identified node, the input instance itself is returned, so
 * callers can detect a miss with {@code ==}.
 */
public final class StructureEditor {

    private static final Logger LOGGER = LoggerFactory.getLogger(StructureEditor.class);

    private StructureEditor() {
        // utility class
    }

    /** Normalizes an imported tree into the editable form. */
    public static Node prepare(Node tree) {
        return MarkerNormalizer.ensureIdentifiers(MarkerNormalizer.wrapWithInsertionPoints(tree));
    }

    public static Node createNode(String typeName) {
        return NodeFactory.create(typeName, new IdGenerator(MarkerNormalizer.ID_PREFIX));
    }

    /**
     * Splices a new template node of {@code typeName} in at an insertion point or empty marker.
     * The insertion point leads into the new node, which is followed by a fresh insertion point
     * and then by whatever followed the target before.
     */
    public static Node insertAt(Node tree, String targetId, String typeName) {
        Optional<List<ParentSlot>> path = TreeTraversal.findPath(tree, targetId);
        if (path.isEmpty()) {
            LOGGER.debug("Insert target {} not found", targetId);
            return tree;
        }
        IdGenerator ids = IdGenerator.forTree(MarkerNormalizer.ID_PREFIX, tree);
        Node created = NodeFactory.create(typeName, ids);
        return splice(tree, path.get(), created, ids);
    }

    /**
     * Removes a node together with its children and reconnects the chain across it. The
     * insertion point following the removed node is dropped with it.
     * <p>
     * Removing a case label removes that case from its switch; removing the default case
     * disables it and empties its body. Sequence markers cannot be removed.
     */
    public static Node removeNode(Node tree, String nodeId) {
        Optional<List<ParentSlot>> path = TreeTraversal.findPath(tree, nodeId);
        if (path.isEmpty()) {
            LOGGER.debug("Node {} to remove not found", nodeId);
            return tree;
        }
        Node node = nodeAt(tree, path.get());
        if (Nodes.isMarker(node)) {
            return tree;
        }
        IdGenerator ids = IdGenerator.forTree(MarkerNormalizer.ID_PREFIX, tree);
        if (node instanceof CaseLabel caseLabel) {
            return removeCase(tree, path.get(), caseLabel, ids);
        }
        return detach(tree, path.get(), ids);
    }

    public static Node editText(Node tree, String nodeId, String newText) {
        Optional<List<ParentSlot>> path = TreeTraversal.findPath(tree, nodeId);
        if (path.isEmpty()) {
            return tree;
        }
        Node node = nodeAt(tree, path.get());
        if (Nodes.isMarker(node)) {
            return tree;
        }
        return TreeTraversal.replace(path.get(), node.withText(newText));
    }

    /**
     * Detaches a node as {@link #removeNode} does and splices the same node in at an
     * insertion point or empty marker. Moving a node into its own subtree, or to a target that
     * no longer exists once the node is detached, leaves the tree unchanged.
     */
    public static Node moveNode(Node tree, String sourceId, String targetId) {
        if (sourceId != null && sourceId.equals(targetId)) {
            return tree;
        }
        Optional<List<ParentSlot>> sourcePath = TreeTraversal.findPath(tree, sourceId);
        if (sourcePath.isEmpty()) {
            return tree;
        }
        Node source = nodeAt(tree, sourcePath.get());
        if (Nodes.isMarker(source) || source instanceof CaseLabel) {
            return tree;
        }
        Node subtree = source.withSlot(Slot.FOLLOW, -1, null);
        if (TreeTraversal.contains(subtree, targetId)) {
            return tree;
        }

        IdGenerator ids = IdGenerator.forTree(MarkerNormalizer.ID_PREFIX, tree);
        Node detached = detach(tree, sourcePath.get(), ids);
        Optional<List<ParentSlot>> targetPath = TreeTraversal.findPath(detached, targetId);
        if (targetPath.isEmpty()) {
            LOGGER.debug("Move target {} not found", targetId);
            return tree;
        }
        Node moved = splice(detached, targetPath.get(), subtree, ids);
        return moved == detached ? tree : moved;
    }

    /** Identifiers of every insertion point and empty marker, in traversal order. */
    public static List<String> collectInsertionPoints(Node tree) {
        List<String> ids = new ArrayList<>();
        walk(tree, node -> {
            if (Nodes.isMarker(node) && node.id() != null) {
                ids.add(node.id());
            }
        });
        return ids;
    }

    /** Every content node and case label, in traversal order. */
    public static List<EditableNode> collectEditableNodes(Node tree) {
        List<EditableNode> nodes = new ArrayList<>();
        walk(tree, node -> {
            if (!Nodes.isMarker(node)) {
                nodes.add(new EditableNode(node.id(), node.typeName(), node.text()));
            }
        });
        return nodes;
    }

    private static void walk(Node node, Consumer<Node> action) {
        if (node == null) return;
        action.accept(node);
        for (NodeSlot slot : node.slots()) {
            walk(slot.child, action);
        }
    }

    private static Node nodeAt(Node tree, List<ParentSlot> path) {
        return path.isEmpty() ? tree : path.get(path.size() - 1).child;
    }

    private static Node splice(Node tree, List<ParentSlot> path, Node node, IdGenerator ids) {
        Node target = nodeAt(tree, path);
        if (target instanceof InsertionPoint insertionPoint) {
            return TreeTraversal.replace(path, insertAfter(insertionPoint, node, ids));
        }
        if (target instanceof EmptyMarker) {
            ParentSlot step = path.isEmpty() ? null : path.get(path.size() - 1);
            if (step != null && step.parent instanceof InsertionPoint insertionPoint) {
                // Insert at the insertion point that already leads into the marker.
                List<ParentSlot> parentPath = path.subList(0, path.size() - 1);
                return TreeTraversal.replace(parentPath, insertAfter(insertionPoint, node, ids));
            }
            return TreeTraversal.replace(path, new InsertionPoint(ids.next(),
                    node.withSlot(Slot.FOLLOW, -1, Nodes.emptyChain(ids))));
        }
        LOGGER.debug("Node {} is not an insertion target", target.id());
        return tree;
    }

    private static InsertionPoint insertAfter(InsertionPoint insertionPoint, Node node, IdGenerator ids) {
        Node rest = insertionPoint.followElement == null ? new EmptyMarker(ids.next()) : insertionPoint.followElement;
        return insertionPoint.withFollowElement(node.withSlot(Slot.FOLLOW, -1, new InsertionPoint(ids.next(), rest)));
    }

    private static Node detach(Node tree, List<ParentSlot> path, IdGenerator ids) {
        Node node = nodeAt(tree, path);
        Node rest = node.follow();
        boolean afterInsertionPoint = !path.isEmpty() && path.get(path.size() - 1).parent instanceof InsertionPoint;
        if (afterInsertionPoint && rest instanceof InsertionPoint) {
            rest = rest.follow();
        }
        if (rest == null) {
            rest = new EmptyMarker(ids.next());
        }
        return TreeTraversal.replace(path, rest);
    }

    private static Node removeCase(Node tree, List<ParentSlot> path, CaseLabel caseLabel, IdGenerator ids) {
        ParentSlot step = path.isEmpty() ? null : path.get(path.size() - 1);
        if (step == null || !(step.parent instanceof Switch parent)) {
            return tree;
        }
        Switch updated = step.slot == Slot.CASE
                ? parent.withoutCase(step.index)
                : parent.withDefault(false, new CaseLabel(caseLabel.id, caseLabel.text, Nodes.emptyChain(ids)));
        return TreeTraversal.replace(path.subList(0, path.size() - 1), updated);
    }

    /** Identifier, JSON type and text of a node offered for editing. */
    public static final class EditableNode {
        public final String id;
        public final String type;
        public final String text;

        public EditableNode(String id, String type, String text) {
            this.id = id;
            this.type = type;
            this.text = text;
        }
    }
}
