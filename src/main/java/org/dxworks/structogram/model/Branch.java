package org.dxworks.structogram.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

/**
 * Two-way branch on the condition in {@code text}.
 * {@code columnWidths}, when present, holds the fractions of the width given to the true and
 * false columns.
 */
@JsonTypeName("BranchNode")
public final class Branch implements Node {
    public final String id;
    public final String text;
    public final Node trueChild;
    public final Node falseChild;
    public final List<Double> columnWidths;
    public final Node followElement;

    @JsonCreator
    public Branch(@JsonProperty("id") String id,
                  @JsonProperty("text") String text,
                  @JsonProperty("trueChild") Node trueChild,
                  @JsonProperty("falseChild") Node falseChild,
                  @JsonProperty("columnWidths") List<Double> columnWidths,
                  @JsonProperty("followElement") Node followElement) {
        this.id = id;
        this.text = text;
        this.trueChild = trueChild;
        this.falseChild = falseChild;
        this.columnWidths = Nodes.copyWithoutNulls(columnWidths);
        this.followElement = followElement;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String text() {
        return text;
    }

    @Override
    public Node follow() {
        return followElement;
    }

    @Override
    public String typeName() {
        return "BranchNode";
    }

    @Override
    public List<NodeSlot> slots() {
        return List.of(
                NodeSlot.of(Slot.FOLLOW, followElement),
                NodeSlot.of(Slot.TRUE_CHILD, trueChild),
                NodeSlot.of(Slot.FALSE_CHILD, falseChild));
    }

    @Override
    public Branch withSlot(Slot slot, int index, Node node) {
        return switch (slot) {
            case FOLLOW -> new Branch(id, text, trueChild, falseChild, columnWidths, node);
            case TRUE_CHILD -> new Branch(id, text, node, falseChild, columnWidths, followElement);
            case FALSE_CHILD -> new Branch(id, text, trueChild, node, columnWidths, followElement);
            default -> throw new IllegalArgumentException("BranchNode has no slot " + slot.getFieldName());
        };
    }

    @Override
    public Branch withId(String id) {
        return new Branch(id, text, trueChild, falseChild, columnWidths, followElement);
    }

    @Override
    public Branch withText(String text) {
        return new Branch(id, text, trueChild, falseChild, columnWidths, followElement);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBranch(this);
    }
}
