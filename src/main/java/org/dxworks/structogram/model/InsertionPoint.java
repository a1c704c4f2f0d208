package org.dxworks.structogram.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

/**
 * A position in a chain where new or moved nodes can be inserted.
 */
@JsonTypeName("InsertNode")
public final class InsertionPoint implements Node {
    public final String id;
    public final Node followElement;

    @JsonCreator
    public InsertionPoint(@JsonProperty("id") String id,
                          @JsonProperty("followElement") Node followElement) {
        this.id = id;
        this.followElement = followElement;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String text() {
        return null;
    }

    @Override
    public Node follow() {
        return followElement;
    }

    @Override
    public String typeName() {
        return "InsertNode";
    }

    @Override
    public List<NodeSlot> slots() {
        return List.of(NodeSlot.of(Slot.FOLLOW, followElement));
    }

    @Override
    public InsertionPoint withSlot(Slot slot, int index, Node child) {
        if (slot != Slot.FOLLOW) {
            throw new IllegalArgumentException("InsertNode has no slot " + slot.getFieldName());
        }
        return new InsertionPoint(id, child);
    }

    public InsertionPoint withFollowElement(Node followElement) {
        return new InsertionPoint(id, followElement);
    }

    @Override
    public InsertionPoint withId(String id) {
        return new InsertionPoint(id, followElement);
    }

    @Override
    public InsertionPoint withText(String text) {
        return this;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitInsertionPoint(this);
    }
}
