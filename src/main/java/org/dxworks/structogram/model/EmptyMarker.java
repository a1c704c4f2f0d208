package org.dxworks.structogram.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

/**
 * Terminates a chain. Has no geometry and no successor.
 */
@JsonTypeName("Placeholder")
public final class EmptyMarker implements Node {
    public final String id;

    @JsonCreator
    public EmptyMarker(@JsonProperty("id") String id) {
        this.id = id;
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
        return null;
    }

    @Override
    public String typeName() {
        return "Placeholder";
    }

    @Override
    public List<NodeSlot> slots() {
        return List.of();
    }

    @Override
    public EmptyMarker withSlot(Slot slot, int index, Node child) {
        throw new IllegalArgumentException("Placeholder has no slot " + slot.getFieldName());
    }

    @Override
    public EmptyMarker withId(String id) {
        return new EmptyMarker(id);
    }

    @Override
    public EmptyMarker withText(String text) {
        return this;
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitEmptyMarker(this);
    }
}
