package org.dxworks.structogram.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

/**
 * Reads a value into the variable named by {@code text}.
 */
@JsonTypeName("InputNode")
public final class Input implements Node {
    public final String id;
    public final String text;
    public final Node followElement;

    @JsonCreator
    public Input(@JsonProperty("id") String id,
             @JsonProperty("text") String text,
             @JsonProperty("followElement") Node followElement) {
        this.id = id;
        this.text = text;
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
        return "InputNode";
    }

    @Override
    public List<NodeSlot> slots() {
        return List.of(NodeSlot.of(Slot.FOLLOW, followElement));
    }

    @Override
    public Input withSlot(Slot slot, int index, Node child) {
        if (slot != Slot.FOLLOW) {
            throw new IllegalArgumentException("InputNode has no slot " + slot.getFieldName());
        }
        return new Input(id, text, child);
    }

    @Override
    public Input withId(String id) {
        return new Input(id, text, followElement);
    }

    @Override
    public Input withText(String text) {
        return new Input(id, text, followElement);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitInput(this);
    }
}
