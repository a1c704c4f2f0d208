package org.dxworks.structogram.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

/**
 * Writes the expression in {@code text}.
 */
@JsonTypeName("OutputNode")
public final class Output implements Node {
    public final String id;
    public final String text;
    public final Node followElement;

    @JsonCreator
    public Output(@JsonProperty("id") String id,
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
        return "OutputNode";
    }

    @Override
    public List<NodeSlot> slots() {
        return List.of(NodeSlot.of(Slot.FOLLOW, followElement));
    }

    @Override
    public Output withSlot(Slot slot, int index, Node child) {
        if (slot != Slot.FOLLOW) {
            throw new IllegalArgumentException("OutputNode has no slot " + slot.getFieldName());
        }
        return new Output(id, text, child);
    }

    @Override
    public Output withId(String id) {
        return new Output(id, text, followElement);
    }

    @Override
    public Output withText(String text) {
        return new Output(id, text, followElement);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitOutput(this);
    }
}
