package org.dxworks.structogram.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

/**
 * A plain statement.
 */
@JsonTypeName("TaskNode")
public final class Task implements Node {
    public final String id;
    public final String text;
    public final Node followElement;

    @JsonCreator
    public Task(@JsonProperty("id") String id,
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
        return "TaskNode";
    }

    @Override
    public List<NodeSlot> slots() {
        return List.of(NodeSlot.of(Slot.FOLLOW, followElement));
    }

    @Override
    public Task withSlot(Slot slot, int index, Node child) {
        if (slot != Slot.FOLLOW) {
            throw new IllegalArgumentException("TaskNode has no slot " + slot.getFieldName());
        }
        return new Task(id, text, child);
    }

    @Override
    public Task withId(String id) {
        return new Task(id, text, followElement);
    }

    @Override
    public Task withText(String text) {
        return new Task(id, text, followElement);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTask(this);
    }
}
