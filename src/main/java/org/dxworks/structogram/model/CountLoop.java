package org.dxworks.structogram.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

/**
 * A counting loop; {@code text} holds the loop header, e.g. {@code i = 1 to 10}.
 */
@JsonTypeName("CountLoopNode")
public final class CountLoop implements Node {
    public final String id;
    public final String text;
    public final Node child;
    public final Node followElement;

    @JsonCreator
    public CountLoop(@JsonProperty("id") String id,
                 @JsonProperty("text") String text,
                 @JsonProperty("child") Node child,
                 @JsonProperty("followElement") Node followElement) {
        this.id = id;
        this.text = text;
        this.child = child;
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
        return "CountLoopNode";
    }

    @Override
    public List<NodeSlot> slots() {
        return List.of(NodeSlot.of(Slot.FOLLOW, followElement), NodeSlot.of(Slot.CHILD, child));
    }

    @Override
    public CountLoop withSlot(Slot slot, int index, Node node) {
        return switch (slot) {
            case FOLLOW -> new CountLoop(id, text, child, node);
            case CHILD -> new CountLoop(id, text, node, followElement);
            default -> throw new IllegalArgumentException("CountLoopNode has no slot " + slot.getFieldName());
        };
    }

    @Override
    public CountLoop withId(String id) {
        return new CountLoop(id, text, child, followElement);
    }

    @Override
    public CountLoop withText(String text) {
        return new CountLoop(id, text, child, followElement);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCountLoop(this);
    }
}
