package org.dxworks.structogram.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

/**
 * A loop that runs {@code child} first and tests its condition afterwards.
 */
@JsonTypeName("FootLoopNode")
public final class PostTestLoop implements Node {
    public final String id;
    public final String text;
    public final Node child;
    public final Node followElement;

    @JsonCreator
    public PostTestLoop(@JsonProperty("id") String id,
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
        return "FootLoopNode";
    }

    @Override
    public List<NodeSlot> slots() {
        return List.of(NodeSlot.of(Slot.FOLLOW, followElement), NodeSlot.of(Slot.CHILD, child));
    }

    @Override
    public PostTestLoop withSlot(Slot slot, int index, Node node) {
        return switch (slot) {
            case FOLLOW -> new PostTestLoop(id, text, child, node);
            case CHILD -> new PostTestLoop(id, text, node, followElement);
            default -> throw new IllegalArgumentException("FootLoopNode has no slot " + slot.getFieldName());
        };
    }

    @Override
    public PostTestLoop withId(String id) {
        return new PostTestLoop(id, text, child, followElement);
    }

    @Override
    public PostTestLoop withText(String text) {
        return new PostTestLoop(id, text, child, followElement);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitPostTestLoop(this);
    }
}
