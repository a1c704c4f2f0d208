package org.dxworks.structogram.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

/**
 * A loop that tests its condition before each pass over {@code child}.
 */
@JsonTypeName("HeadLoopNode")
public final class PreTestLoop implements Node {
    public final String id;
    public final String text;
    public final Node child;
    public final Node followElement;

    @JsonCreator
    public PreTestLoop(@JsonProperty("id") String id,
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
        return "HeadLoopNode";
    }

    @Override
    public List<NodeSlot> slots() {
        return List.of(NodeSlot.of(Slot.FOLLOW, followElement), NodeSlot.of(Slot.CHILD, child));
    }

    @Override
    public PreTestLoop withSlot(Slot slot, int index, Node node) {
        return switch (slot) {
            case FOLLOW -> new PreTestLoop(id, text, child, node);
            case CHILD -> new PreTestLoop(id, text, node, followElement);
            default -> throw new IllegalArgumentException("HeadLoopNode has no slot " + slot.getFieldName());
        };
    }

    @Override
    public PreTestLoop withId(String id) {
        return new PreTestLoop(id, text, child, followElement);
    }

    @Override
    public PreTestLoop withText(String text) {
        return new PreTestLoop(id, text, child, followElement);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitPreTestLoop(this);
    }
}
