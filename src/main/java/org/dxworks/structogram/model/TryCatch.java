package org.dxworks.structogram.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

/**
 * Exception handler. {@code text} is the catch binding, e.g. {@code Exception e}.
 */
@JsonTypeName("TryCatchNode")
public final class TryCatch implements Node {
    public final String id;
    public final String text;
    public final Node tryChild;
    public final Node catchChild;
    public final Node followElement;

    @JsonCreator
    public TryCatch(@JsonProperty("id") String id,
                    @JsonProperty("text") String text,
                    @JsonProperty("tryChild") Node tryChild,
                    @JsonProperty("catchChild") Node catchChild,
                    @JsonProperty("followElement") Node followElement) {
        this.id = id;
        this.text = text;
        this.tryChild = tryChild;
        this.catchChild = catchChild;
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
        return "TryCatchNode";
    }

    @Override
    public List<NodeSlot> slots() {
        return List.of(
                NodeSlot.of(Slot.FOLLOW, followElement),
                NodeSlot.of(Slot.TRY_CHILD, tryChild),
                NodeSlot.of(Slot.CATCH_CHILD, catchChild));
    }

    @Override
    public TryCatch withSlot(Slot slot, int index, Node node) {
        return switch (slot) {
            case FOLLOW -> new TryCatch(id, text, tryChild, catchChild, node);
            case TRY_CHILD -> new TryCatch(id, text, node, catchChild, followElement);
            case CATCH_CHILD -> new TryCatch(id, text, tryChild, node, followElement);
            default -> throw new IllegalArgumentException("TryCatchNode has no slot " + slot.getFieldName());
        };
    }

    @Override
    public TryCatch withId(String id) {
        return new TryCatch(id, text, tryChild, catchChild, followElement);
    }

    @Override
    public TryCatch withText(String text) {
        return new TryCatch(id, text, tryChild, catchChild, followElement);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTryCatch(this);
    }
}
