package org.dxworks.structogram.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;

/**
 * One column of a {@link Switch}. {@code text} is the case value and {@code followElement} the
 * case body chain.
 */
@JsonTypeName("InsertCase")
public final class CaseLabel implements Node {
    public final String id;
    public final String text;
    public final Node followElement;

    @JsonCreator
    public CaseLabel(@JsonProperty("id") String id,
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
        return "InsertCase";
    }

    @Override
    public List<NodeSlot> slots() {
        return List.of(NodeSlot.of(Slot.FOLLOW, followElement));
    }

    @Override
    public CaseLabel withSlot(Slot slot, int index, Node child) {
        if (slot != Slot.FOLLOW) {
            throw new IllegalArgumentException("InsertCase has no slot " + slot.getFieldName());
        }
        return new CaseLabel(id, text, child);
    }

    @Override
    public CaseLabel withId(String id) {
        return new CaseLabel(id, text, followElement);
    }

    @Override
    public CaseLabel withText(String text) {
        return new CaseLabel(id, text, followElement);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitCaseLabel(this);
    }
}
