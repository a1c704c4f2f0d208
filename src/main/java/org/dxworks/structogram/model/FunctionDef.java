package org.dxworks.structogram.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Function definition; {@code text} is the function name.
 */
@JsonTypeName("FunctionNode")
public final class FunctionDef implements Node {
    public final String id;
    public final String text;
    public final List<Parameter> parameters;
    public final Node child;
    public final Node followElement;

    @JsonCreator
    public FunctionDef(@JsonProperty("id") String id,
                       @JsonProperty("text") String text,
                       @JsonProperty("parameters") List<Parameter> parameters,
                       @JsonProperty("child") Node child,
                       @JsonProperty("followElement") Node followElement) {
        this.id = id;
        this.text = text;
        this.parameters = parameters == null ? List.of() : Nodes.copyWithoutNulls(parameters);
        this.child = child;
        this.followElement = followElement;
    }

    /** Parameter names joined with {@code ", "}. */
    public String parameterList() {
        return parameters.stream()
                .map(p -> p.name == null ? "" : p.name)
                .collect(Collectors.joining(", "));
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
        return "FunctionNode";
    }

    @Override
    public List<NodeSlot> slots() {
        return List.of(NodeSlot.of(Slot.FOLLOW, followElement), NodeSlot.of(Slot.CHILD, child));
    }

    @Override
    public FunctionDef withSlot(Slot slot, int index, Node node) {
        return switch (slot) {
            case FOLLOW -> new FunctionDef(id, text, parameters, child, node);
            case CHILD -> new FunctionDef(id, text, parameters, node, followElement);
            default -> throw new IllegalArgumentException("FunctionNode has no slot " + slot.getFieldName());
        };
    }

    @Override
    public FunctionDef withId(String id) {
        return new FunctionDef(id, text, parameters, child, followElement);
    }

    @Override
    public FunctionDef withText(String text) {
        return new FunctionDef(id, text, parameters, child, followElement);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitFunctionDef(this);
    }
}
