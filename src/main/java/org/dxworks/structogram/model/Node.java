package org.dxworks.structogram.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * A node of a structogram tree.
 * <p>
 * Sibling nodes form a chain through {@code followElement}; compound nodes own one or more
 * child chains. Nodes are immutable: every structural change produces new instances along the
 * path from the root to the changed node and shares everything else.
 * <p>
 * The JSON type identifiers are the ones used by struktog-compatible tools, so exported trees
 * can be exchanged with them.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = InsertionPoint.class, name = "InsertNode"),
        @JsonSubTypes.Type(value = EmptyMarker.class, name = "Placeholder"),
        @JsonSubTypes.Type(value = Task.class, name = "TaskNode"),
        @JsonSubTypes.Type(value = Input.class, name = "InputNode"),
        @JsonSubTypes.Type(value = Output.class, name = "OutputNode"),
        @JsonSubTypes.Type(value = Branch.class, name = "BranchNode"),
        @JsonSubTypes.Type(value = Switch.class, name = "CaseNode"),
        @JsonSubTypes.Type(value = CaseLabel.class, name = "InsertCase"),
        @JsonSubTypes.Type(value = PreTestLoop.class, name = "HeadLoopNode"),
        @JsonSubTypes.Type(value = CountLoop.class, name = "CountLoopNode"),
        @JsonSubTypes.Type(value = PostTestLoop.class, name = "FootLoopNode"),
        @JsonSubTypes.Type(value = FunctionDef.class, name = "FunctionNode"),
        @JsonSubTypes.Type(value = TryCatch.class, name = "TryCatchNode")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public sealed interface Node
        permits InsertionPoint, EmptyMarker, Task, Input, Output, Branch, Switch, CaseLabel,
        PreTestLoop, CountLoop, PostTestLoop, FunctionDef, TryCatch {

    /** Identifier, or {@code null} for nodes of a clean (exported) tree. */
    String id();

    /** Text of the node, or {@code null} for sequence markers. */
    String text();

    /** The next sibling, or {@code null} at the end of a chain. */
    Node follow();

    /** The JSON type identifier of this variant. */
    String typeName();

    /**
     * Structural fields of this node in traversal order: {@code followElement} first, then the
     * child chains. Absent fields are reported with a {@code null} child.
     */
    List<NodeSlot> slots();

    /** Returns a copy of this node with the given structural field replaced. */
    Node withSlot(Slot slot, int index, Node child);

    Node withId(String id);

    /** Returns a copy with the text replaced; sequence markers return themselves. */
    Node withText(String text);

    <R> R accept(NodeVisitor<R> visitor);
}
