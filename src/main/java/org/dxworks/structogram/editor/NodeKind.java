package org.dxworks.structogram.editor;

import java.util.Optional;

/**
 * Node kinds that can be created by the editor, keyed by their JSON type identifier.
 */
public enum NodeKind {
    TASK("TaskNode"),
    INPUT("InputNode"),
    OUTPUT("OutputNode"),
    BRANCH("BranchNode"),
    SWITCH("CaseNode"),
    PRE_TEST_LOOP("HeadLoopNode"),
    COUNT_LOOP("CountLoopNode"),
    POST_TEST_LOOP("FootLoopNode"),
    FUNCTION_DEF("FunctionNode"),
    TRY_CATCH("TryCatchNode");

    private final String typeName;

    NodeKind(String typeName) {
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }

    public static Optional<NodeKind> fromTypeName(String typeName) {
        for (NodeKind kind : values()) {
            if (kind.typeName.equals(typeName)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
