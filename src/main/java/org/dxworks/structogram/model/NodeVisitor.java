package org.dxworks.structogram.model;

/**
 * Exhaustive dispatch over the node variants. Adding a variant to {@link Node} requires a new
 * method here, which every traversal then has to implement.
 */
public interface NodeVisitor<R> {
    R visitInsertionPoint(InsertionPoint node);

    R visitEmptyMarker(EmptyMarker node);

    R visitTask(Task node);

    R visitInput(Input node);

    R visitOutput(Output node);

    R visitBranch(Branch node);

    R visitSwitch(Switch node);

    R visitCaseLabel(CaseLabel node);

    R visitPreTestLoop(PreTestLoop node);

    R visitCountLoop(CountLoop node);

    R visitPostTestLoop(PostTestLoop node);

    R visitFunctionDef(FunctionDef node);

    R visitTryCatch(TryCatch node);
}
