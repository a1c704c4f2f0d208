package org.dxworks.structogram.editor;

import org.dxworks.structogram.model.Branch;
import org.dxworks.structogram.model.CaseLabel;
import org.dxworks.structogram.model.CountLoop;
import org.dxworks.structogram.model.FunctionDef;
import org.dxworks.structogram.model.IdGenerator;
import org.dxworks.structogram.model.Input;
import org.dxworks.structogram.model.Node;
import org.dxworks.structogram.model.Nodes;
import org.dxworks.structogram.model.Output;
import org.dxworks.structogram.model.Parameter;
import org.dxworks.structogram.model.PostTestLoop;
import org.dxworks.structogram.model.PreTestLoop;
import org.dxworks.structogram.model.Switch;
import org.dxworks.structogram.model.Task;
import org.dxworks.structogram.model.TryCatch;

import java.util.List;

/**
 * Template nodes with placeholder text. Child chains are empty ({@code InsertionPoint -> EmptyMarker})
 * and {@code followElement} is left unset for the caller to splice.
 */
public final class NodeFactory {

    private NodeFactory() {
        // utility class
    }

    /** Creates a template for a JSON type identifier; unknown identifiers give a Task with that text. */
    public static Node create(String typeName, IdGenerator ids) {
        return NodeKind.fromTypeName(typeName)
                .map(kind -> create(kind, ids))
                .orElseGet(() -> new Task(ids.next(), typeName, null));
    }

    public static Node create(NodeKind kind, IdGenerator ids) {
        String id = ids.next();
        return switch (kind) {
            case TASK -> new Task(id, "Statement", null);
            case INPUT -> new Input(id, "Input", null);
            case OUTPUT -> new Output(id, "Output", null);
            case BRANCH -> new Branch(id, "Condition", Nodes.emptyChain(ids), Nodes.emptyChain(ids), null, null);
            case SWITCH -> new Switch(id, "Variable",
                    List.of(new CaseLabel(ids.next(), "Case 1", Nodes.emptyChain(ids)),
                            new CaseLabel(ids.next(), "Case 2", Nodes.emptyChain(ids))),
                    true,
                    new CaseLabel(ids.next(), "Default", Nodes.emptyChain(ids)),
                    null, null);
            case PRE_TEST_LOOP -> new PreTestLoop(id, "Condition", Nodes.emptyChain(ids), null);
            case COUNT_LOOP -> new CountLoop(id, "i = 1 to 10", Nodes.emptyChain(ids), null);
            case POST_TEST_LOOP -> new PostTestLoop(id, "Condition", Nodes.emptyChain(ids), null);
            case FUNCTION_DEF -> new FunctionDef(id, "function", List.of(new Parameter("0", "param")),
                    Nodes.emptyChain(ids), null);
            case TRY_CATCH -> new TryCatch(id, "Exception e", Nodes.emptyChain(ids), Nodes.emptyChain(ids), null);
        };
    }
}
