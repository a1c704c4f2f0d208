package org.dxworks.structogram.generator;

import org.dxworks.structogram.model.Branch;
import org.dxworks.structogram.model.CaseLabel;
import org.dxworks.structogram.model.CountLoop;
import org.dxworks.structogram.model.EmptyMarker;
import org.dxworks.structogram.model.FunctionDef;
import org.dxworks.structogram.model.Input;
import org.dxworks.structogram.model.InsertionPoint;
import org.dxworks.structogram.model.Node;
import org.dxworks.structogram.model.NodeVisitor;
import org.dxworks.structogram.model.Nodes;
import org.dxworks.structogram.model.Output;
import org.dxworks.structogram.model.PostTestLoop;
import org.dxworks.structogram.model.PreTestLoop;
import org.dxworks.structogram.model.Switch;
import org.dxworks.structogram.model.Task;
import org.dxworks.structogram.model.TryCatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generates source text from a structogram tree using the template of a target language.
 * Every emitted line ends with a newline; nesting is indented with four spaces per level.
 * Sequence markers produce no output.
 */
public class CodeGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(CodeGenerator.class);
    private static final String INDENT = "    ";

    private final LanguageRegistry registry;

    public CodeGenerator() {
        this(LanguageRegistry.builtins());
    }

    public CodeGenerator(LanguageRegistry registry) {
        this.registry = registry;
    }

    public static String generate(Node tree, String language) {
        return new CodeGenerator().generateCode(tree, language);
    }

    public LanguageRegistry getRegistry() {
        return registry;
    }

    /**
     * @throws UnsupportedLanguageException when no template is registered for {@code language}
     */
    public String generateCode(Node tree, String language) {
        CodeTemplate template = registry.get(language);
        LOGGER.debug("Generating {} code", language);
        StringBuilder out = new StringBuilder();
        new Emitter(template, out).chain(tree, 0);
        return out.toString();
    }

    private static final class Emitter {
        private final CodeTemplate t;
        private final StringBuilder out;

        Emitter(CodeTemplate template, StringBuilder out) {
            this.t = template;
            this.out = out;
        }

        void chain(Node node, int level) {
            StatementWriter writer = new StatementWriter(level);
            for (Node current = node; current != null; current = current.follow()) {
                current.accept(writer);
            }
        }

        /** A nested chain; languages without block delimiters get a filler statement when it is empty. */
        void block(Node node, int level) {
            if (!Nodes.hasContent(node) && t.emptyBody != null) {
                line(level, t.emptyBody);
            } else {
                chain(node, level);
            }
        }

        void line(int level, String content) {
            out.append(INDENT.repeat(level)).append(content).append('\n');
        }

        String open(String header) {
            return t.blockOpen == null ? header : header + " " + t.blockOpen;
        }

        /** A continuation header such as else or catch, closing the previous block first. */
        String reopen(String header) {
            return open(t.blockClose == null ? header : t.blockClose + " " + header);
        }

        void close(int level) {
            if (t.blockClose != null) {
                line(level, t.blockClose);
            }
        }

        private final class StatementWriter implements NodeVisitor<Void> {
            private final int level;

            StatementWriter(int level) {
                this.level = level;
            }

            @Override
            public Void visitInsertionPoint(InsertionPoint node) {
                return null;
            }

            @Override
            public Void visitEmptyMarker(EmptyMarker node) {
                return null;
            }

            @Override
            public Void visitTask(Task node) {
                line(level, t.taskPrefix + Nodes.textOrEmpty(node) + t.taskSuffix);
                return null;
            }

            @Override
            public Void visitInput(Input node) {
                line(level, t.inputPrefix + Nodes.textOrEmpty(node) + t.inputSuffix);
                return null;
            }

            @Override
            public Void visitOutput(Output node) {
                line(level, t.outputPrefix + Nodes.textOrEmpty(node) + t.outputSuffix);
                return null;
            }

            @Override
            public Void visitBranch(Branch node) {
                line(level, open(t.branchPrefix + Nodes.textOrEmpty(node) + t.branchSuffix));
                block(node.trueChild, level + 1);
                line(level, reopen(t.elseKeyword));
                block(node.falseChild, level + 1);
                close(level);
                return null;
            }

            @Override
            public Void visitSwitch(Switch node) {
                if (t.nativeSwitch) {
                    nativeSwitch(node);
                } else {
                    conditionalChain(node);
                }
                return null;
            }

            private void nativeSwitch(Switch node) {
                line(level, open(t.switchPrefix + Nodes.textOrEmpty(node) + t.switchSuffix));
                for (CaseLabel caseLabel : node.cases) {
                    line(level + 1, t.casePrefix + Nodes.textOrEmpty(caseLabel) + t.caseSuffix);
                    caseBody(caseLabel);
                }
                if (node.defaultEnabled && node.defaultCase != null) {
                    line(level + 1, t.defaultLabel + t.caseSuffix);
                    caseBody(node.defaultCase);
                }
                close(level);
            }

            private void caseBody(CaseLabel caseLabel) {
                chain(caseLabel.followElement, level + 2);
                if (t.fallthroughStop != null) {
                    line(level + 2, t.fallthroughStop);
                }
            }

            private void conditionalChain(Switch node) {
                String discriminant = Nodes.textOrEmpty(node);
                boolean first = true;
                for (CaseLabel caseLabel : node.cases) {
                    String condition = discriminant + t.equalityOperator + Nodes.textOrEmpty(caseLabel) + t.branchSuffix;
                    line(level, first ? open(t.branchPrefix + condition) : reopen(t.elseIfPrefix + condition));
                    block(caseLabel.followElement, level + 1);
                    first = false;
                }
                boolean withDefault = node.defaultEnabled && node.defaultCase != null;
                if (first) {
                    // No cases: the default body runs unconditionally.
                    if (withDefault) {
                        chain(node.defaultCase.followElement, level);
                    }
                    return;
                }
                if (withDefault) {
                    line(level, reopen(t.elseKeyword));
                    block(node.defaultCase.followElement, level + 1);
                }
                close(level);
            }

            @Override
            public Void visitCaseLabel(CaseLabel node) {
                chain(node.followElement, level);
                return null;
            }

            @Override
            public Void visitPreTestLoop(PreTestLoop node) {
                line(level, open(t.preTestLoopPrefix + Nodes.textOrEmpty(node) + t.preTestLoopSuffix));
                block(node.child, level + 1);
                close(level);
                return null;
            }

            @Override
            public Void visitCountLoop(CountLoop node) {
                line(level, open(t.countLoopPrefix + Nodes.textOrEmpty(node) + t.countLoopSuffix));
                block(node.child, level + 1);
                close(level);
                return null;
            }

            @Override
            public Void visitPostTestLoop(PostTestLoop node) {
                String footer = t.postTestLoopFooterPrefix + Nodes.textOrEmpty(node) + t.postTestLoopFooterSuffix;
                if (t.nativePostTestLoop) {
                    line(level, open(t.postTestLoopHeader));
                    block(node.child, level + 1);
                    line(level, t.blockClose == null ? footer : t.blockClose + " " + footer);
                } else {
                    // Emulated: loop forever and leave once the condition no longer holds.
                    line(level, open(t.postTestLoopHeader));
                    chain(node.child, level + 1);
                    line(level + 1, open(footer));
                    line(level + 2, t.breakStatement);
                    close(level + 1);
                    close(level);
                }
                return null;
            }

            @Override
            public Void visitFunctionDef(FunctionDef node) {
                line(level, open(t.functionPrefix + Nodes.textOrEmpty(node)
                        + t.functionParametersOpen + node.parameterList() + t.functionSuffix));
                block(node.child, level + 1);
                close(level);
                return null;
            }

            @Override
            public Void visitTryCatch(TryCatch node) {
                line(level, open(t.tryKeyword));
                block(node.tryChild, level + 1);
                line(level, reopen(t.catchPrefix + Nodes.textOrEmpty(node) + t.catchSuffix));
                block(node.catchChild, level + 1);
                close(level);
                return null;
            }
        }
    }
}
