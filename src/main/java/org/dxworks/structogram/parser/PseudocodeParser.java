package org.dxworks.structogram.parser;

import org.dxworks.structogram.model.Branch;
import org.dxworks.structogram.model.CaseLabel;
import org.dxworks.structogram.model.CountLoop;
import org.dxworks.structogram.model.FunctionDef;
import org.dxworks.structogram.model.IdGenerator;
import org.dxworks.structogram.model.Input;
import org.dxworks.structogram.model.InsertionPoint;
import org.dxworks.structogram.model.Node;
import org.dxworks.structogram.model.Nodes;
import org.dxworks.structogram.model.Output;
import org.dxworks.structogram.model.Parameter;
import org.dxworks.structogram.model.PostTestLoop;
import org.dxworks.structogram.model.PreTestLoop;
import org.dxworks.structogram.model.Switch;
import org.dxworks.structogram.model.Task;
import org.dxworks.structogram.model.TryCatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;

/**
 * Parses indentation-structured pseudocode into a structogram tree.
 * <p>
 * Lines are grouped into sibling blocks (a header line plus its deeper-indented lines). Each
 * block is classified with one block of lookahead, because if/else, try/catch and
 * repeat/while span two sibling blocks. The resulting chain is then linked from the last
 * statement backwards so every node can point at what follows it.
 * <p>
 * Unrecognized lines never fail the parse; they become {@link Task} nodes with their literal
 * text.
 */
public class PseudocodeParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(PseudocodeParser.class);
    private static final String ID_PREFIX = "__pseudo_";

    private final KeywordMap keywords;
    private final KeywordPatterns patterns;

    public PseudocodeParser() {
        this(KeywordMap.ENGLISH);
    }

    public PseudocodeParser(KeywordMap keywords) {
        this.keywords = keywords;
        this.patterns = new KeywordPatterns(keywords);
    }

    public static Node parse(String source, KeywordMap keywords) {
        return new PseudocodeParser(keywords).parse(source);
    }

    public KeywordMap getKeywords() {
        return keywords;
    }

    /**
     * Parses {@code source} into a chain rooted at an {@link InsertionPoint}. Identifiers are
     * fresh for every call.
     */
    public Node parse(String source) {
        IdGenerator ids = new IdGenerator(ID_PREFIX);
        List<SourceLine> lines = SourceLine.tokenize(source);
        if (lines.isEmpty()) {
            return Nodes.emptyChain(ids);
        }
        int baseIndent = Integer.MAX_VALUE;
        for (SourceLine line : lines) {
            baseIndent = Math.min(baseIndent, line.indent);
        }
        return parseChain(lines, baseIndent, ids);
    }

    private Node parseChain(List<SourceLine> lines, int baseIndent, IdGenerator ids) {
        List<Block> blocks = Block.group(lines, baseIndent);

        // Each statement is completed once the chain after it is known.
        List<UnaryOperator<Node>> statements = new ArrayList<>();
        int i = 0;
        while (i < blocks.size()) {
            Block block = blocks.get(i);
            Block next = i + 1 < blocks.size() ? blocks.get(i + 1) : null;
            if (patterns.isTryCatchPair(block, next)) {
                statements.add(tryCatch(block, next, ids));
                i += 2;
            } else if (patterns.isBranchPair(block, next)) {
                statements.add(branch(block, next, ids));
                i += 2;
            } else if (patterns.ifPrefix.matcher(block.text()).find()) {
                statements.add(branch(block, null, ids));
                i++;
            } else if (patterns.isPostTestLoopPair(block, next)) {
                statements.add(postTestLoop(block, next, ids));
                i += 2;
            } else {
                statements.add(single(block, ids));
                i++;
            }
        }

        Node tail = Nodes.emptyChain(ids);
        for (int j = statements.size() - 1; j >= 0; j--) {
            tail = new InsertionPoint(ids.next(), statements.get(j).apply(tail));
        }
        return tail;
    }

    private Node parseBody(Block block, IdGenerator ids) {
        int childIndent = Block.childIndent(block.children, block.header.indent);
        return parseChain(block.children, childIndent, ids);
    }

    private UnaryOperator<Node> tryCatch(Block tryBlock, Block catchBlock, IdGenerator ids) {
        String binding = KeywordPatterns.afterPrefix(patterns.catchPrefix, catchBlock.text());
        if (binding == null) {
            throw new MalformedConstructException("Expected a catch block after try", catchBlock.header.lineNumber);
        }
        String id = ids.next();
        String text = stripColon(binding);
        Node tryChild = parseBody(tryBlock, ids);
        Node catchChild = parseBody(catchBlock, ids);
        return follow -> new TryCatch(id, text, tryChild, catchChild, follow);
    }

    private UnaryOperator<Node> branch(Block ifBlock, Block elseBlock, IdGenerator ids) {
        String condition = KeywordPatterns.afterPrefix(patterns.ifPrefix, ifBlock.text());
        if (condition == null) {
            throw new MalformedConstructException("Expected an if header", ifBlock.header.lineNumber);
        }
        ColumnWidths header = ColumnWidths.extract(stripColon(condition));
        String id = ids.next();
        Node trueChild = parseBody(ifBlock, ids);
        Node falseChild = elseBlock != null ? parseBody(elseBlock, ids) : Nodes.emptyChain(ids);
        return follow -> new Branch(id, header.text, trueChild, falseChild, header.widths, follow);
    }

    private UnaryOperator<Node> postTestLoop(Block repeatBlock, Block whileBlock, IdGenerator ids) {
        String condition = KeywordPatterns.afterPrefix(patterns.whilePrefix, whileBlock.text());
        if (condition == null || condition.endsWith(":")) {
            throw new MalformedConstructException("Expected a while footer without colon", whileBlock.header.lineNumber);
        }
        if (!whileBlock.children.isEmpty()) {
            LOGGER.debug("Ignoring lines nested under loop footer at line {}", whileBlock.header.lineNumber);
        }
        String id = ids.next();
        String text = condition.trim();
        Node child = parseBody(repeatBlock, ids);
        return follow -> new PostTestLoop(id, text, child, follow);
    }

    private UnaryOperator<Node> single(Block block, IdGenerator ids) {
        String text = block.text();

        Matcher m = patterns.countLoop.matcher(text);
        if (m.matches()) {
            String id = ids.next();
            String header = m.group(1);
            Node child = parseBody(block, ids);
            return follow -> new CountLoop(id, header, child, follow);
        }

        m = patterns.headLoop.matcher(text);
        if (m.matches()) {
            String id = ids.next();
            String condition = m.group(1);
            Node child = parseBody(block, ids);
            return follow -> new PreTestLoop(id, condition, child, follow);
        }

        m = patterns.functionDef.matcher(text);
        if (m.matches()) {
            String id = ids.next();
            String name = m.group(1);
            List<Parameter> parameters = parseParameters(m.group(2));
            Node child = parseBody(block, ids);
            return follow -> new FunctionDef(id, name, parameters, child, follow);
        }

        m = patterns.switchBlock.matcher(text);
        if (m.matches()) {
            return switchStatement(block, ColumnWidths.extract(m.group(1)), ids);
        }

        m = patterns.input.matcher(text);
        if (m.matches()) {
            logIgnoredChildren(block);
            String id = ids.next();
            String variable = m.group(1);
            return follow -> new Input(id, variable, follow);
        }

        m = patterns.output.matcher(text);
        if (m.matches()) {
            logIgnoredChildren(block);
            String id = ids.next();
            String expression = m.group(1);
            return follow -> new Output(id, expression, follow);
        }

        LOGGER.debug("Line {} is a plain statement", block.header.lineNumber);
        logIgnoredChildren(block);
        String id = ids.next();
        return follow -> new Task(id, text, follow);
    }

    /**
     * Case blocks are grouped one level below the switch header. A missing default block still
     * produces an empty, disabled default case.
     */
    private UnaryOperator<Node> switchStatement(Block block, ColumnWidths header, IdGenerator ids) {
        String id = ids.next();
        int caseIndent = Block.childIndent(block.children, block.header.indent);
        List<CaseLabel> cases = new ArrayList<>();
        CaseLabel defaultCase = null;
        boolean defaultEnabled = false;

        for (Block caseBlock : Block.group(block.children, caseIndent)) {
            Matcher m = patterns.caseLabel.matcher(caseBlock.text());
            if (m.matches()) {
                String label = unquote(m.group(1));
                cases.add(new CaseLabel(ids.next(), label, parseBody(caseBlock, ids)));
            } else if (patterns.elseBlock.matcher(caseBlock.text()).matches()) {
                defaultEnabled = true;
                defaultCase = new CaseLabel(ids.next(), keywords.defaultLabel(), parseBody(caseBlock, ids));
            } else {
                LOGGER.debug("Ignoring line {} inside switch: not a case label", caseBlock.header.lineNumber);
            }
        }
        if (defaultCase == null) {
            defaultCase = new CaseLabel(ids.next(), keywords.defaultLabel(), Nodes.emptyChain(ids));
        }

        CaseLabel resolvedDefault = defaultCase;
        boolean resolvedEnabled = defaultEnabled;
        return follow -> new Switch(id, header.text, cases, resolvedEnabled, resolvedDefault, header.widths, follow);
    }

    private static List<Parameter> parseParameters(String raw) {
        List<Parameter> parameters = new ArrayList<>();
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return parameters;
        }
        String[] names = trimmed.split(",", -1);
        for (int i = 0; i < names.length; i++) {
            parameters.add(new Parameter(String.valueOf(i * 3), names[i].trim()));
        }
        return parameters;
    }

    private static void logIgnoredChildren(Block block) {
        if (!block.children.isEmpty()) {
            LOGGER.debug("Ignoring {} lines nested under statement at line {}",
                    block.children.size(), block.header.lineNumber);
        }
    }

    private static String stripColon(String text) {
        return text.endsWith(":") ? text.substring(0, text.length() - 1).stripTrailing() : text;
    }

    private static String unquote(String text) {
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }
}
