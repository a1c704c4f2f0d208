package org.dxworks.structogram.parser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line patterns of one keyword dialect. Keywords are quoted before being embedded, and matching
 * ignores case.
 */
final class KeywordPatterns {

    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    final Pattern tryBlock;
    final Pattern catchPrefix;
    final Pattern ifPrefix;
    final Pattern elseBlock;
    final Pattern repeatBlock;
    final Pattern whilePrefix;
    final Pattern countLoop;
    final Pattern headLoop;
    final Pattern functionDef;
    final Pattern switchBlock;
    final Pattern caseLabel;
    final Pattern input;
    final Pattern output;

    KeywordPatterns(KeywordMap keywords) {
        String kTry = Pattern.quote(keywords.tryKeyword());
        String kCatch = Pattern.quote(keywords.catchKeyword());
        String kIf = Pattern.quote(keywords.ifKeyword());
        String kElse = Pattern.quote(keywords.elseKeyword());
        String kRepeat = Pattern.quote(keywords.repeatKeyword());
        String kWhile = Pattern.quote(keywords.whileKeyword());
        String kFor = Pattern.quote(keywords.forKeyword());
        String kFunction = Pattern.quote(keywords.functionKeyword());
        String kSwitch = Pattern.quote(keywords.switchKeyword());
        String kCase = Pattern.quote(keywords.caseKeyword());
        String kInput = Pattern.quote(keywords.inputKeyword());
        String kOutput = Pattern.quote(keywords.outputKeyword());

        this.tryBlock = Pattern.compile("^" + kTry + "\\s*:$", FLAGS);
        this.catchPrefix = Pattern.compile("^" + kCatch + "\\s+", FLAGS);
        this.ifPrefix = Pattern.compile("^" + kIf + "\\s+", FLAGS);
        this.elseBlock = Pattern.compile("^" + kElse + "\\s*:$", FLAGS);
        this.repeatBlock = Pattern.compile("^" + kRepeat + "\\s*:$", FLAGS);
        this.whilePrefix = Pattern.compile("^" + kWhile + "\\s+", FLAGS);
        this.countLoop = Pattern.compile("^" + kRepeat + "\\s+" + kFor + "\\s+(.+?)\\s*:$", FLAGS);
        this.headLoop = Pattern.compile("^" + kRepeat + "\\s+" + kWhile + "\\s+(.+?)\\s*:$", FLAGS);
        this.functionDef = Pattern.compile("^" + kFunction + "\\s+(\\w+)\\s*\\(([^)]*)\\)\\s*:$", FLAGS);
        this.switchBlock = Pattern.compile("^" + kSwitch + "\\s+(.+?)\\s*:$", FLAGS);
        this.caseLabel = Pattern.compile("^" + kCase + "\\s+(.+?)\\s*:$", FLAGS);
        this.input = Pattern.compile("^" + kInput + "\\s*\\(\\s*\"?([^\"]*)\"?\\s*\\)$", FLAGS);
        this.output = Pattern.compile("^" + kOutput + "\\s*\\(\\s*\"?([^\"]*)\"?\\s*\\)$", FLAGS);
    }

    boolean isTryCatchPair(Block block, Block next) {
        return next != null && tryBlock.matcher(block.text()).matches()
                && catchPrefix.matcher(next.text()).find();
    }

    boolean isBranchPair(Block block, Block next) {
        return next != null && ifPrefix.matcher(block.text()).find()
                && elseBlock.matcher(next.text()).matches();
    }

    /** A foot-tested loop is only merged when the while line has no trailing colon. */
    boolean isPostTestLoopPair(Block block, Block next) {
        return next != null && repeatBlock.matcher(block.text()).matches()
                && whilePrefix.matcher(next.text()).find()
                && !next.text().endsWith(":");
    }

    /** Text following a prefix pattern, or null when the prefix does not match. */
    static String afterPrefix(Pattern prefix, String text) {
        Matcher m = prefix.matcher(text);
        return m.find() ? text.substring(m.end()) : null;
    }
}
