package org.dxworks.structogram.generator;

/**
 * Template fragments for one target language.
 * <p>
 * Compound headers are written as {@code prefix + text + suffix}, followed by
 * {@code " " + blockOpen} when the language delimits blocks. Null fragments are omitted.
 * Templates can also be supplied from configuration, so all fields are plain properties.
 */
public class CodeTemplate {
    public String inputPrefix = "";
    public String inputSuffix = "";
    public String outputPrefix = "";
    public String outputSuffix = "";
    public String taskPrefix = "";
    public String taskSuffix = "";

    public String branchPrefix;
    public String branchSuffix;
    public String elseKeyword;
    public String elseIfPrefix;

    public String tryKeyword;
    public String catchPrefix;
    public String catchSuffix;

    public String countLoopPrefix;
    public String countLoopSuffix;
    public String preTestLoopPrefix;
    public String preTestLoopSuffix;

    // Foot-tested loops: either "header { body } footerPrefix cond footerSuffix" or,
    // without a native construct, "header body, then footerPrefix cond footerSuffix + break".
    public boolean nativePostTestLoop;
    public String postTestLoopHeader;
    public String postTestLoopFooterPrefix;
    public String postTestLoopFooterSuffix;
    public String breakStatement;

    public String functionPrefix;
    public String functionParametersOpen = "(";
    public String functionSuffix;

    // Multi-way branch: a native switch, or an if/else-if chain comparing with equalityOperator.
    public boolean nativeSwitch;
    public String switchPrefix;
    public String switchSuffix;
    public String casePrefix;
    public String caseSuffix;
    public String defaultLabel;
    public String fallthroughStop;
    public String equalityOperator = " == ";

    public String blockOpen;
    public String blockClose;
    public String emptyBody;

    public static CodeTemplate python() {
        CodeTemplate t = new CodeTemplate();
        t.inputSuffix = " = input(\"Eingabe\")";
        t.outputPrefix = "print(";
        t.outputSuffix = ")";
        t.branchPrefix = "if ";
        t.branchSuffix = ":";
        t.elseKeyword = "else:";
        t.elseIfPrefix = "elif ";
        t.tryKeyword = "try:";
        t.catchPrefix = "except ";
        t.catchSuffix = ":";
        t.countLoopPrefix = "for ";
        t.countLoopSuffix = ":";
        t.preTestLoopPrefix = "while ";
        t.preTestLoopSuffix = ":";
        t.nativePostTestLoop = false;
        t.postTestLoopHeader = "while True:";
        t.postTestLoopFooterPrefix = "if not (";
        t.postTestLoopFooterSuffix = "):";
        t.breakStatement = "break";
        t.functionPrefix = "def ";
        t.functionSuffix = "):";
        t.nativeSwitch = false;
        t.emptyBody = "pass";
        return t;
    }

    public static CodeTemplate java() {
        CodeTemplate t = braced();
        t.inputSuffix = " = System.console().readLine();";
        t.outputPrefix = "System.out.println(";
        t.outputSuffix = ");";
        t.functionPrefix = "public void ";
        return t;
    }

    public static CodeTemplate javascript() {
        CodeTemplate t = braced();
        t.inputSuffix = " = prompt(\"Eingabe\");";
        t.outputPrefix = "console.log(";
        t.outputSuffix = ");";
        t.functionPrefix = "function ";
        return t;
    }

    private static CodeTemplate braced() {
        CodeTemplate t = new CodeTemplate();
        t.taskSuffix = ";";
        t.branchPrefix = "if (";
        t.branchSuffix = ")";
        t.elseKeyword = "else";
        t.elseIfPrefix = "else if (";
        t.tryKeyword = "try";
        t.catchPrefix = "catch (";
        t.catchSuffix = ")";
        t.countLoopPrefix = "for (";
        t.countLoopSuffix = ")";
        t.preTestLoopPrefix = "while (";
        t.preTestLoopSuffix = ")";
        t.nativePostTestLoop = true;
        t.postTestLoopHeader = "do";
        t.postTestLoopFooterPrefix = "while (";
        t.postTestLoopFooterSuffix = ");";
        t.breakStatement = "break;";
        t.functionSuffix = ")";
        t.nativeSwitch = true;
        t.switchPrefix = "switch (";
        t.switchSuffix = ")";
        t.casePrefix = "case ";
        t.caseSuffix = ":";
        t.defaultLabel = "default";
        t.fallthroughStop = "break;";
        t.blockOpen = "{";
        t.blockClose = "}";
        return t;
    }
}
