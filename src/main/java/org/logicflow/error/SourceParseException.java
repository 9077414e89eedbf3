package org.logicflow.error;

import java.util.List;

/**
 * JavaParser 报告的语法错误
 */
public class SourceParseException extends FlowException {

    private final int line;
    private final List<String> problems;

    public SourceParseException(String origin, int line, List<String> problems) {
        super("Syntax error in " + origin + (line > 0 ? " at line " + line : "") + ": "
                + (problems.isEmpty() ? "unknown problem" : problems.get(0)));
        this.line = line;
        this.problems = List.copyOf(problems);
    }

    /** 第一个问题所在行号，未知时为 -1 */
    public int getLine() {
        return line;
    }

    public List<String> getProblems() {
        return problems;
    }
}
