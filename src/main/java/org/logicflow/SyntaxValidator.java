package org.logicflow;

import com.github.javaparser.ParseResult;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import org.logicflow.error.SourceParseException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 检查 JavaParser 的解析结果，语法错误时抛出带行号的异常
 */
public final class SyntaxValidator {

    private SyntaxValidator() {
    }

    /**
     * @param result 解析结果
     * @param origin 源码来源（文件路径等），用于错误信息
     * @return 语法正确时的编译单元
     * @throws SourceParseException 存在语法错误时抛出
     */
    public static CompilationUnit requireValid(ParseResult<CompilationUnit> result, String origin) {
        if (result.isSuccessful() && result.getResult().isPresent()) {
            return result.getResult().get();
        }

        List<Problem> problems = result.getProblems();
        List<String> messages = problems.stream()
                .map(p -> "Line " + line(p) + ": " + p.getMessage())
                .collect(Collectors.toList());
        int firstLine = problems.isEmpty() ? -1 : line(problems.get(0));
        throw new SourceParseException(origin, firstLine, messages);
    }

    // 如果获取不到行号，返回 -1
    private static int line(Problem p) {
        return p.getLocation()
                .flatMap(l -> l.getBegin().getRange())
                .map(r -> r.begin.line)
                .orElse(-1);
    }
}
