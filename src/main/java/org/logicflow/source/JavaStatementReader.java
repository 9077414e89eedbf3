package org.logicflow.source;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.*;
import org.logicflow.error.FlowBuildException;
import org.logicflow.error.MalformedInputException;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Java 前端：把 JavaParser 的语句 AST 降级为通用语句序列
 * <p>
 * BlockStmt 本身不生成语句，其内部语句直接展开到外层序列；
 * 经典 for 循环被改写为 "初始化语句 + while"，switch 被改写为 if / else if 链，
 * try-with-resources 的资源部分被表示为上下文块。
 */
public class JavaStatementReader {

    private static final Logger LOGGER = Logger.getLogger(JavaStatementReader.class.getName());

    private static final String ALWAYS = "true";

    /**
     * 读取一个方法体
     *
     * @param body 方法体
     * @return 通用语句序列
     */
    public List<SourceStmt> read(BlockStmt body) {
        return read(body.getStatements());
    }

    public List<SourceStmt> read(NodeList<Statement> statements) {
        List<SourceStmt> out = new ArrayList<>();
        for (Statement s : statements) {
            lower(s, out);
        }
        return out;
    }

    /**
     * 降级单条语句，结果追加到 out（一条 Java 语句可能产生零条或多条通用语句）
     */
    private void lower(Statement s, List<SourceStmt> out) {
        int line = line(s);
        int column = column(s);

        if (s instanceof BlockStmt block) {
            // 代码块本身不建节点，只展开里面的语句
            for (Statement child : block.getStatements()) {
                lower(child, out);
            }
        } else if (s instanceof ExpressionStmt exprStmt) {
            out.add(SourceStmt.simple(expressionKind(exprStmt.getExpression()), s.toString(), line, column));
        } else if (s instanceof ExplicitConstructorInvocationStmt) {
            out.add(SourceStmt.simple(StmtKind.EXPRESSION, s.toString(), line, column));
        } else if (s instanceof ReturnStmt || s instanceof YieldStmt) {
            out.add(SourceStmt.simple(StmtKind.RETURN, s.toString(), line, column));
        } else if (s instanceof BreakStmt) {
            out.add(SourceStmt.simple(StmtKind.BREAK, s.toString(), line, column));
        } else if (s instanceof ContinueStmt) {
            out.add(SourceStmt.simple(StmtKind.CONTINUE, s.toString(), line, column));
        } else if (s instanceof EmptyStmt) {
            out.add(SourceStmt.simple(StmtKind.PASS, ";", line, column));
        } else if (s instanceof ThrowStmt) {
            out.add(SourceStmt.simple(StmtKind.RAISE, s.toString(), line, column));
        } else if (s instanceof AssertStmt) {
            out.add(SourceStmt.simple(StmtKind.ASSERT, s.toString(), line, column));
        } else if (s instanceof LabeledStmt labeled) {
            lower(labeled.getStatement(), out);
        } else if (s instanceof IfStmt ifStmt) {
            out.add(lowerIf(ifStmt));
        } else if (s instanceof ForEachStmt forEach) {
            out.add(SourceStmt.forStmt(forEach.getVariableDeclarator().getNameAsString(),
                    forEach.getIterable().toString(), lowerBody(forEach.getBody()), line, column));
        } else if (s instanceof ForStmt forStmt) {
            lowerFor(forStmt, out);
        } else if (s instanceof WhileStmt whileStmt) {
            out.add(SourceStmt.whileStmt(whileStmt.getCondition().toString(),
                    lowerBody(whileStmt.getBody()), line, column));
        } else if (s instanceof DoStmt doStmt) {
            out.add(SourceStmt.whileStmt(doStmt.getCondition().toString(),
                    lowerBody(doStmt.getBody()), line, column));
        } else if (s instanceof TryStmt tryStmt) {
            out.add(lowerTry(tryStmt));
        } else if (s instanceof SynchronizedStmt sync) {
            out.add(SourceStmt.withStmt(List.of(sync.getExpression().toString()),
                    lowerBody(sync.getBody()), line, column));
        } else if (s instanceof SwitchStmt switchStmt) {
            lowerSwitch(switchStmt, out);
        } else if (s instanceof LocalClassDeclarationStmt || s instanceof LocalRecordDeclarationStmt) {
            out.add(SourceStmt.builder(StmtKind.DEFINITION).text(firstLine(s)).at(line, column).build());
        } else if (s instanceof UnparsableStmt) {
            throw new FlowBuildException(line, column, new MalformedInputException("unparsable statement"));
        } else {
            LOGGER.fine(() -> "No lowering rule for " + s.getClass().getSimpleName() + " at line " + line);
            out.add(SourceStmt.builder(StmtKind.OTHER).text(s.toString()).at(line, column).build());
        }
    }

    private SourceStmt lowerIf(IfStmt ifStmt) {
        List<SourceStmt> orelse = new ArrayList<>();
        ifStmt.getElseStmt().ifPresent(elseStmt -> lower(elseStmt, orelse));
        return SourceStmt.ifStmt(ifStmt.getCondition().toString(), lowerBody(ifStmt.getThenStmt()),
                orelse, line(ifStmt), column(ifStmt));
    }

    /**
     * for (init; compare; update) body  ==>  init; while (compare) { body; update; }
     */
    private void lowerFor(ForStmt forStmt, List<SourceStmt> out) {
        for (Expression init : forStmt.getInitialization()) {
            out.add(SourceStmt.simple(expressionKind(init), init + ";", line(init), column(init)));
        }
        List<SourceStmt> body = lowerBody(forStmt.getBody());
        for (Expression update : forStmt.getUpdate()) {
            body.add(SourceStmt.simple(expressionKind(update), update + ";", line(update), column(update)));
        }
        String test = forStmt.getCompare().map(Expression::toString).orElse(ALWAYS);
        out.add(SourceStmt.whileStmt(test, body, line(forStmt), column(forStmt)));
    }

    private SourceStmt lowerTry(TryStmt tryStmt) {
        int line = line(tryStmt);
        int column = column(tryStmt);
        List<SourceStmt> tryBody = read(tryStmt.getTryBlock());

        if (!tryStmt.getResources().isEmpty()) {
            List<String> resources = tryStmt.getResources().stream()
                    .map(Expression::toString)
                    .collect(Collectors.toList());
            SourceStmt resourceBlock = SourceStmt.withStmt(resources, tryBody, line, column);
            if (tryStmt.getCatchClauses().isEmpty() && tryStmt.getFinallyBlock().isEmpty()) {
                return resourceBlock;
            }
            // 资源在 catch / finally 之前关闭，所以上下文块位于 try 体内
            tryBody = List.of(resourceBlock);
        }

        List<ExceptHandler> handlers = new ArrayList<>();
        for (CatchClause clause : tryStmt.getCatchClauses()) {
            handlers.add(new ExceptHandler(clause.getParameter().getType().toString(),
                    clause.getParameter().getNameAsString(), read(clause.getBody())));
        }
        List<SourceStmt> finalBody = tryStmt.getFinallyBlock().map(this::read).orElse(null);
        return SourceStmt.tryStmt(tryBody, handlers, null, finalBody, line, column);
    }

    /**
     * switch 改写为 if / else if 链：条件为 "selector == label"，多个标签用 || 连接；
     * 没有语句的 case 贯穿到下一个 case；default 总是作为最后的 else。
     */
    private void lowerSwitch(SwitchStmt switchStmt, List<SourceStmt> out) {
        String selector = switchStmt.getSelector().toString();
        List<String> tests = new ArrayList<>();
        List<List<SourceStmt>> bodies = new ArrayList<>();
        List<Integer> lines = new ArrayList<>();
        List<Integer> columns = new ArrayList<>();
        List<SourceStmt> defaultBody = null;

        List<String> pendingLabels = new ArrayList<>();
        boolean pendingDefault = false;
        SwitchEntry firstPending = null;
        for (SwitchEntry entry : switchStmt.getEntries()) {
            if (firstPending == null) {
                firstPending = entry;
            }
            if (entry.getLabels().isEmpty()) {
                pendingDefault = true;
            }
            entry.getLabels().forEach(label -> pendingLabels.add(selector + " == " + label));
            if (entry.getStatements().isEmpty()) {
                continue;
            }
            List<SourceStmt> body = read(entry.getStatements());
            if (pendingDefault) {
                defaultBody = body;
            } else {
                tests.add(String.join(" || ", pendingLabels));
                bodies.add(body);
                lines.add(line(firstPending));
                columns.add(column(firstPending));
            }
            pendingLabels.clear();
            pendingDefault = false;
            firstPending = null;
        }
        if (pendingDefault) {
            defaultBody = List.of();
        } else if (!pendingLabels.isEmpty()) {
            tests.add(String.join(" || ", pendingLabels));
            bodies.add(List.of());
            lines.add(line(firstPending));
            columns.add(column(firstPending));
        }

        if (tests.isEmpty()) {
            if (defaultBody != null) {
                out.addAll(defaultBody);
            }
            return;
        }

        // 从后往前拼出 else if 链，第一个 case 使用 switch 自身的位置
        List<SourceStmt> orelse = defaultBody;
        for (int i = tests.size() - 1; i >= 0; i--) {
            int line = i == 0 ? line(switchStmt) : lines.get(i);
            int column = i == 0 ? column(switchStmt) : columns.get(i);
            orelse = List.of(SourceStmt.ifStmt(tests.get(i), bodies.get(i), orelse, line, column));
        }
        out.addAll(orelse);
    }

    private List<SourceStmt> lowerBody(Statement body) {
        List<SourceStmt> out = new ArrayList<>();
        lower(body, out);
        return out;
    }

    private static StmtKind expressionKind(Expression expr) {
        if (expr instanceof AssignExpr || expr instanceof VariableDeclarationExpr) {
            return StmtKind.ASSIGNMENT;
        }
        if (expr instanceof UnaryExpr unary) {
            switch (unary.getOperator()) {
                case PREFIX_INCREMENT, PREFIX_DECREMENT, POSTFIX_INCREMENT, POSTFIX_DECREMENT -> {
                    return StmtKind.ASSIGNMENT;
                }
                default -> {
                    return StmtKind.EXPRESSION;
                }
            }
        }
        return StmtKind.EXPRESSION;
    }

    private static String firstLine(Node node) {
        String text = node.toString();
        int newline = text.indexOf('\n');
        return newline < 0 ? text : text.substring(0, newline).trim();
    }

    private static int line(Node node) {
        return node.getBegin().map(p -> p.line).orElse(-1);
    }

    private static int column(Node node) {
        return node.getBegin().map(p -> p.column).orElse(-1);
    }
}
