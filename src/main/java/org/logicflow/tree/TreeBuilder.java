package org.logicflow.tree;

import org.logicflow.error.FlowBuildException;
import org.logicflow.error.MalformedInputException;
import org.logicflow.model.BranchNode;
import org.logicflow.model.InstructionNode;
import org.logicflow.model.LogicalNode;
import org.logicflow.model.LoopNode;
import org.logicflow.model.ProgramNode;
import org.logicflow.model.TryNode;
import org.logicflow.model.WithNode;
import org.logicflow.source.ExceptHandler;
import org.logicflow.source.SourceStmt;
import org.logicflow.source.StmtKind;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 逻辑流树构建器
 * <p>
 * 自顶向下遍历通用语句序列，维护一个作用域栈（每个打开的词法块一层），
 * 为每条语句生成一个类型化的逻辑节点。复合语句的节点先追加到当前作用域以固定其位置，
 * 再压入新作用域递归处理子语句，弹出后把收集到的节点挂到对应槽位上。
 * <p>
 * 实例不可重入，也不是线程安全的；每次 {@link #build(List)} 都会重置内部状态。
 */
public class TreeBuilder {

    private static final Logger LOGGER = Logger.getLogger(TreeBuilder.class.getName());

    private final Deque<Scope> scopes = new ArrayDeque<>();
    private int idCounter = 0;

    /**
     * 构建逻辑流树
     *
     * @param statements 顶层语句序列
     * @return 程序根节点
     * @throws FlowBuildException 任一语句处理失败时抛出，携带最内层出错语句的位置
     */
    public ProgramNode build(List<SourceStmt> statements) {
        idCounter = 0;
        scopes.clear();
        scopes.push(new Scope(1));
        try {
            for (SourceStmt stmt : statements) {
                visit(stmt);
            }
            return new ProgramNode(scopes.peek().getNodes());
        } finally {
            scopes.clear();
        }
    }

    private void visit(SourceStmt stmt) {
        if (stmt == null) {
            throw new MalformedInputException("statement is null");
        }
        try {
            dispatch(stmt);
        } catch (RuntimeException e) {
            throw FlowBuildException.wrap(e, stmt.getLine(), stmt.getColumn());
        }
    }

    private void dispatch(SourceStmt stmt) {
        StmtKind kind = stmt.getKind();
        if (kind.isSimple()) {
            addToScope(new InstructionNode(nextId(), stmt.getText(), stmt.getLine(), stmt.getColumn()));
            return;
        }
        switch (kind) {
            case IF -> visitIf(stmt);
            case FOR -> visitLoop(stmt, require(stmt.getTarget(), "target") + " in "
                    + require(stmt.getIterable(), "iterable"));
            case WHILE -> visitLoop(stmt, require(stmt.getTest(), "test"));
            case TRY -> visitTry(stmt);
            case WITH -> visitWith(stmt);
            // 函数 / 类定义不进入其内部
            case DEFINITION -> LOGGER.fine(() -> "Skipping definition at line " + stmt.getLine());
            default -> LOGGER.log(Level.FINE, "Skipping unsupported statement {0}", stmt);
        }
    }

    private void visitIf(SourceStmt stmt) {
        BranchNode branchNode = new BranchNode(nextId(), stmt.getLine(), stmt.getColumn());
        addToScope(branchNode);

        branchNode.addBranch(require(stmt.getTest(), "test"), collect(stmt.getBody(), "body"));

        // elif / else 链
        SourceStmt current = stmt;
        while (current.getOrelse() != null && !current.getOrelse().isEmpty()) {
            List<SourceStmt> orelse = current.getOrelse();
            if (orelse.size() == 1 && orelse.get(0).getKind() == StmtKind.IF) {
                current = orelse.get(0);
                addElif(branchNode, current);
            } else {
                branchNode.addBranch(BranchNode.ELSE, collect(orelse, "orelse"));
                break;
            }
        }
        branchNode.seal();
    }

    /**
     * elif 臂是一条独立语句，出错时报告它自己的位置
     */
    private void addElif(BranchNode branchNode, SourceStmt elif) {
        try {
            branchNode.addBranch(require(elif.getTest(), "test"), collect(elif.getBody(), "body"));
        } catch (RuntimeException e) {
            throw FlowBuildException.wrap(e, elif.getLine(), elif.getColumn());
        }
    }

    private void visitLoop(SourceStmt stmt, String condition) {
        LoopNode loopNode = new LoopNode(nextId(), condition, stmt.getLine(), stmt.getColumn());
        addToScope(loopNode);

        loopNode.addChildren(collect(stmt.getBody(), "body"));
        loopNode.seal();
    }

    private void visitTry(SourceStmt stmt) {
        TryNode tryNode = new TryNode(nextId(), stmt.getLine(), stmt.getColumn());
        addToScope(tryNode);

        tryNode.addNodes(TryNode.Slot.TRY, collect(stmt.getBody(), "body"));

        if (stmt.getHandlers() != null) {
            for (ExceptHandler handler : stmt.getHandlers()) {
                tryNode.addExcept(describe(handler), collect(handler.body(), "body"));
            }
        }
        if (stmt.getOrelse() != null && !stmt.getOrelse().isEmpty()) {
            tryNode.addNodes(TryNode.Slot.ELSE, collect(stmt.getOrelse(), "orelse"));
        }
        if (stmt.getFinalBody() != null && !stmt.getFinalBody().isEmpty()) {
            tryNode.addNodes(TryNode.Slot.FINALLY, collect(stmt.getFinalBody(), "finalbody"));
        }
        tryNode.seal();
    }

    private void visitWith(SourceStmt stmt) {
        List<String> items = require(stmt.getItems(), "items");
        WithNode withNode = new WithNode(nextId(), String.join(", ", items), stmt.getLine(), stmt.getColumn());
        addToScope(withNode);

        withNode.addChildren(collect(stmt.getBody(), "body"));
        withNode.seal();
    }

    /**
     * 异常描述符：无类型为 "all"，有绑定名时追加 " as name"
     */
    static String describe(ExceptHandler handler) {
        if (handler.type() == null) {
            return TryNode.ALL;
        }
        return handler.name() != null ? handler.type() + " as " + handler.name() : handler.type();
    }

    /**
     * 在新作用域中处理一组子语句，返回收集到的节点
     */
    private List<LogicalNode> collect(List<SourceStmt> statements, String field) {
        require(statements, field);
        Scope scope = new Scope(scopes.peek().getLevel() + 1);
        scopes.push(scope);
        try {
            for (SourceStmt child : statements) {
                visit(child);
            }
        } finally {
            scopes.pop();
        }
        return scope.getNodes();
    }

    private void addToScope(LogicalNode node) {
        scopes.peek().add(node);
    }

    private int nextId() {
        return idCounter++;
    }

    private static <T> T require(T value, String field) {
        if (value == null) {
            throw MalformedInputException.missingField(field);
        }
        return value;
    }
}
