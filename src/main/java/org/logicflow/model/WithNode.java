package org.logicflow.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 上下文块节点（try-with-resources、synchronized 等），key 为逗号连接的上下文表达式
 */
public final class WithNode extends LogicalNode {

    private final String contextExpr;
    private final List<LogicalNode> children = new ArrayList<>();

    public WithNode(int id, String contextExpr, int line, int column) {
        super(id, line, column);
        this.contextExpr = contextExpr;
    }

    public void addChildren(List<LogicalNode> nodes) {
        checkMutable();
        children.addAll(nodes);
    }

    public List<LogicalNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public String getKey() {
        return contextExpr;
    }

    @Override
    public <R> R accept(LogicalNodeVisitor<R> visitor) {
        return visitor.visitWith(this);
    }
}
