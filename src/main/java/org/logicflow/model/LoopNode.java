package org.logicflow.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 循环节点。key 为 "target in iterable"（迭代循环）或条件表达式（条件循环）
 */
public final class LoopNode extends LogicalNode {

    private final String condition;
    private final List<LogicalNode> children = new ArrayList<>();

    public LoopNode(int id, String condition, int line, int column) {
        super(id, line, column);
        this.condition = condition;
    }

    public void addChildren(List<LogicalNode> nodes) {
        checkMutable();
        children.addAll(nodes);
    }

    /** 循环体，按源码顺序 */
    public List<LogicalNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    @Override
    public String getKey() {
        return condition;
    }

    @Override
    public <R> R accept(LogicalNodeVisitor<R> visitor) {
        return visitor.visitLoop(this);
    }
}
