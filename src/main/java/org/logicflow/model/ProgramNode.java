package org.logicflow.model;

import java.util.List;

/**
 * 逻辑流树的根，持有顶层节点序列。本身不是 LogicalNode。
 */
public final class ProgramNode {

    private final List<LogicalNode> children;

    public ProgramNode(List<LogicalNode> children) {
        this.children = List.copyOf(children);
    }

    public List<LogicalNode> getChildren() {
        return children;
    }

    public boolean isEmpty() {
        return children.isEmpty();
    }

    @Override
    public String toString() {
        return "ProgramNode(" + children.size() + " nodes)";
    }
}
