package org.logicflow.tree;

import org.logicflow.model.LogicalNode;

import java.util.ArrayList;
import java.util.List;

/**
 * 一个词法块内已完成节点的累加器，只在树构建期间存在
 */
final class Scope {

    private final int level;
    private final List<LogicalNode> nodes = new ArrayList<>();

    Scope(int level) {
        this.level = level;
    }

    int getLevel() {
        return level;
    }

    void add(LogicalNode node) {
        nodes.add(node);
    }

    List<LogicalNode> getNodes() {
        return nodes;
    }

    @Override
    public String toString() {
        return "Scope(level=" + level + ",nodesCount=" + nodes.size() + ")";
    }
}
