package org.logicflow.model;

import java.util.List;

/**
 * 带标签的一段语句序列：分支的一个条件臂，或 try 的一个异常处理器
 *
 * @param label 条件文本或异常描述符
 * @param nodes 按源码顺序排列的节点
 */
public record LabeledBody(String label, List<LogicalNode> nodes) {

    public LabeledBody {
        nodes = List.copyOf(nodes);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public LogicalNode first() {
        return nodes.get(0);
    }

    public LogicalNode last() {
        return nodes.get(nodes.size() - 1);
    }
}
