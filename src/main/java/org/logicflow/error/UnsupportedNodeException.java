package org.logicflow.error;

/**
 * 必须对每种节点分类的消费者遇到了无法处理的节点类型
 */
public class UnsupportedNodeException extends FlowException {

    public UnsupportedNodeException(String message) {
        super(message);
    }
}
