package org.logicflow.graph;

/**
 * 一条有向边：from 执行完后紧接着执行 to
 */
public record FlowEdge(int from, int to) {

    @Override
    public String toString() {
        return from + "->" + to;
    }
}
