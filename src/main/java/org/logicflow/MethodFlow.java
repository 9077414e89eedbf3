package org.logicflow;

import org.logicflow.graph.FlowGraph;
import org.logicflow.model.ProgramNode;

/**
 * 一个方法（或构造器）的分析结果
 *
 * @param name    "类型名#签名"，例如 {@code Sample#run(int)}
 * @param line    声明所在行
 * @param program 方法体的逻辑流树
 * @param graph   线性化后的流图
 */
public record MethodFlow(String name, int line, ProgramNode program, FlowGraph graph) {
}
