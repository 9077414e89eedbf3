package org.logicflow.model;

/**
 * 逻辑节点的穷举访问者。新增节点类型时，所有实现都必须同步修改，编译器会报错提示。
 */
public interface LogicalNodeVisitor<R> {

    R visitInstruction(InstructionNode node);

    R visitLoop(LoopNode node);

    R visitBranch(BranchNode node);

    R visitTry(TryNode node);

    R visitWith(WithNode node);
}
