package org.logicflow.model;

/**
 * 叶子节点：一条普通语句（赋值、表达式、return 等），key 为语句源码
 */
public final class InstructionNode extends LogicalNode {

    private final String instruction;

    public InstructionNode(int id, String instruction, int line, int column) {
        super(id, line, column);
        this.instruction = instruction;
        seal();
    }

    @Override
    public String getKey() {
        return instruction;
    }

    @Override
    public <R> R accept(LogicalNodeVisitor<R> visitor) {
        return visitor.visitInstruction(this);
    }
}
