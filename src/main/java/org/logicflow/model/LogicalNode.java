package org.logicflow.model;

/**
 * 逻辑流树中的一个节点（指令、循环、分支、异常处理、上下文块）
 * <p>
 * 节点身份由 {@link #getId()} 决定：图构建只能用 id 作为键，
 * 不能用 key 文本，因为两条语句的源码可能完全相同。
 * 复合节点在其语句遍历结束后被 {@link #seal()}，之后不可再修改。
 */
public abstract sealed class LogicalNode permits InstructionNode, LoopNode, BranchNode, TryNode, WithNode {

    private final int id;
    private final int line;
    private final int column;
    private boolean sealed;

    protected LogicalNode(int id, int line, int column) {
        this.id = id;
        this.line = line;
        this.column = column;
    }

    public int getId() {
        return id;
    }

    /** 起始行号（从 1 开始） */
    public int getLine() {
        return line;
    }

    /** 起始列号（从 1 开始） */
    public int getColumn() {
        return column;
    }

    /**
     * 节点的可读键，含义随节点类型不同
     */
    public abstract String getKey();

    public abstract <R> R accept(LogicalNodeVisitor<R> visitor);

    public boolean isSealed() {
        return sealed;
    }

    /**
     * 冻结节点，之后任何修改都会抛出 IllegalStateException
     */
    public void seal() {
        sealed = true;
    }

    protected void checkMutable() {
        if (sealed) {
            throw new IllegalStateException(this + " is sealed and can no longer be modified");
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + getKey() + ")";
    }
}
