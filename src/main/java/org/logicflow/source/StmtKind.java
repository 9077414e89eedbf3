package org.logicflow.source;

/**
 * 通用语句种类
 */
public enum StmtKind {
    EXPRESSION,
    ASSIGNMENT,
    RETURN,
    BREAK,
    CONTINUE,
    PASS,
    RAISE,
    ASSERT,
    IF,
    FOR,
    WHILE,
    TRY,
    WITH,
    /** 函数或类定义：不进入其内部 */
    DEFINITION,
    /** 无处理规则的语句，构建时跳过 */
    OTHER;

    /**
     * 是否作为一条指令节点记录
     */
    public boolean isSimple() {
        return switch (this) {
            case EXPRESSION, ASSIGNMENT, RETURN, BREAK, CONTINUE, PASS, RAISE, ASSERT -> true;
            default -> false;
        };
    }
}
