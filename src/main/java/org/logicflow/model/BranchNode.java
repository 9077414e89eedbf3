package org.logicflow.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 分支节点：if / elif... / else
 * <p>
 * 条件臂按声明顺序保存，key 为逗号连接的条件文本，无条件的最后一臂标记为 {@code else}。
 */
public final class BranchNode extends LogicalNode {

    public static final String ELSE = "else";

    private final List<LabeledBody> branches = new ArrayList<>();

    public BranchNode(int id, int line, int column) {
        super(id, line, column);
    }

    /**
     * 追加一个条件臂
     *
     * @param condition 条件文本，else 分支传 {@link #ELSE}
     * @param nodes     该臂的语句节点
     */
    public void addBranch(String condition, List<LogicalNode> nodes) {
        checkMutable();
        branches.add(new LabeledBody(condition, nodes));
    }

    public List<LabeledBody> getBranches() {
        return Collections.unmodifiableList(branches);
    }

    public List<String> getConditions() {
        return branches.stream().map(LabeledBody::label).collect(Collectors.toList());
    }

    @Override
    public String getKey() {
        return String.join(", ", getConditions());
    }

    @Override
    public <R> R accept(LogicalNodeVisitor<R> visitor) {
        return visitor.visitBranch(this);
    }
}
