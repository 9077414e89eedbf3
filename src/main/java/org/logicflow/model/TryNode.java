package org.logicflow.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 异常处理节点，包含 try / except / else / finally 四个槽位
 * <p>
 * except 槽是有序的 (异常描述符 → 处理器语句) 列表。没有类型的处理器描述符为 {@link #ALL}，
 * 绑定了变量名的处理器描述符追加 {@code " as <name>"}。
 */
public final class TryNode extends LogicalNode {

    public static final String ALL = "all";

    /** 槽位名 */
    public enum Slot {
        TRY, ELSE, FINALLY
    }

    private final List<LogicalNode> tryBody = new ArrayList<>();
    private final List<LabeledBody> handlers = new ArrayList<>();
    private final List<LogicalNode> elseBody = new ArrayList<>();
    private final List<LogicalNode> finallyBody = new ArrayList<>();

    public TryNode(int id, int line, int column) {
        super(id, line, column);
    }

    public void addNodes(Slot slot, List<LogicalNode> nodes) {
        checkMutable();
        switch (slot) {
            case TRY -> tryBody.addAll(nodes);
            case ELSE -> elseBody.addAll(nodes);
            case FINALLY -> finallyBody.addAll(nodes);
        }
    }

    public void addExcept(String exception, List<LogicalNode> nodes) {
        checkMutable();
        handlers.add(new LabeledBody(exception, nodes));
    }

    public List<LogicalNode> getTryBody() {
        return Collections.unmodifiableList(tryBody);
    }

    public List<LabeledBody> getHandlers() {
        return Collections.unmodifiableList(handlers);
    }

    public List<LogicalNode> getElseBody() {
        return Collections.unmodifiableList(elseBody);
    }

    public List<LogicalNode> getFinallyBody() {
        return Collections.unmodifiableList(finallyBody);
    }

    @Override
    public String getKey() {
        List<String> parts = new ArrayList<>();
        parts.add("try");
        handlers.forEach(h -> parts.add(h.label()));
        if (!elseBody.isEmpty()) {
            parts.add("else");
        }
        if (!finallyBody.isEmpty()) {
            parts.add("finally");
        }
        return String.join(", ", parts);
    }

    @Override
    public <R> R accept(LogicalNodeVisitor<R> visitor) {
        return visitor.visitTry(this);
    }
}
