package org.logicflow.graph;

import org.logicflow.model.*;

import java.util.*;
import java.util.function.Function;

public class GraphBuilder {

    /**
     * 把逻辑流树线性化为有向图
     * <p>
     * 每个节点只访问一次。普通语句连向同一作用域中的下一个兄弟；
     * 复合语句体内按顺序两两相连，体的最后一个节点连向复合语句自身的后继。
     * 不画循环回边，也不画 try 体到 except 处理器的边。
     */
    public static FlowGraph build(ProgramNode program) {
        LinearizeContext context = new LinearizeContext();
        for (LogicalNode node : program.getChildren()) {
            emit(node, program.getChildren(), node.toString(), context);
        }
        return context.graph;
    }

    private static void emit(LogicalNode node, List<LogicalNode> siblings, String label, LinearizeContext ctx) {
        ctx.register(node, label);
        node.accept(new EmitVisitor(ctx, siblings));
    }

    /**
     * 线性化上下文：结果图 + 已访问节点，用于保证每个节点只出现一次、id 不重复
     */
    private static class LinearizeContext {
        final FlowGraph graph = new FlowGraph();
        final Map<Integer, LogicalNode> byId = new HashMap<>();

        void register(LogicalNode node, String label) {
            LogicalNode previous = byId.putIfAbsent(node.getId(), node);
            if (previous == node) {
                throw new IllegalStateException(node + " is reachable more than once in the tree");
            }
            if (previous != null) {
                throw new IllegalStateException("Duplicate node id " + node.getId()
                        + " shared by " + previous + " and " + node);
            }
            graph.addVertex(node.getId(), label);
        }

        void addEdge(LogicalNode from, LogicalNode to, String label) {
            graph.addEdge(from.getId(), to.getId(), label);
        }
    }

    private static class EmitVisitor implements LogicalNodeVisitor<Void> {

        private final LinearizeContext ctx;
        private final List<LogicalNode> siblings;

        EmitVisitor(LinearizeContext ctx, List<LogicalNode> siblings) {
            this.ctx = ctx;
            this.siblings = siblings;
        }

        @Override
        public Void visitInstruction(InstructionNode node) {
            linkToSuccessor(node, node, null);
            return null;
        }

        @Override
        public Void visitLoop(LoopNode node) {
            List<LogicalNode> body = node.getChildren();
            chain(body, LogicalNode::toString);
            if (!body.isEmpty()) {
                // 最后一条连向循环自身的后继，而不是回到循环头
                linkToSuccessor(last(body), node, null);
            }
            return null;
        }

        @Override
        public Void visitBranch(BranchNode node) {
            for (LabeledBody branch : node.getBranches()) {
                String condition = branch.label();
                chain(branch.nodes(), child -> condition + ": " + child);
                if (!branch.isEmpty()) {
                    // 每个分支独立汇合到分支节点的后继
                    linkToSuccessor(branch.last(), node, condition);
                }
            }
            return null;
        }

        @Override
        public Void visitTry(TryNode node) {
            List<LogicalNode> tryBody = node.getTryBody();
            List<LogicalNode> elseBody = node.getElseBody();
            List<LogicalNode> finallyBody = node.getFinallyBody();

            chain(tryBody, LogicalNode::toString);
            for (LabeledBody handler : node.getHandlers()) {
                String exception = handler.label();
                chain(handler.nodes(), child -> "except " + exception + ": " + child);
            }
            chain(elseBody, LogicalNode::toString);
            chain(finallyBody, child -> "finally: " + child);

            if (!elseBody.isEmpty() && !tryBody.isEmpty()) {
                ctx.addEdge(last(tryBody), elseBody.get(0), null);
            }

            // 没有 finally 时 try 的出口不连向后继
            if (finallyBody.isEmpty()) {
                return null;
            }
            LogicalNode finallyEntry = finallyBody.get(0);
            if (!elseBody.isEmpty()) {
                ctx.addEdge(last(elseBody), finallyEntry, null);
            } else if (!tryBody.isEmpty()) {
                ctx.addEdge(last(tryBody), finallyEntry, null);
            }
            for (LabeledBody handler : node.getHandlers()) {
                if (!handler.isEmpty()) {
                    ctx.addEdge(handler.last(), finallyEntry, handler.label());
                }
            }
            linkToSuccessor(last(finallyBody), node, null);
            return null;
        }

        @Override
        public Void visitWith(WithNode node) {
            List<LogicalNode> body = node.getChildren();
            chain(body, LogicalNode::toString);
            if (!body.isEmpty()) {
                linkToSuccessor(last(body), node, null);
            }
            return null;
        }

        /**
         * 体内节点两两相连，并递归处理每个节点
         */
        private void chain(List<LogicalNode> body, Function<LogicalNode, String> labeler) {
            for (int i = 0; i < body.size(); i++) {
                LogicalNode child = body.get(i);
                if (i > 0) {
                    ctx.addEdge(body.get(i - 1), child, null);
                }
                emit(child, body, labeler.apply(child), ctx);
            }
        }

        /**
         * 在兄弟序列中找到 anchor 的位置，若其后还有节点则连一条 source -> 下一个节点的边
         */
        private void linkToSuccessor(LogicalNode source, LogicalNode anchor, String label) {
            int index = indexOf(siblings, anchor);
            if (index >= 0 && index + 1 < siblings.size()) {
                ctx.addEdge(source, siblings.get(index + 1), label);
            }
        }
    }

    // 按身份查找，不能用 equals
    private static int indexOf(List<LogicalNode> nodes, LogicalNode target) {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) == target) {
                return i;
            }
        }
        return -1;
    }

    private static LogicalNode last(List<LogicalNode> nodes) {
        return nodes.get(nodes.size() - 1);
    }
}
