package org.logicflow.tree;

import org.logicflow.model.*;

import java.util.List;

/**
 * 以缩进文本打印逻辑流树，每层缩进两个空格
 */
public class TreePrinter {

    private static final String INDENT = "  ";

    public static String print(ProgramNode program) {
        StringBuilder sb = new StringBuilder();
        for (LogicalNode node : program.getChildren()) {
            printNode(node, 0, sb);
        }
        return sb.toString();
    }

    private static void printNode(LogicalNode node, int depth, StringBuilder sb) {
        node.accept(new LogicalNodeVisitor<Void>() {
            @Override
            public Void visitInstruction(InstructionNode n) {
                line(sb, depth, n.toString());
                return null;
            }

            @Override
            public Void visitLoop(LoopNode n) {
                line(sb, depth, n.toString());
                printAll(n.getChildren(), depth + 1, sb);
                return null;
            }

            @Override
            public Void visitBranch(BranchNode n) {
                line(sb, depth, "BranchNode:");
                for (LabeledBody branch : n.getBranches()) {
                    line(sb, depth + 1, branch.label() + ":");
                    printAll(branch.nodes(), depth + 2, sb);
                }
                return null;
            }

            @Override
            public Void visitTry(TryNode n) {
                line(sb, depth, "TryNode:");
                line(sb, depth + 1, "body:");
                printAll(n.getTryBody(), depth + 2, sb);
                if (!n.getHandlers().isEmpty()) {
                    line(sb, depth + 1, "excepts:");
                    for (LabeledBody handler : n.getHandlers()) {
                        line(sb, depth + 2, handler.label() + ":");
                        printAll(handler.nodes(), depth + 3, sb);
                    }
                }
                if (!n.getElseBody().isEmpty()) {
                    line(sb, depth + 1, "else:");
                    printAll(n.getElseBody(), depth + 2, sb);
                }
                if (!n.getFinallyBody().isEmpty()) {
                    line(sb, depth + 1, "finally:");
                    printAll(n.getFinallyBody(), depth + 2, sb);
                }
                return null;
            }

            @Override
            public Void visitWith(WithNode n) {
                line(sb, depth, n.toString());
                printAll(n.getChildren(), depth + 1, sb);
                return null;
            }
        });
    }

    private static void printAll(List<LogicalNode> nodes, int depth, StringBuilder sb) {
        for (LogicalNode child : nodes) {
            printNode(child, depth, sb);
        }
    }

    private static void line(StringBuilder sb, int depth, String text) {
        sb.append(INDENT.repeat(depth)).append(text).append('\n');
    }
}
