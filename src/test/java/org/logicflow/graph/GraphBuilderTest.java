package org.logicflow.graph;

import org.junit.jupiter.api.Test;
import org.logicflow.model.*;
import org.logicflow.source.ExceptHandler;
import org.logicflow.source.SourceStmt;
import org.logicflow.source.StmtKind;
import org.logicflow.tree.TreeBuilder;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * GraphBuilder（树线性化）单元测试
 * <p>
 * 覆盖：
 * 1. 顺序、分支汇合、循环、try/except/else/finally 的后继边
 * 2. 没有 finally 时出口不连向后继
 * 3. 每个节点只出现一次、重复 id 检测
 * 4. 两次线性化结果一致
 */
public class GraphBuilderTest {

    private static SourceStmt call(String text) {
        return SourceStmt.simple(StmtKind.EXPRESSION, text, 1, 1);
    }

    private static ProgramNode tree(SourceStmt... statements) {
        return new TreeBuilder().build(List.of(statements));
    }

    /**
     * 按 key 查找顶点 id（标签以 "(key)" 结尾），要求唯一
     */
    private static int id(FlowGraph graph, String key) {
        List<Integer> matches = graph.vertices().entrySet().stream()
                .filter(e -> e.getValue().endsWith("(" + key + ")"))
                .map(java.util.Map.Entry::getKey)
                .toList();
        assertEquals(1, matches.size(), "顶点 " + key + " 应唯一存在");
        return matches.get(0);
    }

    @Test
    public void testSequentialInstructions() {
        ProgramNode program = new ProgramNode(List.of(
                new InstructionNode(0, "x=1", 1, 1),
                new InstructionNode(1, "x=2", 2, 1)));

        FlowGraph graph = GraphBuilder.build(program);

        assertEquals(2, graph.vertexCount());
        assertEquals(1, graph.edgeCount());
        assertTrue(graph.hasEdge(0, 1), "x=1 -> x=2");
        assertEquals("InstructionNode(x=1)", graph.label(0));
    }

    @Test
    public void testIfElseRejoinsSuccessor() {
        FlowGraph graph = GraphBuilder.build(tree(
                SourceStmt.ifStmt("cond", List.of(call("a()")), List.of(call("b()")), 1, 1),
                call("c()")));

        int a = id(graph, "a()");
        int b = id(graph, "b()");
        int c = id(graph, "c()");
        assertTrue(graph.hasEdge(a, c));
        assertTrue(graph.hasEdge(b, c));
        assertFalse(graph.hasEdge(a, b), "分支之间没有边");
        assertFalse(graph.hasEdge(b, a));
        assertEquals("cond", graph.edgeLabel(a, c));
        assertEquals("else", graph.edgeLabel(b, c));
        assertEquals("cond: InstructionNode(a())", graph.label(a));
        assertEquals("else: InstructionNode(b())", graph.label(b));
    }

    @Test
    public void testWhileLoopHasNoBackEdge() {
        ProgramNode program = tree(
                SourceStmt.whileStmt("cond", List.of(call("body()")), 1, 1),
                call("after()"));
        FlowGraph graph = GraphBuilder.build(program);

        int loop = program.getChildren().get(0).getId();
        int body = id(graph, "body()");
        int after = id(graph, "after()");
        assertTrue(graph.hasEdge(body, after));
        assertFalse(graph.hasEdge(body, body));
        assertFalse(graph.hasEdge(body, loop), "循环体不回连循环头");
        assertFalse(graph.hasEdge(loop, body));
    }

    @Test
    public void testLoopBodyChainedInOrder() {
        FlowGraph graph = GraphBuilder.build(tree(
                SourceStmt.forStmt("i", "xs", List.of(call("a()"), call("b()"), call("c()")), 1, 1),
                call("d()")));

        assertTrue(graph.hasEdge(id(graph, "a()"), id(graph, "b()")));
        assertTrue(graph.hasEdge(id(graph, "b()"), id(graph, "c()")));
        assertTrue(graph.hasEdge(id(graph, "c()"), id(graph, "d()")));
        assertFalse(graph.hasEdge(id(graph, "a()"), id(graph, "d()")), "只有最后一条连向循环的后继");
    }

    @Test
    public void testTryExceptFinallyAtEndOfScope() {
        FlowGraph graph = GraphBuilder.build(tree(SourceStmt.tryStmt(
                List.of(call("a()")),
                List.of(new ExceptHandler("E", null, List.of(call("b()")))),
                null,
                List.of(call("c()")),
                1, 1)));

        int a = id(graph, "a()");
        int b = id(graph, "b()");
        int c = id(graph, "c()");
        assertTrue(graph.hasEdge(a, c));
        assertTrue(graph.hasEdge(b, c));
        assertTrue(graph.successors(c).isEmpty(), "finally 之后没有后继");
        assertFalse(graph.hasEdge(a, b), "try 体不连向异常处理器");
        assertEquals("E", graph.edgeLabel(b, c));
        assertEquals("except E: InstructionNode(b())", graph.label(b));
        assertEquals("finally: InstructionNode(c())", graph.label(c));
    }

    @Test
    public void testElifChainRejoinsSuccessor() {
        SourceStmt elif = SourceStmt.ifStmt("q", List.of(call("b()")), List.of(call("c()")), 3, 1);
        FlowGraph graph = GraphBuilder.build(tree(
                SourceStmt.ifStmt("p", List.of(call("a()")), List.of(elif), 1, 1),
                call("d()")));

        int d = id(graph, "d()");
        assertTrue(graph.hasEdge(id(graph, "a()"), d));
        assertTrue(graph.hasEdge(id(graph, "b()"), d));
        assertTrue(graph.hasEdge(id(graph, "c()"), d));
        assertEquals("q", graph.edgeLabel(id(graph, "b()"), d));
    }

    @Test
    public void testBranchArmsEachHaveExactlyOneExit() {
        ProgramNode program = tree(
                SourceStmt.ifStmt("p", List.of(call("a1()"), call("a2()")),
                        List.of(call("b()")), 1, 1),
                call("after()"));
        FlowGraph graph = GraphBuilder.build(program);

        BranchNode branch = (BranchNode) program.getChildren().get(0);
        int after = id(graph, "after()");
        for (LabeledBody arm : branch.getBranches()) {
            assertEquals(List.of(after), graph.successors(arm.last().getId()));
        }
    }

    @Test
    public void testBranchAsLastStatementHasNoExit() {
        ProgramNode program = tree(
                call("before()"),
                SourceStmt.ifStmt("p", List.of(call("a()")), List.of(call("b()")), 2, 1));
        FlowGraph graph = GraphBuilder.build(program);

        assertTrue(graph.successors(id(graph, "a()")).isEmpty());
        assertTrue(graph.successors(id(graph, "b()")).isEmpty());
        assertTrue(graph.hasEdge(id(graph, "before()"), program.getChildren().get(1).getId()));
    }

    @Test
    public void testTryWithoutFinallyLeavesExitsUnlinked() {
        ProgramNode program = tree(
                SourceStmt.tryStmt(List.of(call("a()")),
                        List.of(new ExceptHandler("E", "e", List.of(call("b()")))), null, null, 1, 1),
                call("after()"));
        FlowGraph graph = GraphBuilder.build(program);

        int tryId = program.getChildren().get(0).getId();
        int after = id(graph, "after()");
        assertFalse(graph.hasEdge(id(graph, "a()"), after), "没有 finally 时 try 体不连向后继");
        assertFalse(graph.hasEdge(id(graph, "b()"), after), "没有 finally 时处理器不连向后继");
        assertFalse(graph.hasEdge(tryId, after));
        assertTrue(graph.predecessors(after).isEmpty());
    }

    @Test
    public void testTryElseFinallyJoins() {
        FlowGraph graph = GraphBuilder.build(tree(
                SourceStmt.tryStmt(List.of(call("a()")),
                        List.of(new ExceptHandler("E1", null, List.of(call("b()"))),
                                new ExceptHandler("E2", null, List.of(call("c()")))),
                        List.of(call("d()")),
                        List.of(call("f1()"), call("f2()")),
                        1, 1),
                call("after()")));

        int a = id(graph, "a()");
        int d = id(graph, "d()");
        int f1 = id(graph, "f1()");
        int f2 = id(graph, "f2()");
        assertTrue(graph.hasEdge(a, d), "try -> else");
        assertTrue(graph.hasEdge(d, f1), "else -> finally");
        assertFalse(graph.hasEdge(a, f1), "有 else 时 try 不直接连 finally");
        assertTrue(graph.hasEdge(id(graph, "b()"), f1));
        assertTrue(graph.hasEdge(id(graph, "c()"), f1));
        assertTrue(graph.hasEdge(f1, f2));
        assertTrue(graph.hasEdge(f2, id(graph, "after()")));
        assertEquals(3, graph.predecessors(f1).size());
    }

    @Test
    public void testWithBlockLinksToSuccessor() {
        FlowGraph graph = GraphBuilder.build(tree(
                SourceStmt.withStmt(List.of("lock"), List.of(call("a()"), call("b()")), 1, 1),
                call("c()")));

        assertTrue(graph.hasEdge(id(graph, "a()"), id(graph, "b()")));
        assertTrue(graph.hasEdge(id(graph, "b()"), id(graph, "c()")));
        assertFalse(graph.hasEdge(id(graph, "a()"), id(graph, "c()")));
    }

    @Test
    public void testNestedCompoundExitsThroughOuterNode() {
        ProgramNode program = tree(
                SourceStmt.forStmt("x", "xs", List.of(
                        call("a()"),
                        SourceStmt.ifStmt("x", List.of(call("b()")), null, 3, 1)), 1, 1),
                call("after()"));
        FlowGraph graph = GraphBuilder.build(program);

        LoopNode loop = (LoopNode) program.getChildren().get(0);
        BranchNode branch = (BranchNode) loop.getChildren().get(1);
        assertTrue(graph.hasEdge(id(graph, "a()"), branch.getId()));
        assertTrue(graph.successors(id(graph, "b()")).isEmpty(), "分支是循环体最后一条，臂内无后继");
        assertTrue(graph.hasEdge(branch.getId(), id(graph, "after()")), "循环最后一个节点连向循环后继");
    }

    @Test
    public void testEveryNodeVisitedExactlyOnce() {
        ProgramNode program = tree(
                call("a()"),
                SourceStmt.whileStmt("c", List.of(
                        SourceStmt.tryStmt(List.of(call("a()")),
                                List.of(new ExceptHandler(null, null, List.of(call("a()")))),
                                List.of(call("a()")), List.of(call("a()")), 3, 1)), 2, 1),
                SourceStmt.withStmt(List.of("r"), List.of(
                        SourceStmt.ifStmt("p", List.of(call("a()")), List.of(call("a()")), 9, 1)), 8, 1));

        FlowGraph graph = GraphBuilder.build(program);

        assertEquals(countNodes(program.getChildren()), graph.vertexCount());
        assertEquals(11, graph.vertexCount());
    }

    @Test
    public void testLinearizationIsIdempotent() {
        ProgramNode program = tree(
                SourceStmt.ifStmt("p", List.of(call("a()")), List.of(call("b()")), 1, 1),
                SourceStmt.tryStmt(List.of(call("c()")),
                        List.of(new ExceptHandler("E", null, List.of(call("d()")))), null, List.of(call("e()")), 3, 1),
                call("f()"));

        FlowGraph first = GraphBuilder.build(program);
        FlowGraph second = GraphBuilder.build(program);

        assertEquals(first.vertices(), second.vertices());
        assertEquals(first.edges(), second.edges());
    }

    @Test
    public void testSharedNodeIsRejected() {
        InstructionNode shared = new InstructionNode(0, "x=1", 1, 1);

        assertThrows(IllegalStateException.class,
                () -> GraphBuilder.build(new ProgramNode(List.of(shared, shared))));
    }

    @Test
    public void testDuplicateIdIsRejected() {
        ProgramNode program = new ProgramNode(List.of(
                new InstructionNode(3, "x=1", 1, 1),
                new InstructionNode(3, "x=1", 2, 1)));

        assertThrows(IllegalStateException.class, () -> GraphBuilder.build(program));
    }

    @Test
    public void testEmptyProgram() {
        FlowGraph graph = GraphBuilder.build(new ProgramNode(List.of()));

        assertEquals(0, graph.vertexCount());
        assertTrue(graph.edges().isEmpty());
    }

    private static int countNodes(List<LogicalNode> nodes) {
        int count = 0;
        for (LogicalNode node : nodes) {
            count++;
            if (node instanceof LoopNode loop) {
                count += countNodes(loop.getChildren());
            } else if (node instanceof WithNode with) {
                count += countNodes(with.getChildren());
            } else if (node instanceof BranchNode branch) {
                for (LabeledBody arm : branch.getBranches()) {
                    count += countNodes(arm.nodes());
                }
            } else if (node instanceof TryNode tryNode) {
                count += countNodes(tryNode.getTryBody());
                for (LabeledBody handler : tryNode.getHandlers()) {
                    count += countNodes(handler.nodes());
                }
                count += countNodes(tryNode.getElseBody());
                count += countNodes(tryNode.getFinallyBody());
            }
        }
        return count;
    }
}
