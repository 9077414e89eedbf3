package org.logicflow.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 节点模型单元测试：key 规则与冻结
 */
public class LogicalNodeTest {

    @Test
    public void testInstructionIsSealedOnCreation() {
        InstructionNode node = new InstructionNode(0, "x = 1;", 3, 5);

        assertTrue(node.isSealed());
        assertEquals("x = 1;", node.getKey());
        assertEquals(3, node.getLine());
        assertEquals(5, node.getColumn());
        assertEquals("InstructionNode(x = 1;)", node.toString());
    }

    @Test
    public void testBranchKeyJoinsConditionsInOrder() {
        BranchNode branch = new BranchNode(0, 1, 1);
        branch.addBranch("a > 1", List.of(new InstructionNode(1, "f();", 2, 1)));
        branch.addBranch("a > 0", List.of());
        branch.addBranch(BranchNode.ELSE, List.of(new InstructionNode(2, "g();", 4, 1)));

        assertEquals("a > 1, a > 0, else", branch.getKey());
        assertEquals("BranchNode(a > 1, a > 0, else)", branch.toString());
        assertTrue(branch.getBranches().get(1).isEmpty());
    }

    @Test
    public void testBranchKeepsRepeatedConditions() {
        BranchNode branch = new BranchNode(0, 1, 1);
        branch.addBranch("p", List.of(new InstructionNode(1, "a();", 2, 1)));
        branch.addBranch("p", List.of(new InstructionNode(2, "b();", 3, 1)));

        assertEquals(2, branch.getBranches().size(), "重复条件不覆盖之前的分支");
        assertEquals("p, p", branch.getKey());
    }

    @Test
    public void testTryKeyListsNonEmptySlots() {
        TryNode tryNode = new TryNode(0, 1, 1);
        tryNode.addNodes(TryNode.Slot.TRY, List.of(new InstructionNode(1, "a();", 2, 1)));
        assertEquals("try", tryNode.getKey());

        tryNode.addExcept("IOException as e", List.of());
        tryNode.addNodes(TryNode.Slot.FINALLY, List.of(new InstructionNode(2, "c();", 6, 1)));
        assertEquals("try, IOException as e, finally", tryNode.getKey());
    }

    @Test
    public void testSealedCompoundRejectsMutation() {
        TryNode tryNode = new TryNode(0, 1, 1);
        tryNode.seal();

        assertThrows(IllegalStateException.class, () -> tryNode.addExcept(TryNode.ALL, List.of()));
        assertThrows(IllegalStateException.class, () -> tryNode.addNodes(TryNode.Slot.ELSE, List.of()));

        WithNode with = new WithNode(1, "lock", 1, 1);
        with.seal();
        assertThrows(IllegalStateException.class, () -> with.addChildren(List.of()));
    }

    @Test
    public void testLabeledBodyCopiesNodes() {
        java.util.ArrayList<LogicalNode> nodes = new java.util.ArrayList<>();
        nodes.add(new InstructionNode(0, "a();", 1, 1));
        LabeledBody body = new LabeledBody("p", nodes);
        nodes.clear();

        assertEquals(1, body.nodes().size());
        assertSame(body.first(), body.last());
    }
}
