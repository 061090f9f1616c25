package com.smartchoice.tree;

import com.smartchoice.tree.error.ConfigurationException;
import com.smartchoice.tree.error.EvaluationException;
import com.smartchoice.tree.spec.ChanceBranch;
import com.smartchoice.tree.spec.NodeSpecBag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalDouble;

import static com.smartchoice.tree.fixture.TreeFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class DecisionTreeTest {

    @Test
    void lifecycleFlags() {
        DecisionTree tree = DecisionTree.build(bidBag());
        assertFalse(tree.isEvaluated());
        assertFalse(tree.isRolledBack());

        tree.evaluate();
        assertTrue(tree.isEvaluated());
        tree.rollback();
        assertTrue(tree.isRolledBack());

        tree.rebuild();
        assertFalse(tree.isEvaluated());
        assertNull(tree.node(FIRST_TERMINAL).ev());
    }

    @Test
    void rollbackBeforeEvaluateFails() {
        DecisionTree tree = DecisionTree.build(bidBag());
        assertThrows(EvaluationException.class, tree::rollback);
    }

    @Test
    void buildCopiesTheBag() {
        NodeSpecBag bag = bidBag();
        DecisionTree tree = DecisionTree.build(bag);
        bag.setOutcome(0, "cost", "low");
        assertNotSame(bag, tree.specs());
        assertTrue(tree.specs().dependentOutcomes().isEmpty());
    }

    @Test
    void mutatingSpecsTakesEffectOnRebuild() {
        DecisionTree tree = rolledBack(bidBag());
        tree.specs().addChance("cost", List.of(
                new ChanceBranch("low", 0.5, 200, "profit"),
                new ChanceBranch("high", 0.5, 600, "profit")));

        assertEquals(BID_TREE_SIZE, tree.size());
        tree.rebuild().evaluate();
        assertEquals(1 + 2 * (1 + 3 * 3), tree.size());
        assertEquals(65.0, tree.rollback(), EPS);
    }

    @Test
    void copyIsDeep() {
        DecisionTree original = rolledBack(bidBag());
        List<NodeSnapshot> before = original.snapshot();

        DecisionTree copy = original.copy();
        assertTrue(copy.isRolledBack());
        copy.setBranchValue("cost", "low", 0);
        copy.forceBranch(ROOT, 1);
        copy.evaluate();
        copy.rollback(View.CE, UtilityFunction.EXP, 100);
        copy.specs().setOutcome(1, "cost", "low");

        assertEquals(before, original.snapshot());
        assertTrue(original.specs().dependentOutcomes().isEmpty());
        assertNotEquals(before, copy.snapshot());
    }

    @Test
    void rollbackByIds() {
        DecisionTree tree = evaluated(fourBidBag());
        assertEquals(tree.rollback(View.CE, UtilityFunction.EXP, 1000), tree.rollback("ce", "exp", 1000), EPS);
        assertEquals(65.0, tree.rollback("eu", null, 0), EPS);
        assertThrows(ConfigurationException.class, () -> tree.rollback("pv", "exp", 1000));
        assertThrows(ConfigurationException.class, () -> tree.rollback("ev", "quadratic", 1000));
    }

    @Test
    void branchValueMutators() {
        DecisionTree tree = evaluated(bidBag());
        assertEquals(OptionalDouble.of(200), tree.findBranchValue("cost", "low"));
        assertEquals(OptionalDouble.empty(), tree.findBranchValue("cost", "none"));

        assertEquals(6, tree.setBranchValue("cost", "low", 0));
        assertFalse(tree.isEvaluated());
        assertEquals(OptionalDouble.of(0), tree.findBranchValue("cost", "low"));
        assertEquals(0, tree.setBranchValue("cost", "none", 1));
    }

    @Test
    void findBranchValueReportsTheLastOccurrence() {
        DecisionTree tree = evaluated(bidBag().setOutcome(250, "bid", "high", "cost", "low"));
        assertEquals(OptionalDouble.of(250), tree.findBranchValue("cost", "low"));
    }

    @Test
    void probabilityMutators_onlyTouchChanceBranches() {
        DecisionTree tree = rolledBack(bidBag());
        assertEquals(18, tree.setVariableProbability("cost", 0));
        assertEquals(0, tree.setVariableProbability("bid", 0));
        assertFalse(tree.isRolledBack());
        assertTrue(tree.isEvaluated());
        assertEquals(6, tree.setBranchProbability("cost", "high", 1));
        assertEquals(1.0, tree.node(5).tagProb());
        assertEquals(0.0, tree.node(3).tagProb());
    }

    @Test
    void badIndicesAndPositions() {
        DecisionTree tree = evaluated(bidBag());
        assertThrows(ConfigurationException.class, () -> tree.node(BID_TREE_SIZE));
        assertThrows(ConfigurationException.class, () -> tree.node(-1));
        assertThrows(ConfigurationException.class, () -> tree.forceBranch(ROOT, 2));
        assertThrows(ConfigurationException.class, () -> tree.forceBranch(FIRST_TERMINAL, 0));
        assertThrows(ConfigurationException.class, () -> tree.clearForcedBranch(99));
    }

    @Test
    void snapshotCarriesTypeSpecificFields() {
        DecisionTree tree = rolledBack(bidBag());
        List<NodeSnapshot> snapshot = tree.snapshot();
        assertEquals(BID_TREE_SIZE, snapshot.size());

        NodeSnapshot root = snapshot.get(ROOT);
        assertEquals(NodeType.DECISION, root.type());
        assertEquals(Boolean.TRUE, root.maximize());
        assertEquals(LOW_BID_COMPETITOR, root.optimalSuccessor());

        NodeSnapshot terminal = snapshot.get(FIRST_TERMINAL);
        assertEquals(NodeType.TERMINAL, terminal.type());
        assertNull(terminal.maximize());
        assertEquals(List.of(), terminal.successors());
        assertThrows(UnsupportedOperationException.class, () -> tree.nodes().remove(0));
    }
}
