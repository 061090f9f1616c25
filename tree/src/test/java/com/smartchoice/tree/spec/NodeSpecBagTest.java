package com.smartchoice.tree.spec;

import com.smartchoice.tree.error.ConfigurationException;
import com.smartchoice.tree.error.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.smartchoice.tree.fixture.TreeFixture.bidBag;
import static com.smartchoice.tree.fixture.TreeFixture.bidPayoff;
import static org.junit.jupiter.api.Assertions.*;

class NodeSpecBagTest {

    @Nested
    @DisplayName("chance nodes")
    class Chance {

        @Test
        void probabilitiesMustSumToOne_byDefault() {
            var bag = new NodeSpecBag();
            var ex = assertThrows(ValidationException.class, () -> bag.addChance("c", List.of(
                    new ChanceBranch("a", 0.5, 1, "t"),
                    new ChanceBranch("b", 0.4, 2, "t"))));
            assertTrue(ex.getMessage().contains("Sum of probabilities for variable c"), ex.getMessage());
            assertFalse(bag.contains("c"));
        }

        @Test
        void normalizePolicy_rescalesProbabilities() {
            var bag = new NodeSpecBag(ProbabilityPolicy.NORMALIZE).addChance("c", List.of(
                    new ChanceBranch("a", 1, 10, "t"),
                    new ChanceBranch("b", 3, 20, "t")));
            var spec = (ChanceSpec) bag.get("c");
            assertEquals(0.25, spec.branches().get(0).probability(), 1e-12);
            assertEquals(0.75, spec.branches().get(1).probability(), 1e-12);
            assertEquals(10, spec.branches().get(0).value());
        }

        @Test
        void normalizePolicy_rejectsZeroSum() {
            var bag = new NodeSpecBag(ProbabilityPolicy.NORMALIZE);
            assertThrows(ValidationException.class, () -> bag.addChance("c", List.of(
                    new ChanceBranch("a", 0, 10, "t"))));
        }

        @Test
        void allProblemsAreReportedTogether() {
            var bag = new NodeSpecBag();
            var ex = assertThrows(ValidationException.class, () -> bag.addChance("c", List.of(
                    new ChanceBranch("a", -0.5, 1, "t"),
                    new ChanceBranch("a", 1.5, 2, " "))));
            String msg = ex.getMessage();
            assertTrue(msg.contains("Duplicate branch a"), msg);
            assertTrue(msg.contains("has no successor"), msg);
            assertTrue(msg.contains("invalid probability -0.5"), msg);
        }

        @Test
        void tupleArityIsChecked() {
            var bag = new NodeSpecBag();
            var ex = assertThrows(ValidationException.class, () -> bag.addChanceTuples("c", List.of(
                    List.of("a", 0.5, 1, "t"),
                    List.of("b", 0.5, "t"))));
            assertTrue(ex.getMessage().contains("Branch #1 of variable c has invalid information"), ex.getMessage());
        }

        @Test
        void tupleSlotTypesAreChecked() {
            var bag = new NodeSpecBag();
            var ex = assertThrows(ValidationException.class, () -> bag.addChanceTuples("c", List.of(
                    List.of("a", "half", 1, "t"))));
            assertTrue(ex.getMessage().contains("probability must be a number"), ex.getMessage());
        }
    }

    @Nested
    @DisplayName("decision nodes")
    class Decision {

        @Test
        void tuplesBecomeBranches() {
            var bag = new NodeSpecBag().addDecisionTuples("d", List.of(
                    List.of("x", 1, "t"),
                    List.of("y", 2.5, "t")), false);
            var spec = (DecisionSpec) bag.get("d");
            assertEquals(List.of(new DecisionBranch("x", 1, "t"), new DecisionBranch("y", 2.5, "t")), spec.branches());
            assertFalse(spec.maximize());
        }

        @Test
        void tupleArityIsChecked() {
            var bag = new NodeSpecBag();
            assertThrows(ValidationException.class, () -> bag.addDecisionTuples("d", List.of(
                    List.of("x", 1, "t", "extra")), true));
        }

        @Test
        void emptyBranchListIsRejected() {
            var bag = new NodeSpecBag();
            assertThrows(ValidationException.class, () -> bag.addDecision("d", List.of(), true));
        }
    }

    @Test
    void firstNameIsRoot_andReAddingKeepsPosition() {
        var bag = bidBag();
        assertEquals("bid", bag.rootName());
        bag.addDecision("bid", List.of(new DecisionBranch("only", 600, "competitor_bid")), true);
        assertEquals("bid", bag.rootName());
        assertEquals(List.of("bid", "competitor_bid", "cost", "profit"), List.copyOf(bag.names()));
        assertEquals(List.of("only"), bag.get("bid").branchLabels());
    }

    @Test
    void rootNameOfEmptyBagFails() {
        assertThrows(ValidationException.class, () -> new NodeSpecBag().rootName());
    }

    @Test
    void topBottomBranches_useRawValues() {
        var bag = bidBag();
        assertEquals(new TopBottomBranches("high", "low"), bag.getTopBottomBranches("cost"));
        assertEquals(new TopBottomBranches("high", "low"), bag.getTopBottomBranches("bid"));
    }

    @Test
    void topBottomBranches_firstOccurrenceWinsTies() {
        var bag = new NodeSpecBag().addChance("c", List.of(
                new ChanceBranch("a", 0.25, 5, "t"),
                new ChanceBranch("b", 0.25, 5, "t"),
                new ChanceBranch("c", 0.5, 5, "t")));
        assertEquals(new TopBottomBranches("a", "a"), bag.getTopBottomBranches("c"));
    }

    @Test
    void topBottomBranches_rejectUnknownAndTerminal() {
        var bag = bidBag();
        assertThrows(ValidationException.class, () -> bag.getTopBottomBranches("nope"));
        assertThrows(ValidationException.class, () -> bag.getTopBottomBranches("profit"));
    }

    @Nested
    @DisplayName("dependent overrides")
    class Overrides {

        @Test
        void varargsFormBuildsConditions() {
            var bag = bidBag().setProbability(0.4, "competitor_bid", "low", "cost", "low");
            assertEquals(List.of(new DependentOverride(0.4, Map.of("competitor_bid", "low", "cost", "low"))),
                    bag.dependentProbabilities());
        }

        @Test
        void insertionOrderIsKept() {
            var bag = bidBag().setOutcome(1, "cost", "low").setOutcome(2, "cost", "low");
            assertEquals(1, bag.dependentOutcomes().get(0).payload());
            assertEquals(2, bag.dependentOutcomes().get(1).payload());
        }

        @Test
        void malformedConditionsAreRejected() {
            var bag = bidBag();
            assertThrows(ConfigurationException.class, () -> bag.setProbability(0.5));
            assertThrows(ConfigurationException.class, () -> bag.setProbability(0.5, "cost"));
            assertThrows(ConfigurationException.class, () -> bag.setOutcome(1, Map.of()));
            assertThrows(ConfigurationException.class, () -> bag.setOutcome(1, Map.of("cost", " ")));
        }
    }

    @Test
    void copyIsIndependent() {
        var original = bidBag();
        var copy = original.copy();
        copy.addTerminal("extra", bidPayoff()).setOutcome(1, "cost", "low");
        assertFalse(original.contains("extra"));
        assertTrue(original.dependentOutcomes().isEmpty());
        assertEquals(original.policy(), copy.policy());
    }
}
