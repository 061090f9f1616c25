package com.smartchoice.sensitivity;

import com.smartchoice.tree.ChanceNode;
import com.smartchoice.tree.DecisionNode;
import com.smartchoice.tree.DecisionTree;
import com.smartchoice.tree.TreeNode;
import com.smartchoice.tree.error.EvaluationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Distribution of outcomes reachable from a node when the rolled-back strategy is followed.
 * Chance nodes mix the distributions of their branches; decision nodes take the one of their
 * optimal successor.
 *
 * @param targetIndex   the analysed node
 * @param distributions one per analysed node: the target when single, otherwise each of its branches
 */
public record RiskProfile(int targetIndex, List<Distribution> distributions) {

    public RiskProfile {
        distributions = List.copyOf(distributions);
    }

    public record Outcome(double value, double probability, double cumulativeProbability) {
    }

    /** Outcomes sorted by value. */
    public record Distribution(String label, double expectedValue, List<Outcome> outcomes) {
        public Distribution {
            outcomes = List.copyOf(outcomes);
        }
    }

    /** Reads the tree as it was last rolled back; the tree is not modified. */
    public static RiskProfile of(DecisionTree tree, int targetIndex, boolean single) {
        if (!tree.isRolledBack()) throw new EvaluationException("Risk profiles need a rolled back tree");
        TreeNode target = single ? Sweeps.target(tree, targetIndex) : Sweeps.internalTarget(tree, targetIndex);

        List<Distribution> distributions = new ArrayList<>();
        if (single) {
            distributions.add(distribution(tree, target));
        } else {
            for (int child : target.successors()) distributions.add(distribution(tree, tree.node(child)));
        }
        return new RiskProfile(targetIndex, distributions);
    }

    private static Distribution distribution(DecisionTree tree, TreeNode node) {
        NavigableMap<Double, Double> outcomes = outcomes(tree, node);
        List<Outcome> result = new ArrayList<>(outcomes.size());
        double cumulative = 0;
        for (Map.Entry<Double, Double> e : outcomes.entrySet()) {
            cumulative += e.getValue();
            result.add(new Outcome(e.getKey(), e.getValue(), cumulative));
        }
        String label = node.tagBranch() == null
                ? String.format(Locale.ROOT, "EV=%.2f", node.ev())
                : String.format(Locale.ROOT, "%s; EV=%.2f", node.tagBranch(), node.ev());
        return new Distribution(label, node.ev(), result);
    }

    private static NavigableMap<Double, Double> outcomes(DecisionTree tree, TreeNode node) {
        if (node instanceof DecisionNode d) {
            return outcomes(tree, tree.node(d.optimalSuccessor()));
        }
        if (node instanceof ChanceNode c) {
            if (c.forcedBranch() != null) return outcomes(tree, tree.node(c.successors().get(c.forcedBranch())));
            NavigableMap<Double, Double> merged = new TreeMap<>();
            for (int index : c.successors()) {
                TreeNode child = tree.node(index);
                double p = child.tagProb() == null ? 0.0 : child.tagProb();
                outcomes(tree, child).forEach((value, q) -> merged.merge(value + 0.0, p * q, Double::sum));
            }
            return merged;
        }
        NavigableMap<Double, Double> terminal = new TreeMap<>();
        // -0.0 and 0.0 are one outcome
        terminal.put(node.ev() + 0.0, 1.0);
        return terminal;
    }
}
