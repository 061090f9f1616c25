package com.smartchoice.tree;

import com.smartchoice.tree.error.ConfigurationException;
import com.smartchoice.tree.error.EvaluationException;
import com.smartchoice.tree.spec.NodeSpecBag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

/**
 * A decision tree expanded from a {@link NodeSpecBag}.
 *
 * <p>Lifecycle: {@link #build} (or {@link #rebuild}) creates the skeleton and applies the
 * dependent overrides, {@link #evaluate} computes the terminal payoffs and
 * {@link #rollback} runs backward induction. Rollback can be repeated with different
 * utilities; changing a branch value needs a new evaluate first.
 *
 * <p>Not thread safe. Use {@link #copy} to work on an independent tree.
 */
public final class DecisionTree {

    private static final Logger log = LoggerFactory.getLogger(DecisionTree.class);

    private final NodeSpecBag specs;
    private List<TreeNode> nodes = List.of();
    private boolean evaluated;
    private boolean rolledBack;

    private DecisionTree(NodeSpecBag specs) {
        this.specs = specs;
    }

    /** The bag is copied; later changes to it do not affect the tree. */
    public static DecisionTree build(NodeSpecBag bag) {
        DecisionTree tree = new DecisionTree(bag.copy());
        tree.rebuild();
        return tree;
    }

    public DecisionTree copy() {
        DecisionTree copy = new DecisionTree(specs.copy());
        List<TreeNode> copied = new ArrayList<>(nodes.size());
        for (TreeNode node : nodes) copied.add(node.copy());
        copy.nodes = copied;
        copy.evaluated = evaluated;
        copy.rolledBack = rolledBack;
        return copy;
    }

    /** Regenerates the skeleton from {@link #specs()}, discarding all results and forced branches. */
    public DecisionTree rebuild() {
        List<TreeNode> built = TreeBuilder.build(specs);
        OverrideResolver.apply(built, specs);
        nodes = built;
        evaluated = false;
        rolledBack = false;
        log.debug("Built tree rooted at {} with {} nodes", specs.rootName(), built.size());
        return this;
    }

    public DecisionTree evaluate() {
        PayoffEvaluator.evaluate(nodes);
        evaluated = true;
        rolledBack = false;
        return this;
    }

    /** Expected value at the root, no utility. */
    public double rollback() {
        return rollback(View.EV, UtilityFunction.NONE, 0);
    }

    /**
     * Rolls the tree back and returns the requested quantity at the root. Without a utility
     * every view returns the expected value.
     */
    public double rollback(View view, UtilityFunction utility, double riskTolerance) {
        if (!evaluated) throw new EvaluationException("Tree must be evaluated before rollback");
        double result = RollbackEngine.rollback(nodes, view, utility, riskTolerance);
        rolledBack = true;
        return result;
    }

    /** As {@link #rollback(View, UtilityFunction, double)} with textual ids, e.g. {@code ("ce", "exp", 1000)}. */
    public double rollback(String viewId, String utilityId, double riskTolerance) {
        return rollback(View.fromId(viewId), UtilityFunction.fromId(utilityId), riskTolerance);
    }

    public int size() {
        return nodes.size();
    }

    public TreeNode node(int index) {
        checkIndex(index);
        return nodes.get(index);
    }

    public List<TreeNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<NodeSnapshot> snapshot() {
        return nodes.stream().map(TreeNode::snapshot).toList();
    }

    public boolean isEvaluated() {
        return evaluated;
    }

    public boolean isRolledBack() {
        return rolledBack;
    }

    /** The tree's own bag. Changes take effect on the next {@link #rebuild()}. */
    public NodeSpecBag specs() {
        return specs;
    }

    /** Sets the probability of every branch of {@code variable}. Returns the number of nodes changed. */
    public int setVariableProbability(String variable, double probability) {
        int touched = 0;
        for (TreeNode node : nodes) {
            if (variable.equals(node.tagName()) && node.tagProb() != null) {
                node.setTagProb(probability);
                touched++;
            }
        }
        rolledBack = false;
        return touched;
    }

    public int setBranchProbability(String variable, String branch, double probability) {
        int touched = 0;
        for (TreeNode node : nodes) {
            if (matches(node, variable, branch) && node.tagProb() != null) {
                node.setTagProb(probability);
                touched++;
            }
        }
        rolledBack = false;
        return touched;
    }

    /** Overwrites the value of every occurrence of the branch. The tree must be evaluated again. */
    public int setBranchValue(String variable, String branch, double value) {
        int touched = 0;
        for (TreeNode node : nodes) {
            if (matches(node, variable, branch)) {
                node.setTagValue(value);
                touched++;
            }
        }
        if (touched > 0) evaluated = false;
        rolledBack = false;
        return touched;
    }

    /** Value of the last occurrence of the branch in index order. */
    public OptionalDouble findBranchValue(String variable, String branch) {
        for (int i = nodes.size() - 1; i >= 0; i--) {
            TreeNode node = nodes.get(i);
            if (matches(node, variable, branch)) return OptionalDouble.of(node.tagValue());
        }
        return OptionalDouble.empty();
    }

    /** Makes rollback follow branch {@code position} of the node at {@code index}. */
    public void forceBranch(int index, int position) {
        InternalNode node = internal(index);
        if (position < 0 || position >= node.successors().size()) {
            throw new ConfigurationException("Node " + index + " has no branch at position " + position);
        }
        node.setForcedBranch(position);
        rolledBack = false;
    }

    public void clearForcedBranch(int index) {
        internal(index).setForcedBranch(null);
        rolledBack = false;
    }

    private InternalNode internal(int index) {
        checkIndex(index);
        if (nodes.get(index) instanceof InternalNode internal) return internal;
        throw new ConfigurationException("Node " + index + " is a terminal and has no branches");
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= nodes.size()) {
            throw new ConfigurationException("Node index " + index + " is out of range [0, " + nodes.size() + ")");
        }
    }

    private static boolean matches(TreeNode node, String variable, String branch) {
        return variable.equals(node.tagName()) && branch.equals(node.tagBranch());
    }

    @Override
    public String toString() {
        return "DecisionTree{" + "root=" + specs.rootName() + ", size=" + nodes.size()
                + ", evaluated=" + evaluated + ", rolledBack=" + rolledBack + '}';
    }
}
