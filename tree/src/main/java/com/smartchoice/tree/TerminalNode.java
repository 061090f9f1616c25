package com.smartchoice.tree;

import com.smartchoice.tree.spec.PayoffFn;

import java.util.Map;

/**
 * End of a path. Keeps the payoff function and the path maps it was last called with, so
 * the inputs behind a terminal's value can be inspected after evaluation.
 */
public final class TerminalNode extends TreeNode {

    private final PayoffFn payoff;
    private Map<String, Double> lastValues = Map.of();
    private Map<String, Double> lastProbabilities = Map.of();
    private Map<String, String> lastBranches = Map.of();

    TerminalNode(int index, String name, PayoffFn payoff) {
        super(index, name);
        this.payoff = payoff;
    }

    private TerminalNode(TerminalNode other) {
        super(other);
        this.payoff = other.payoff;
        this.lastValues = other.lastValues;
        this.lastProbabilities = other.lastProbabilities;
        this.lastBranches = other.lastBranches;
    }

    @Override
    public NodeType type() {
        return NodeType.TERMINAL;
    }

    @Override
    TerminalNode copy() {
        return new TerminalNode(this);
    }

    /** May be null. */
    public PayoffFn payoff() {
        return payoff;
    }

    public Map<String, Double> lastValues() {
        return lastValues;
    }

    public Map<String, Double> lastProbabilities() {
        return lastProbabilities;
    }

    public Map<String, String> lastBranches() {
        return lastBranches;
    }

    /** The maps are stored as given; callers pass immutable copies. */
    void recordPayoffInputs(Map<String, Double> values, Map<String, Double> probabilities, Map<String, String> branches) {
        this.lastValues = values;
        this.lastProbabilities = probabilities;
        this.lastBranches = branches;
    }
}
