package com.smartchoice.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A node with branches: a decision or a chance node. */
public abstract sealed class InternalNode extends TreeNode permits DecisionNode, ChanceNode {

    private final List<Integer> successors;
    private Integer forcedBranch;
    private Integer optimalSuccessor;

    protected InternalNode(int index, String name) {
        super(index, name);
        this.successors = new ArrayList<>();
    }

    protected InternalNode(InternalNode other) {
        super(other);
        this.successors = new ArrayList<>(other.successors);
        this.forcedBranch = other.forcedBranch;
        this.optimalSuccessor = other.optimalSuccessor;
    }

    /** Child indices in branch order. */
    @Override
    public List<Integer> successors() {
        return Collections.unmodifiableList(successors);
    }

    /** Position (not index) of the branch forced during rollback, or null. */
    public Integer forcedBranch() {
        return forcedBranch;
    }

    /** Index of the chosen child after rollback; null for an unforced chance node. */
    public Integer optimalSuccessor() {
        return optimalSuccessor;
    }

    @Override
    public NodeSnapshot snapshot() {
        return new NodeSnapshot(index(), type(), name(), tagName(), tagBranch(), tagValue(), tagProb(),
                ev(), eu(), ce(), optimalStrategy(), pathProb(), List.copyOf(successors),
                forcedBranch, optimalSuccessor, this instanceof DecisionNode d ? d.maximize() : null);
    }

    void addSuccessor(int childIndex) {
        successors.add(childIndex);
    }

    void setForcedBranch(Integer forcedBranch) {
        this.forcedBranch = forcedBranch;
    }

    void setOptimalSuccessor(Integer optimalSuccessor) {
        this.optimalSuccessor = optimalSuccessor;
    }
}
