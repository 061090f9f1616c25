package com.smartchoice.tree;

public final class DecisionNode extends InternalNode {

    private final boolean maximize;

    DecisionNode(int index, String name, boolean maximize) {
        super(index, name);
        this.maximize = maximize;
    }

    private DecisionNode(DecisionNode other) {
        super(other);
        this.maximize = other.maximize;
    }

    public boolean maximize() {
        return maximize;
    }

    @Override
    public NodeType type() {
        return NodeType.DECISION;
    }

    @Override
    DecisionNode copy() {
        return new DecisionNode(this);
    }
}
