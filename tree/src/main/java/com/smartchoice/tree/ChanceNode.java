package com.smartchoice.tree;

public final class ChanceNode extends InternalNode {

    ChanceNode(int index, String name) {
        super(index, name);
    }

    private ChanceNode(ChanceNode other) {
        super(other);
    }

    @Override
    public NodeType type() {
        return NodeType.CHANCE;
    }

    @Override
    ChanceNode copy() {
        return new ChanceNode(this);
    }
}
