package com.smartchoice.tree;

import java.util.List;

/**
 * One position in the expanded tree. Nodes live in an index-addressed arena owned by a
 * {@link DecisionTree}; index 0 is the root and children always have larger indices.
 *
 * <p>The tag describes the branch of the parent that leads here. Evaluation results are
 * null until the tree has been evaluated and rolled back.
 */
public abstract sealed class TreeNode permits InternalNode, TerminalNode {

    private final int index;
    private final String name;

    private String tagName;
    private String tagBranch;
    private Double tagValue;
    private Double tagProb;

    private Double ev;
    private Double eu;
    private Double ce;
    private boolean optimalStrategy;
    private Double pathProb;

    protected TreeNode(int index, String name) {
        this.index = index;
        this.name = name;
    }

    protected TreeNode(TreeNode other) {
        this.index = other.index;
        this.name = other.name;
        this.tagName = other.tagName;
        this.tagBranch = other.tagBranch;
        this.tagValue = other.tagValue;
        this.tagProb = other.tagProb;
        this.ev = other.ev;
        this.eu = other.eu;
        this.ce = other.ce;
        this.optimalStrategy = other.optimalStrategy;
        this.pathProb = other.pathProb;
    }

    public abstract NodeType type();

    /** Deep copy; nothing mutable is shared with this node. */
    abstract TreeNode copy();

    public int index() {
        return index;
    }

    public String name() {
        return name;
    }

    /** Name of the parent variable; null for the root. */
    public String tagName() {
        return tagName;
    }

    public String tagBranch() {
        return tagBranch;
    }

    public Double tagValue() {
        return tagValue;
    }

    /** Probability of the incoming branch; only present under chance parents or after an override. */
    public Double tagProb() {
        return tagProb;
    }

    public Double ev() {
        return ev;
    }

    public Double eu() {
        return eu;
    }

    public Double ce() {
        return ce;
    }

    public boolean optimalStrategy() {
        return optimalStrategy;
    }

    public Double pathProb() {
        return pathProb;
    }

    public List<Integer> successors() {
        return List.of();
    }

    public NodeSnapshot snapshot() {
        return new NodeSnapshot(index, type(), name, tagName, tagBranch, tagValue, tagProb,
                ev, eu, ce, optimalStrategy, pathProb, successors(), null, null, null);
    }

    void tag(String tagName, String tagBranch, Double tagValue, Double tagProb) {
        this.tagName = tagName;
        this.tagBranch = tagBranch;
        this.tagValue = tagValue;
        this.tagProb = tagProb;
    }

    void setTagValue(Double tagValue) {
        this.tagValue = tagValue;
    }

    void setTagProb(Double tagProb) {
        this.tagProb = tagProb;
    }

    void setEv(Double ev) {
        this.ev = ev;
    }

    void setEu(Double eu) {
        this.eu = eu;
    }

    void setCe(Double ce) {
        this.ce = ce;
    }

    void setOptimalStrategy(boolean optimalStrategy) {
        this.optimalStrategy = optimalStrategy;
    }

    void setPathProb(Double pathProb) {
        this.pathProb = pathProb;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + "index=" + index + ", name='" + name + '\''
                + ", tag=" + tagName + "/" + tagBranch + ", ev=" + ev + '}';
    }
}
