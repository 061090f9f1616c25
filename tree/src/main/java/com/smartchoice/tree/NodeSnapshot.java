package com.smartchoice.tree;

import java.util.List;

/**
 * Immutable view of a {@link TreeNode} at one point in time. Fields that do not apply to
 * the node's type are null ({@code forcedBranch}, {@code optimalSuccessor}, {@code maximize}).
 */
public record NodeSnapshot(int index,
                           NodeType type,
                           String name,
                           String tagName,
                           String tagBranch,
                           Double tagValue,
                           Double tagProb,
                           Double ev,
                           Double eu,
                           Double ce,
                           boolean optimalStrategy,
                           Double pathProb,
                           List<Integer> successors,
                           Integer forcedBranch,
                           Integer optimalSuccessor,
                           Boolean maximize) {
    public NodeSnapshot {
        successors = List.copyOf(successors);
    }
}
