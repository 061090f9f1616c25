package com.smartchoice.tree;

import com.smartchoice.tree.spec.DependentOverride;
import com.smartchoice.tree.spec.NodeSpecBag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Applies path-conditioned overrides. The path of a node includes its own incoming branch,
 * so a condition on the variable that leads to a node matches that node. Probability
 * overrides run first, then outcome overrides, each in the order they were added.
 */
final class OverrideResolver {

    private static final Logger log = LoggerFactory.getLogger(OverrideResolver.class);

    private OverrideResolver() {
    }

    static void apply(List<TreeNode> arena, NodeSpecBag bag) {
        for (DependentOverride o : bag.dependentProbabilities()) {
            int touched = applyOne(arena, o, TreeNode::setTagProb);
            log.debug("Dependent probability {} for {} applied to {} nodes", o.payload(), o.conditions(), touched);
        }
        for (DependentOverride o : bag.dependentOutcomes()) {
            int touched = applyOne(arena, o, TreeNode::setTagValue);
            log.debug("Dependent outcome {} for {} applied to {} nodes", o.payload(), o.conditions(), touched);
        }
    }

    private static int applyOne(List<TreeNode> arena, DependentOverride override, BiConsumer<TreeNode, Double> setter) {
        return visit(arena, 0, new HashMap<>(), override, setter);
    }

    private static int visit(List<TreeNode> arena, int index, Map<String, String> parentPath,
                             DependentOverride override, BiConsumer<TreeNode, Double> setter) {
        TreeNode node = arena.get(index);
        Map<String, String> path = parentPath;
        if (node.tagName() != null) {
            path = new HashMap<>(parentPath);
            path.put(node.tagName(), node.tagBranch());
        }
        int touched = 0;
        if (override.matches(path)) {
            setter.accept(node, override.payload());
            touched++;
        }
        for (int child : node.successors()) touched += visit(arena, child, path, override, setter);
        return touched;
    }
}
