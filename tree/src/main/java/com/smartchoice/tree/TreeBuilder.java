package com.smartchoice.tree;

import com.smartchoice.common.errorsor.ErrorsOr;
import com.smartchoice.tree.error.ValidationException;
import com.smartchoice.tree.spec.ChanceBranch;
import com.smartchoice.tree.spec.ChanceSpec;
import com.smartchoice.tree.spec.DecisionBranch;
import com.smartchoice.tree.spec.DecisionSpec;
import com.smartchoice.tree.spec.NodeSpec;
import com.smartchoice.tree.spec.NodeSpecBag;
import com.smartchoice.tree.spec.TerminalSpec;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Expands the named specs into the node arena. Every visit of a name allocates a fresh
 * node, so a name reachable along several paths appears several times. Nodes are numbered
 * in pre-order.
 */
final class TreeBuilder {

    private TreeBuilder() {
    }

    static List<TreeNode> build(NodeSpecBag bag) {
        if (bag.isEmpty()) throw new ValidationException("Cannot build a tree: no variables have been defined");
        validate(bag).valueOrThrow(ValidationException::new);

        List<TreeNode> arena = new ArrayList<>();
        expand(bag, bag.rootName(), arena);
        tag(bag, arena);
        return arena;
    }

    /** Every name reachable from the root must exist and the named graph must be acyclic. */
    static ErrorsOr<Boolean> validate(NodeSpecBag bag) {
        List<String> errors = new ArrayList<>();
        checkReachable(bag, bag.rootName(), new LinkedHashSet<>(), new HashSet<>(), errors);
        return ErrorsOr.liftOrErrors(Boolean.TRUE, errors);
    }

    private static void checkReachable(NodeSpecBag bag, String name, LinkedHashSet<String> path,
                                       Set<String> done, List<String> errors) {
        if (done.contains(name)) return;
        if (path.contains(name)) {
            List<String> cycle = new ArrayList<>();
            boolean inCycle = false;
            for (String p : path) {
                if (p.equals(name)) inCycle = true;
                if (inCycle) cycle.add(p);
            }
            cycle.add(name);
            errors.add("Cycle detected: " + String.join(" -> ", cycle));
            return;
        }
        NodeSpec spec = bag.get(name);
        path.add(name);
        for (String next : spec.nextNames()) {
            if (!bag.contains(next)) {
                errors.add("Variable " + name + " refers to undefined variable " + next);
            } else {
                checkReachable(bag, next, path, done, errors);
            }
        }
        path.remove(name);
        done.add(name);
    }

    private static int expand(NodeSpecBag bag, String name, List<TreeNode> arena) {
        NodeSpec spec = bag.get(name);
        int index = arena.size();
        if (spec instanceof TerminalSpec t) {
            arena.add(new TerminalNode(index, name, t.payoff()));
            return index;
        }
        InternalNode node = spec instanceof DecisionSpec d
                ? new DecisionNode(index, name, d.maximize())
                : new ChanceNode(index, name);
        arena.add(node);
        for (String next : spec.nextNames()) node.addSuccessor(expand(bag, next, arena));
        return index;
    }

    private static void tag(NodeSpecBag bag, List<TreeNode> arena) {
        for (TreeNode node : arena) {
            if (!(node instanceof InternalNode parent)) continue;
            NodeSpec spec = bag.get(parent.name());
            List<Integer> successors = parent.successors();
            if (spec instanceof DecisionSpec d) {
                for (int i = 0; i < successors.size(); i++) {
                    DecisionBranch b = d.branches().get(i);
                    arena.get(successors.get(i)).tag(d.name(), b.label(), b.value(), null);
                }
            } else if (spec instanceof ChanceSpec c) {
                for (int i = 0; i < successors.size(); i++) {
                    ChanceBranch b = c.branches().get(i);
                    arena.get(successors.get(i)).tag(c.name(), b.label(), b.value(), b.probability());
                }
            }
        }
    }
}
