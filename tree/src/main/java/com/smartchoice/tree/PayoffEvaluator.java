package com.smartchoice.tree;

import com.smartchoice.tree.error.EvaluationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Walks every root-to-terminal path and stores the payoff of each terminal as its EV. */
final class PayoffEvaluator {

    private PayoffEvaluator() {
    }

    static void evaluate(List<TreeNode> arena) {
        visit(arena, 0, new LinkedHashMap<>(), new LinkedHashMap<>(), new LinkedHashMap<>());
    }

    private static void visit(List<TreeNode> arena, int index,
                              Map<String, Double> values, Map<String, Double> probs, Map<String, String> branches) {
        TreeNode node = arena.get(index);
        if (node.tagName() != null) {
            values = new LinkedHashMap<>(values);
            values.put(node.tagName(), node.tagValue());
            branches = new LinkedHashMap<>(branches);
            branches.put(node.tagName(), node.tagBranch());
            if (node.tagProb() != null) {
                probs = new LinkedHashMap<>(probs);
                probs.put(node.tagName(), node.tagProb());
            }
        }
        if (node instanceof TerminalNode terminal) {
            terminal.setEv(payoff(terminal, values, probs, branches));
            return;
        }
        for (int child : node.successors()) visit(arena, child, values, probs, branches);
    }

    private static double payoff(TerminalNode terminal, Map<String, Double> values,
                                 Map<String, Double> probs, Map<String, String> branches) {
        if (terminal.payoff() == null) {
            throw new EvaluationException("Terminal " + terminal.name() + " (node " + terminal.index() + ") has no payoff function");
        }
        Map<String, Double> v = Collections.unmodifiableMap(values);
        Map<String, Double> p = Collections.unmodifiableMap(probs);
        Map<String, String> b = Collections.unmodifiableMap(branches);
        terminal.recordPayoffInputs(v, p, b);
        try {
            return terminal.payoff().payoff(v, p, b);
        } catch (EvaluationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EvaluationException("Payoff of terminal " + terminal.name() + " (node " + terminal.index()
                    + ") failed for path " + b + ": " + e.getMessage(), e);
        }
    }
}
