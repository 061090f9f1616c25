package com.smartchoice.sensitivity;

import com.smartchoice.tree.DecisionTree;
import com.smartchoice.tree.TreeNode;
import com.smartchoice.tree.error.ConfigurationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/** Shared plumbing for the sweeps: private working copies and series collection. */
final class Sweeps {

    private Sweeps() {
    }

    /** A deep copy of {@code tree}, evaluated if the source was not. */
    static DecisionTree workingCopy(DecisionTree tree) {
        DecisionTree copy = tree.copy();
        if (!copy.isEvaluated()) copy.evaluate();
        return copy;
    }

    static TreeNode target(DecisionTree tree, int targetIndex) {
        if (targetIndex < 0 || targetIndex >= tree.size()) {
            throw new ConfigurationException("Target node " + targetIndex + " is out of range [0, " + tree.size() + ")");
        }
        return tree.node(targetIndex);
    }

    static TreeNode internalTarget(DecisionTree tree, int targetIndex) {
        TreeNode node = target(tree, targetIndex);
        if (node.successors().isEmpty()) {
            throw new ConfigurationException("Target node " + targetIndex + " (" + node.name() + ") is a terminal");
        }
        return node;
    }

    /**
     * Collects the y values of one or more series while a sweep runs. A single collector
     * records the target itself; a branch collector records every successor of the target.
     */
    static final class Collector {
        private final DecisionTree tree;
        private final Map<String, Integer> sources = new LinkedHashMap<>();
        private final Map<String, List<SensitivityPoint>> points = new LinkedHashMap<>();

        private Collector(DecisionTree tree) {
            this.tree = tree;
        }

        static Collector single(DecisionTree tree, TreeNode target) {
            Collector c = new Collector(tree);
            c.add(target.name(), target.index());
            return c;
        }

        static Collector branches(DecisionTree tree, TreeNode target) {
            Collector c = new Collector(tree);
            for (int child : target.successors()) c.add(tree.node(child).tagBranch(), child);
            return c;
        }

        private void add(String label, int index) {
            sources.put(label, index);
            points.put(label, new ArrayList<>());
        }

        void record(double x, ToDoubleFunction<TreeNode> y) {
            for (Map.Entry<String, Integer> source : sources.entrySet()) {
                points.get(source.getKey()).add(new SensitivityPoint(x, y.applyAsDouble(tree.node(source.getValue()))));
            }
        }

        List<SensitivitySeries> series() {
            List<SensitivitySeries> result = new ArrayList<>();
            points.forEach((label, p) -> result.add(new SensitivitySeries(label, p)));
            return result;
        }
    }
}
