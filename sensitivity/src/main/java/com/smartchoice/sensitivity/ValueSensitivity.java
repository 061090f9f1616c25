package com.smartchoice.sensitivity;

import com.smartchoice.common.numeric.Grids;
import com.smartchoice.tree.DecisionTree;
import com.smartchoice.tree.TreeNode;
import com.smartchoice.tree.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.OptionalDouble;

/** Sweeps the value of one branch of a variable over {@code [min, max]}, re-evaluating the payoffs at each step. */
public final class ValueSensitivity {

    private static final Logger log = LoggerFactory.getLogger(ValueSensitivity.class);

    public static final int DEFAULT_POINTS = 11;

    private ValueSensitivity() {
    }

    public static SensitivityResult run(DecisionTree tree, String variable, String branch,
                                        double min, double max, boolean single, int targetIndex) {
        return run(tree, variable, branch, min, max, single, targetIndex, DEFAULT_POINTS);
    }

    /**
     * @param single when true one series with the EV of the target, otherwise one series per
     *               branch of the target
     */
    public static SensitivityResult run(DecisionTree tree, String variable, String branch,
                                        double min, double max, boolean single, int targetIndex, int points) {
        if (points < 2) throw new ConfigurationException("A value sweep needs at least 2 points but got " + points);
        OptionalDouble base = tree.findBranchValue(variable, branch);
        if (base.isEmpty()) {
            throw new ConfigurationException("No branch " + branch + " of variable " + variable + " in the tree");
        }
        DecisionTree copy = Sweeps.workingCopy(tree);
        TreeNode target = single ? Sweeps.target(copy, targetIndex) : Sweeps.internalTarget(copy, targetIndex);
        log.debug("Value sweep of {}={} over [{}, {}] at node {}", variable, branch, min, max, targetIndex);

        Sweeps.Collector collector = single
                ? Sweeps.Collector.single(copy, target)
                : Sweeps.Collector.branches(copy, target);
        for (double value : Grids.linspace(min, max, points)) {
            copy.setBranchValue(variable, branch, value);
            copy.evaluate();
            copy.rollback();
            collector.record(value, TreeNode::ev);
        }
        SensitivityResult result = new SensitivityResult(targetIndex, "Value of " + variable + "=" + branch,
                base.getAsDouble(), collector.series());
        log.info("Value sweep of {}={} at node {} produced {} series", variable, branch, targetIndex, result.series().size());
        return result;
    }
}
