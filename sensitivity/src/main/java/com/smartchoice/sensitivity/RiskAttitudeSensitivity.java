package com.smartchoice.sensitivity;

import com.smartchoice.common.numeric.Grids;
import com.smartchoice.tree.DecisionTree;
import com.smartchoice.tree.NodeType;
import com.smartchoice.tree.TreeNode;
import com.smartchoice.tree.UtilityFunction;
import com.smartchoice.tree.View;
import com.smartchoice.tree.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Certainty equivalents as the risk aversion grows from zero (risk neutral, plain EV) to
 * {@code 1 / riskTolerance}. The x values are risk aversions.
 */
public final class RiskAttitudeSensitivity {

    private static final Logger log = LoggerFactory.getLogger(RiskAttitudeSensitivity.class);

    public static final int POINTS = 11;

    private RiskAttitudeSensitivity() {
    }

    public static SensitivityResult run(DecisionTree tree, UtilityFunction utility, double riskTolerance, int targetIndex) {
        checkArguments(utility, riskTolerance);
        DecisionTree copy = Sweeps.workingCopy(tree);
        TreeNode target = Sweeps.internalTarget(copy, targetIndex);
        log.debug("Risk attitude sweep with {} utility up to tolerance {} at node {}", utility.id(), riskTolerance, targetIndex);

        Sweeps.Collector collector = target.type() == NodeType.DECISION
                ? Sweeps.Collector.branches(copy, target)
                : Sweeps.Collector.single(copy, target);
        for (double aversion : aversions(riskTolerance)) {
            if (aversion == 0) {
                copy.rollback();
                collector.record(aversion, TreeNode::ev);
            } else {
                copy.rollback(View.CE, utility, 1.0 / aversion);
                collector.record(aversion, TreeNode::ce);
            }
        }
        SensitivityResult result = new SensitivityResult(targetIndex, "Risk aversion", riskTolerance, collector.series());
        log.info("Risk attitude sweep at node {} produced {} series", targetIndex, result.series().size());
        return result;
    }

    public static List<Double> aversions(double riskTolerance) {
        return Grids.linspace(0, 1.0 / riskTolerance, POINTS);
    }

    /** Risk tolerance shown for each aversion: {@code "Infinity"} for zero, else {@code 1 / aversion} rounded. */
    public static List<String> riskToleranceLabels(double riskTolerance) {
        List<String> labels = new ArrayList<>(POINTS);
        for (double aversion : aversions(riskTolerance)) {
            labels.add(aversion == 0 ? "Infinity" : String.valueOf(Math.round(1.0 / aversion)));
        }
        return labels;
    }

    private static void checkArguments(UtilityFunction utility, double riskTolerance) {
        if (utility == null || !utility.isActive()) {
            throw new ConfigurationException("A risk attitude sweep needs a utility function (exp or log)");
        }
        if (!(riskTolerance > 0) || Double.isInfinite(riskTolerance)) {
            throw new ConfigurationException("Risk tolerance must be finite and positive but was " + riskTolerance);
        }
    }
}
