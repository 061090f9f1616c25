package com.smartchoice.sensitivity;

import com.smartchoice.common.numeric.Grids;
import com.smartchoice.tree.DecisionTree;
import com.smartchoice.tree.NodeType;
import com.smartchoice.tree.TreeNode;
import com.smartchoice.tree.error.ConfigurationException;
import com.smartchoice.tree.spec.ChanceSpec;
import com.smartchoice.tree.spec.TopBottomBranches;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sweeps the probability of a chance variable between its top and bottom outcomes. Every
 * other branch of the variable gets probability zero; at each step the bottom branch gets
 * {@code p} and the top branch {@code 1 - p}.
 */
public final class ProbabilisticSensitivity {

    private static final Logger log = LoggerFactory.getLogger(ProbabilisticSensitivity.class);

    public static final int POINTS = 21;

    private ProbabilisticSensitivity() {
    }

    public static SensitivityResult run(DecisionTree tree, String variable, int targetIndex) {
        if (!(tree.specs().get(variable) instanceof ChanceSpec)) {
            throw new ConfigurationException("Variable " + variable + " is not a chance variable");
        }
        DecisionTree copy = Sweeps.workingCopy(tree);
        TreeNode target = Sweeps.internalTarget(copy, targetIndex);
        TopBottomBranches tb = copy.specs().getTopBottomBranches(variable);
        log.debug("Probabilistic sweep of {} (top {}, bottom {}) at node {}", variable, tb.top(), tb.bottom(), targetIndex);

        Sweeps.Collector collector = target.type() == NodeType.DECISION
                ? Sweeps.Collector.branches(copy, target)
                : Sweeps.Collector.single(copy, target);

        copy.setVariableProbability(variable, 0);
        for (double p : Grids.linspace(0, 1, POINTS)) {
            copy.setBranchProbability(variable, tb.top(), 1 - p);
            copy.setBranchProbability(variable, tb.bottom(), p);
            copy.rollback();
            collector.record(p, TreeNode::ev);
        }
        SensitivityResult result = new SensitivityResult(targetIndex, "Probability of " + variable + "=" + tb.bottom(),
                null, collector.series());
        log.info("Probabilistic sweep of {} at node {} produced {} series", variable, targetIndex, result.series().size());
        return result;
    }
}
