package com.smartchoice.tree;

import com.smartchoice.tree.error.ConfigurationException;
import com.smartchoice.tree.error.EvaluationException;

import java.util.List;

/**
 * Backward induction over an evaluated arena. Each call recomputes every node from the
 * terminal EVs, so repeated calls with the same arguments give the same result.
 */
final class RollbackEngine {

    private RollbackEngine() {
    }

    static double rollback(List<TreeNode> arena, View view, UtilityFunction utility, double tolerance) {
        if (utility.isActive() && !(tolerance > 0 && Double.isFinite(tolerance))) {
            throw new ConfigurationException("Risk tolerance must be finite and positive for utility "
                    + utility.id() + " but was " + tolerance);
        }
        Context ctx = new Context(arena, utility, tolerance);
        ctx.rollback(0);
        ctx.mark(0, true, 1.0);

        TreeNode root = arena.get(0);
        if (!utility.isActive()) return root.ev();
        return switch (view) {
            case EV -> root.ev();
            case EU -> root.eu();
            case CE -> root.ce();
        };
    }

    private record Context(List<TreeNode> arena, UtilityFunction utility, double tolerance) {

        void rollback(int index) {
            TreeNode node = arena.get(index);
            if (node instanceof TerminalNode t) terminal(t);
            else if (node instanceof ChanceNode c) chance(c);
            else if (node instanceof DecisionNode d) decision(d);

            if (utility.isActive()) {
                node.setCe(utility.inverse(node.eu(), tolerance));
            } else {
                node.setEu(null);
                node.setCe(null);
            }
        }

        private void terminal(TerminalNode node) {
            if (node.ev() == null) {
                throw new EvaluationException("Terminal " + node.name() + " (node " + node.index()
                        + ") has no expected value; evaluate the tree before rolling back");
            }
            if (utility.isActive()) node.setEu(utility.apply(node.ev(), tolerance));
        }

        private void chance(ChanceNode node) {
            for (int child : node.successors()) rollback(child);
            if (node.forcedBranch() != null) {
                TreeNode forced = arena.get(node.successors().get(node.forcedBranch()));
                copyResult(node, forced);
                node.setOptimalSuccessor(forced.index());
                return;
            }
            double ev = 0;
            double eu = 0;
            for (int index : node.successors()) {
                TreeNode child = arena.get(index);
                double p = child.tagProb() == null ? 0.0 : child.tagProb();
                ev += p * child.ev();
                if (utility.isActive()) eu += p * child.eu();
            }
            node.setEv(ev);
            node.setEu(utility.isActive() ? eu : null);
            node.setOptimalSuccessor(null);
        }

        private void decision(DecisionNode node) {
            for (int child : node.successors()) rollback(child);
            TreeNode chosen;
            if (node.forcedBranch() != null) {
                chosen = arena.get(node.successors().get(node.forcedBranch()));
            } else {
                chosen = arena.get(node.successors().get(0));
                for (int i = 1; i < node.successors().size(); i++) {
                    TreeNode candidate = arena.get(node.successors().get(i));
                    if (improves(node.maximize(), criterion(candidate), criterion(chosen))) chosen = candidate;
                }
            }
            copyResult(node, chosen);
            node.setOptimalSuccessor(chosen.index());
        }

        private double criterion(TreeNode node) {
            return utility.isActive() ? node.eu() : node.ev();
        }

        /** Strict improvement only, so the earliest child keeps a tie. */
        private static boolean improves(boolean maximize, double candidate, double incumbent) {
            return maximize ? candidate > incumbent : candidate < incumbent;
        }

        private void copyResult(TreeNode node, TreeNode from) {
            node.setEv(from.ev());
            node.setEu(utility.isActive() ? from.eu() : null);
        }

        /** {@code pathProb} already includes this node's own branch probability. */
        void mark(int index, boolean optimal, double pathProb) {
            TreeNode node = arena.get(index);
            node.setOptimalStrategy(optimal);
            node.setPathProb(pathProb);
            if (!(node instanceof InternalNode internal)) return;

            List<Integer> successors = internal.successors();
            Integer forced = internal.forcedBranch();
            for (int i = 0; i < successors.size(); i++) {
                int childIndex = successors.get(i);
                TreeNode child = arena.get(childIndex);
                if (internal instanceof DecisionNode) {
                    boolean chosen = internal.optimalSuccessor() == childIndex;
                    mark(childIndex, optimal && chosen, chosen ? pathProb * own(child) : 0.0);
                } else if (forced != null) {
                    boolean chosen = forced == i;
                    mark(childIndex, optimal && chosen, chosen ? pathProb : 0.0);
                } else {
                    mark(childIndex, optimal, pathProb * own(child));
                }
            }
        }

        private static double own(TreeNode node) {
            return node.tagProb() == null ? 1.0 : node.tagProb();
        }
    }
}
