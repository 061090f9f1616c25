package com.smartchoice.tree;

import com.smartchoice.tree.error.ConfigurationException;

/**
 * Utility transforms used by rollback. {@code tolerance} is the decision maker's risk
 * tolerance and must be positive when a utility is active.
 */
public enum UtilityFunction {
    NONE("none") {
        @Override
        public double apply(double value, double tolerance) {
            return value;
        }

        @Override
        public double inverse(double utility, double tolerance) {
            return utility;
        }
    },
    EXP("exp") {
        @Override
        public double apply(double value, double tolerance) {
            return 1.0 - Math.exp(-value / tolerance);
        }

        /** The utility is capped at 0.9999 so the logarithm stays finite. */
        @Override
        public double inverse(double utility, double tolerance) {
            return -tolerance * Math.log(1.0 - Math.min(utility, 0.9999));
        }
    },
    LOG("log") {
        @Override
        public double apply(double value, double tolerance) {
            return Math.log(value + tolerance);
        }

        @Override
        public double inverse(double utility, double tolerance) {
            return Math.exp(utility) - tolerance;
        }
    };

    private final String id;

    UtilityFunction(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public abstract double apply(double value, double tolerance);

    public abstract double inverse(double utility, double tolerance);

    public boolean isActive() {
        return this != NONE;
    }

    /** {@code null} and {@code "none"} both mean no utility. */
    public static UtilityFunction fromId(String id) {
        if (id == null) return NONE;
        for (UtilityFunction u : values()) {
            if (u.id.equals(id)) return u;
        }
        throw new ConfigurationException("Unknown utility function '" + id + "'. Expected one of none, exp, log");
    }
}
