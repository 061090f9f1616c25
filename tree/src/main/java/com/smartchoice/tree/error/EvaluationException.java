package com.smartchoice.tree.error;

/** Terminal payoffs could not be computed, or values were read before they were computed. */
public class EvaluationException extends DecisionTreeException {
    public EvaluationException(String message) {
        super(message);
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
