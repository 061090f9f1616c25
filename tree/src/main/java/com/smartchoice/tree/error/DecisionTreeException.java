package com.smartchoice.tree.error;

/** Root of every failure raised by the decision tree engine. */
public class DecisionTreeException extends RuntimeException {
    public DecisionTreeException(String message) {
        super(message);
    }

    public DecisionTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
