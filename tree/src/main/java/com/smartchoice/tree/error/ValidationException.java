package com.smartchoice.tree.error;

/** A node specification is malformed: bad branch shape, probabilities, missing or cyclic references. */
public class ValidationException extends DecisionTreeException {
    public ValidationException(String message) {
        super(message);
    }
}
