package com.smartchoice.tree.error;

/** Unknown identifier or unusable parameter passed to the engine. */
public class ConfigurationException extends DecisionTreeException {
    public ConfigurationException(String message) {
        super(message);
    }
}
