package com.smartchoice.tree;

import com.smartchoice.tree.error.ConfigurationException;

/** Which root quantity {@code rollback} returns. */
public enum View {
    EV("ev"), EU("eu"), CE("ce");

    private final String id;

    View(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static View fromId(String id) {
        for (View v : values()) {
            if (v.id.equals(id)) return v;
        }
        throw new ConfigurationException("Unknown view '" + id + "'. Expected one of ev, eu, ce");
    }
}
