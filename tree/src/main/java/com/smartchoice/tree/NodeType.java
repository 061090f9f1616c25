package com.smartchoice.tree;

public enum NodeType {
    DECISION, CHANCE, TERMINAL
}
