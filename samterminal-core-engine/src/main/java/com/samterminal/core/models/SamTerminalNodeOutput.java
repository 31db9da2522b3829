package com.samterminal.core.models;

import lombok.Data;

/**
 * What a node produced: its output value and the branch the walk continues on.
 * A {@code null} branch follows every plain outgoing edge.
 */
@Data
public class SamTerminalNodeOutput {
    private final String branch;
    private final Object data;

    private SamTerminalNodeOutput(String branch, Object data) {
        this.branch = branch;
        this.data = data;
    }

    public static SamTerminalNodeOutput of(String branch, Object data) {
        return new SamTerminalNodeOutput(branch, data);
    }

    public static SamTerminalNodeOutput ofData(Object data) {
        return new SamTerminalNodeOutput(null, data);
    }

    public static SamTerminalNodeOutput ofEmpty() {
        return new SamTerminalNodeOutput(null, null);
    }

}
