package com.bincfa.graph;

public class NoPredecessorException extends CfaQueryException {
    private final long stateId;

    public NoPredecessorException(long stateId) {
        super("vertex without predecessor: " + stateId);
        this.stateId = stateId;
    }

    public long getStateId() {
        return stateId;
    }
}
