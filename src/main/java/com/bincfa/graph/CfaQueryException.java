package com.bincfa.graph;

/**
 * A query asked for something the CFA does not have.
 */
public abstract class CfaQueryException extends Exception {
    protected CfaQueryException(String message) {
        super(message);
    }
}
