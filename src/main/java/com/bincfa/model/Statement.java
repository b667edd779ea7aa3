package com.bincfa.model;

import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A semantic effect produced by the instruction decoder.
 * Implementations are persisted with their class name, so they must be plain Jackson beans.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.CLASS, include = JsonTypeInfo.As.PROPERTY, property = "@class")
public interface Statement {

    /**
     * @param verbose when true, includes details such as operand sizes
     */
    String render(boolean verbose);
}
