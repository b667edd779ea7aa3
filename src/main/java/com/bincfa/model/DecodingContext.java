package com.bincfa.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Decoding context attached to a state: address and operand widths in bits.
 */
@Getter
@EqualsAndHashCode
public final class DecodingContext {
    @JsonProperty("addr_sz")
    private final int addressSize;

    @JsonProperty("op_sz")
    private final int operandSize;

    @JsonCreator
    public DecodingContext(@JsonProperty("addr_sz") int addressSize,
                           @JsonProperty("op_sz") int operandSize) {
        this.addressSize = addressSize;
        this.operandSize = operandSize;
    }

    @Override
    public String toString() {
        return "ctx{addr_sz=" + addressSize + ", op_sz=" + operandSize + "}";
    }
}
