package com.bincfa.config;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigInteger;

/**
 * Initial taint of a register or a memory cell: an exact taint value or a masked one.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InitialTaint {
    BigInteger value;
    BigInteger mask; // null for an exact taint

    public static InitialTaint exact(BigInteger value) {
        return new InitialTaint(value, null);
    }

    public static InitialTaint masked(BigInteger value, BigInteger mask) {
        return new InitialTaint(value, mask);
    }

    public boolean isMasked() {
        return mask != null;
    }

    @Override
    public String toString() {
        String base = "0x" + value.toString(16);
        return isMasked() ? base + "?0x" + mask.toString(16) : base;
    }
}
