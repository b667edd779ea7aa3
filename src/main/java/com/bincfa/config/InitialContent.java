package com.bincfa.config;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Value;

import java.math.BigInteger;

/**
 * Initial content of a register or a memory cell, as written in the configuration.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InitialContent {

    public enum Kind {
        /** exact value */
        EXACT,
        /** value plus a don't-care mask */
        MASKED,
        /** raw byte pattern, memory only */
        BYTES
    }

    Kind kind;
    BigInteger value;
    BigInteger mask;
    @Getter(AccessLevel.NONE)
    byte[] bytes;

    public static InitialContent exact(BigInteger value) {
        return new InitialContent(Kind.EXACT, value, null, null);
    }

    public static InitialContent masked(BigInteger value, BigInteger mask) {
        return new InitialContent(Kind.MASKED, value, mask, null);
    }

    public static InitialContent bytes(byte[] bytes) {
        return new InitialContent(Kind.BYTES, null, null, bytes.clone());
    }

    /**
     * @return a copy of the byte pattern, null unless the kind is {@link Kind#BYTES}
     */
    public byte[] getBytes() {
        return bytes == null ? null : bytes.clone();
    }

    @Override
    public String toString() {
        switch (kind) {
            case MASKED:
                return "0x" + value.toString(16) + "?0x" + mask.toString(16);
            case BYTES:
                StringBuilder sb = new StringBuilder("|");
                for (byte b : bytes) {
                    sb.append(String.format("%02x", b & 0xff));
                }
                return sb.append('|').toString();
            default:
                return "0x" + value.toString(16);
        }
    }
}
