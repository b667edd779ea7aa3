package com.bincfa.config;

import lombok.Value;

import java.math.BigInteger;

/**
 * Key of a memory content table: start offset and number of repetitions of the content.
 */
@Value
public class MemoryKey implements Comparable<MemoryKey> {
    BigInteger address;
    int length;

    @Override
    public int compareTo(MemoryKey other) {
        int c = address.compareTo(other.address);
        return c != 0 ? c : Integer.compare(length, other.length);
    }
}
