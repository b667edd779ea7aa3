package com.bincfa.model;

import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Hardware register descriptor.
 */
@Value
@AllArgsConstructor
public class Register {
    String name;
    int width; // in bits
    boolean stackPointer;

    public Register(String name, int width) {
        this(name, width, false);
    }

    @Override
    public String toString() {
        return name;
    }
}
