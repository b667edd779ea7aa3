package com.bincfa.config;

import com.bincfa.model.Register;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Built-in register sets.
 */
public enum Architecture {
    X86(32, new String[]{"eax", "ecx", "edx", "ebx", "esp", "ebp", "esi", "edi"}, "esp"),
    X64(64, new String[]{"rax", "rcx", "rdx", "rbx", "rsp", "rbp", "rsi", "rdi",
            "r8", "r9", "r10", "r11", "r12", "r13", "r14", "r15"}, "rsp");

    private final List<Register> registers;

    Architecture(int width, String[] general, String stackPointer) {
        List<Register> regs = new ArrayList<>();
        for (String name : general) {
            regs.add(new Register(name, width, name.equals(stackPointer)));
        }
        for (String flag : Flags.NAMES) {
            regs.add(new Register(flag, 1));
        }
        this.registers = Collections.unmodifiableList(regs);
    }

    public List<Register> registers() {
        return registers;
    }

    // enum constructors cannot read the enum's own static fields
    private static final class Flags {
        static final String[] NAMES = {"cf", "pf", "af", "zf", "sf", "tf", "if", "df", "of"};
    }

    public static Architecture fromName(String name) {
        if (name == null) {
            return X86;
        }
        for (Architecture a : values()) {
            if (a.name().equalsIgnoreCase(name.trim())) {
                return a;
            }
        }
        throw new IllegalConfigurationException("Unknown architecture: " + name);
    }
}
