package com.bincfa.config;

import lombok.Value;

import java.util.Optional;

/**
 * Content plus optional taint for one register or memory entry.
 */
@Value
public class InitialSpec {
    InitialContent content;
    InitialTaint taint; // null when no taint is asserted

    public Optional<InitialTaint> taint() {
        return Optional.ofNullable(taint);
    }

    @Override
    public String toString() {
        return taint == null ? content.toString() : content + "!" + taint;
    }
}
