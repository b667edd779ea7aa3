package com.bincfa.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.TreeMap;

/**
 * Value of {@link ConfigSnapshotDomain}: the initial content text of every location.
 */
@Data
@NoArgsConstructor
public class SnapshotValue {
    @JsonProperty("registers")
    private TreeMap<String, String> registers = new TreeMap<>();

    @JsonProperty("memory")
    private TreeMap<String, String> memory = new TreeMap<>();

    SnapshotValue copy() {
        SnapshotValue v = new SnapshotValue();
        v.registers.putAll(registers);
        v.memory.putAll(memory);
        return v;
    }
}
