package com.bincfa.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class MemoryConfig {
    @JsonProperty("global")
    private List<MemoryEntry> global = new ArrayList<>();

    @JsonProperty("stack")
    private List<MemoryEntry> stack = new ArrayList<>();

    @JsonProperty("heap")
    private List<MemoryEntry> heap = new ArrayList<>();
}
