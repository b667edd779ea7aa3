package com.bincfa.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
public class AnalysisConfig {
    @JsonProperty("analysis")
    private AnalysisSettings analysis = new AnalysisSettings();

    @JsonProperty("registers")
    private List<RegisterDecl> registers = new ArrayList<>();

    @JsonProperty("register_content")
    private Map<String, String> registerContent = new LinkedHashMap<>(); // register name -> content spec

    @JsonProperty("memory")
    private MemoryConfig memory = new MemoryConfig();
}
