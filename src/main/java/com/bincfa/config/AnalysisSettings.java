package com.bincfa.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class AnalysisSettings {
    @JsonProperty("architecture")
    private String architecture = "x86";

    @JsonProperty("address_size")
    private int addressSize = 32;

    @JsonProperty("operand_size")
    private int operandSize = 32;

    @JsonProperty("log_level")
    private int logLevel = 2;

    @JsonProperty("entrypoint")
    private String entrypoint; // e.g. "0x401000"
}
