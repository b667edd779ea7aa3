package com.bincfa.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class MemoryEntry {
    @JsonProperty("address")
    private String address; // hex or decimal, kept as text so YAML does not reinterpret it

    @JsonProperty("length")
    private int length = 1; // number of repetitions of the content

    @JsonProperty("content")
    private String content; // content spec, see ContentSpecParser
}
