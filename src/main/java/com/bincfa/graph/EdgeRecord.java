package com.bincfa.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class EdgeRecord {
    @JsonProperty("src")
    private long src;

    @JsonProperty("dst")
    private long dst;
}
