package com.bincfa.graph;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Persisted form of a whole CFA: every vertex then every edge.
 */
@Data
@NoArgsConstructor
public class CfaSnapshot<D> {
    @JsonProperty("states")
    private List<StateRecord<D>> states = new ArrayList<>();

    @JsonProperty("edges")
    private List<EdgeRecord> edges = new ArrayList<>();
}
