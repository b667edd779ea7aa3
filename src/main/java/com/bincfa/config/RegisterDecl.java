package com.bincfa.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class RegisterDecl {
    @JsonProperty("name")
    private String name;

    @JsonProperty("width")
    private int width; // bits

    @JsonProperty("stack_pointer")
    private boolean stackPointer;
}
