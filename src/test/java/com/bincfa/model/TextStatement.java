package com.bincfa.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Statement carrying its own text, standing in for decoder output in tests.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class TextStatement implements Statement {
    private String text;

    @Override
    public String render(boolean verbose) {
        return text;
    }
}
