package com.example.samifier.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * {@code {"Condition": "Name"}} as it appears inside {@code Fn::And}, {@code Fn::Or} and {@code Fn::Not}.
 */
@Data
@AllArgsConstructor
public class ConditionRef implements Intrinsic {
    public static final String FUNCTION = "Condition";

    private String name;

    @Override
    public String getFunctionName() {
        return FUNCTION;
    }

    @Override
    public ConditionRef copy() {
        return new ConditionRef(name);
    }
}
