package com.example.samifier.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * {@code Ref} to a resource, parameter or pseudo parameter.
 */
@Data
@AllArgsConstructor
public class Ref implements Intrinsic {
    public static final String FUNCTION = "Ref";

    private String target;

    /**
     * Pseudo parameters such as {@code AWS::Region} never name a logical ID
     */
    public boolean isPseudo() {
        return target != null && target.contains("::");
    }

    @Override
    public String getFunctionName() {
        return FUNCTION;
    }

    @Override
    public Ref copy() {
        return new Ref(target);
    }
}
