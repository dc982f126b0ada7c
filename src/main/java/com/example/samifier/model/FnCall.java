package com.example.samifier.model;

import com.example.samifier.util.Values;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Any other {@code Fn::*} function, e.g. {@code Fn::Join}, {@code Fn::If} or {@code Fn::Select}.
 * The argument is kept exactly as written.
 */
@Data
@AllArgsConstructor
public class FnCall implements Intrinsic {
    public static final String IF = "Fn::If";
    public static final String JOIN = "Fn::Join";

    private String functionName;
    private Object argument;

    /**
     * Condition named by {@code Fn::If}, null for every other function
     */
    public String getIfCondition() {
        if (IF.equals(functionName) && argument instanceof List && !((List<?>) argument).isEmpty()
                && ((List<?>) argument).get(0) instanceof String) {
            return (String) ((List<?>) argument).get(0);
        }
        return null;
    }

    /**
     * Short-form YAML tag name, e.g. {@code Join} for {@code Fn::Join}
     */
    public String getShortName() {
        return functionName.startsWith("Fn::") ? functionName.substring(4) : functionName;
    }

    @Override
    public FnCall copy() {
        return new FnCall(functionName, Values.deepCopy(argument));
    }
}
