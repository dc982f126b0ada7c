package com.example.samifier.model;

import com.example.samifier.util.Values;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * {@code Fn::GetAtt}. The attribute is usually a string but may itself be an intrinsic.
 */
@Data
@AllArgsConstructor
public class GetAtt implements Intrinsic {
    public static final String FUNCTION = "Fn::GetAtt";

    private String logicalId;
    private Object attribute;

    public boolean hasAttribute(String name) {
        return name.equals(attribute);
    }

    @Override
    public String getFunctionName() {
        return FUNCTION;
    }

    @Override
    public GetAtt copy() {
        return new GetAtt(logicalId, Values.deepCopy(attribute));
    }
}
