package com.example.samifier.model;

/**
 * A CloudFormation intrinsic function kept as a typed node instead of being resolved.
 */
public interface Intrinsic {

    /**
     * Long-form key of the function, e.g. {@code Ref} or {@code Fn::GetAtt}
     */
    String getFunctionName();

    /**
     * Deep copy of this node, including any nested values
     */
    Intrinsic copy();
}
