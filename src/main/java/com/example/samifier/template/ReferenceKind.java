package com.example.samifier.template;

/**
 * Syntactic form through which a logical ID is referenced
 */
public enum ReferenceKind {
    REF,
    GET_ATT,
    SUB,
    DEPENDS_ON,
    /** Resource or output Condition attribute, Fn::If condition name, or {Condition: X} */
    CONDITION;

    public boolean targetsCondition() {
        return this == CONDITION;
    }
}
