package com.example.samifier.model;

/**
 * Output flavour of a refactoring run
 */
public enum RefactorTarget {
    /** Cleaned and renamed CloudFormation, no folding */
    CFN,
    /** CloudFormation folded into SAM constructs */
    SAM
}
