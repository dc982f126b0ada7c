package com.example.samifier.rename;

/**
 * How a candidate name was made unique
 */
public enum CollisionStrategy {
    NONE,
    TYPE_SUFFIX,
    COUNTER
}
