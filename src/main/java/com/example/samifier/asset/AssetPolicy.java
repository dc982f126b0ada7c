package com.example.samifier.asset;

/**
 * Where function code ends up when both placements are possible
 */
public enum AssetPolicy {
    PREFER_INLINE,
    PREFER_EXTERNAL
}
