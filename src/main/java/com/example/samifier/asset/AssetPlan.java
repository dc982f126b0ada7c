package com.example.samifier.asset;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of asset planning: what to write and what was decided per resource.
 */
@Getter
public class AssetPlan {
    private final List<StagedAsset> staged = new ArrayList<>();
    private final List<AssetRecord> records = new ArrayList<>();
}
