package com.example.samifier.asset;

import lombok.Getter;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Content to write next to the output template: one file or a directory tree,
 * held in memory until the output writer commits the run.
 */
@Getter
public class StagedAsset {

    /**
     * Destination relative to the output template, {@code /} separated
     */
    private final String relativePath;

    private final String digest;

    /**
     * File path relative to {@link #relativePath} to content; a single entry with an empty key
     * means the asset is a file rather than a directory
     */
    private final Map<String, byte[]> files;

    public StagedAsset(String relativePath, String digest, Map<String, byte[]> files) {
        this.relativePath = relativePath;
        this.digest = digest;
        this.files = Collections.unmodifiableMap(new TreeMap<>(files));
    }

    public boolean isSingleFile() {
        return files.size() == 1 && files.containsKey("");
    }

    public long getSize() {
        long size = 0;
        for (byte[] content : files.values()) {
            size += content.length;
        }
        return size;
    }
}
