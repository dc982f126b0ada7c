package com.example.samifier.asset;

import java.io.IOException;

/**
 * Downloads code that only exists in S3. Optional: without one, remote code can only stay remote.
 */
public interface AssetFetcher {

    /**
     * @param version object version, null for the latest
     */
    byte[] fetch(String bucket, String key, String version) throws IOException;
}
