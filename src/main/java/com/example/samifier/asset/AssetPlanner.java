package com.example.samifier.asset;

import com.example.samifier.exception.AssetUnavailableException;
import com.example.samifier.model.Resource;
import com.example.samifier.model.TemplateDocument;
import com.example.samifier.util.Values;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Decides where the code of every function and layer lives and rewrites its location property.
 *
 * Nothing is written here: staged content is returned in the {@link AssetPlan} and committed by
 * the output writer together with the template. Identical content, compared by SHA-256 digest,
 * is staged once and shared by every resource using it.
 */
@Slf4j
@Component
public class AssetPlanner {
    public static final String ASSET_PATH = "aws:asset:path";
    public static final String ASSET_PROPERTY = "aws:asset:property";
    static final String ASSET_METADATA_PREFIX = "aws:asset:";

    private static final Map<String, String> RUNTIME_EXTENSIONS = new LinkedHashMap<>();

    static {
        RUNTIME_EXTENSIONS.put("python", ".py");
        RUNTIME_EXTENSIONS.put("nodejs", ".js");
        RUNTIME_EXTENSIONS.put("ruby", ".rb");
        RUNTIME_EXTENSIONS.put("dotnet", ".cs");
        RUNTIME_EXTENSIONS.put("go", ".go");
        RUNTIME_EXTENSIONS.put("java", ".java");
        RUNTIME_EXTENSIONS.put("provided", ".txt");
    }

    private final Optional<AssetFetcher> fetcher;

    @Autowired
    public AssetPlanner(Optional<AssetFetcher> fetcher) {
        this.fetcher = fetcher;
    }

    public AssetPlan plan(TemplateDocument document, AssetPolicy policy, String assetsDirectory, List<Path> searchRoots) {
        AssetPlan plan = new AssetPlan();
        Map<String, StagedAsset> stagedByDigest = new LinkedHashMap<>();
        Map<String, String> ownerByDigest = new LinkedHashMap<>();

        for (Resource resource : document.getResources().values()) {
            CodeSlot slot = CodeSlot.of(resource);
            if (slot == null) {
                continue;
            }
            String id = resource.getLogicalId();
            String localPath = Values.asString(resource.getMetadata().get(ASSET_PATH));
            AssetRecord.AssetRecordBuilder record = AssetRecord.builder().logicalId(id);
            StagedAsset candidate = null;

            if (localPath != null && isCodeAsset(resource)) {
                Path source = resolve(localPath, searchRoots, id);
                candidate = readLocal(source, assetsDirectory + "/" + id, id);
                record.kind(AssetRecord.Kind.LOCAL_PATH).source(localPath);
            } else if (slot.inlineCode(resource) != null) {
                Object code = slot.inlineCode(resource);
                record.kind(AssetRecord.Kind.INLINE_TEXT).source("inline");
                if (policy == AssetPolicy.PREFER_EXTERNAL && code instanceof String) {
                    candidate = inlineFile(resource, (String) code, assetsDirectory + "/" + id);
                } else {
                    if (policy == AssetPolicy.PREFER_EXTERNAL) {
                        log.warn("Inline code of {} is computed by an intrinsic function and stays inline", id);
                    }
                    plan.getRecords().add(record.placement(AssetRecord.Placement.INLINE).build());
                }
            } else if (slot.remoteLocation(resource) != null) {
                Map<String, Object> location = slot.remoteLocation(resource);
                record.kind(AssetRecord.Kind.REMOTE_OBJECT).source(describe(location));
                if (policy == AssetPolicy.PREFER_EXTERNAL) {
                    candidate = fetchRemote(location, assetsDirectory + "/" + id, id);
                } else {
                    plan.getRecords().add(record.placement(AssetRecord.Placement.REMOTE).build());
                }
            }

            if (candidate != null) {
                StagedAsset staged = stagedByDigest.get(candidate.getDigest());
                if (staged == null) {
                    staged = candidate;
                    stagedByDigest.put(staged.getDigest(), staged);
                    ownerByDigest.put(staged.getDigest(), id);
                    plan.getStaged().add(staged);
                } else {
                    record.sharedWith(ownerByDigest.get(staged.getDigest()));
                    log.debug("{} shares staged content with {}", id, ownerByDigest.get(staged.getDigest()));
                }
                slot.setLocation(resource, staged.getRelativePath());
                plan.getRecords().add(record
                        .placement(AssetRecord.Placement.STAGED)
                        .digest(staged.getDigest())
                        .relativePath(staged.getRelativePath())
                        .build());
            }
            resource.getMetadata().keySet().removeIf(key -> key.startsWith(ASSET_METADATA_PREFIX));
        }
        log.info("Planned {} asset(s), {} staged location(s)", plan.getRecords().size(), plan.getStaged().size());
        return plan;
    }

    private static boolean isCodeAsset(Resource resource) {
        Object property = resource.getMetadata().get(ASSET_PROPERTY);
        return property == null || List.of("Code", "Content", "CodeUri", "ContentUri").contains(property);
    }

    private static Path resolve(String assetPath, List<Path> searchRoots, String logicalId) {
        Path direct = Path.of(assetPath);
        if (direct.isAbsolute() && Files.exists(direct)) {
            return direct;
        }
        for (Path root : searchRoots) {
            Path candidate = root.resolve(assetPath);
            if (Files.exists(candidate)) {
                return candidate;
            }
        }
        throw new AssetUnavailableException(String.format("Asset %s of %s was not found under %s", assetPath, logicalId, searchRoots));
    }

    private static StagedAsset readLocal(Path source, String destination, String logicalId) {
        Map<String, byte[]> files = new TreeMap<>();
        try {
            if (Files.isDirectory(source)) {
                List<Path> paths;
                try (Stream<Path> walk = Files.walk(source)) {
                    paths = walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
                }
                for (Path path : paths) {
                    files.put(source.relativize(path).toString().replace('\\', '/'), Files.readAllBytes(path));
                }
                return new StagedAsset(destination, digest(files), files);
            }
            files.put("", Files.readAllBytes(source));
            return new StagedAsset(destination + "/" + source.getFileName(), digest(files), files);
        } catch (IOException e) {
            throw new AssetUnavailableException("Cannot read asset " + source + " of " + logicalId, e);
        }
    }

    private static StagedAsset inlineFile(Resource resource, String code, String destination) {
        String text = code.endsWith("\n") ? code : code + "\n";
        Map<String, byte[]> files = new TreeMap<>();
        files.put(handlerFile(resource), text.getBytes(StandardCharsets.UTF_8));
        return new StagedAsset(destination, digest(files), files);
    }

    /**
     * {@code index.handler} on a Python runtime gives {@code index.py}
     */
    static String handlerFile(Resource resource) {
        String handler = resource.stringProperty("Handler");
        String base = handler == null || handler.lastIndexOf('.') <= 0 ? "index" : handler.substring(0, handler.lastIndexOf('.'));
        return base + extensionFor(resource.stringProperty("Runtime"));
    }

    static String extensionFor(String runtime) {
        if (runtime != null) {
            for (Map.Entry<String, String> entry : RUNTIME_EXTENSIONS.entrySet()) {
                if (runtime.startsWith(entry.getKey())) {
                    return entry.getValue();
                }
            }
        }
        return ".js";
    }

    private StagedAsset fetchRemote(Map<String, Object> location, String destination, String logicalId) {
        if (!fetcher.isPresent()) {
            throw new AssetUnavailableException(String.format(
                    "Code of %s only exists at %s and no asset fetcher is configured", logicalId, describe(location)));
        }
        String bucket = Values.asString(location.get("Bucket"));
        String key = Values.asString(location.get("Key"));
        if (bucket == null || key == null) {
            throw new AssetUnavailableException(String.format(
                    "Code location of %s is computed at deploy time and cannot be fetched", logicalId));
        }
        try {
            byte[] content = fetcher.get().fetch(bucket, key, Values.asString(location.get("Version")));
            Map<String, byte[]> files = new TreeMap<>();
            files.put("", content);
            String fileName = key.substring(key.lastIndexOf('/') + 1);
            return new StagedAsset(destination + "/" + fileName, digest(files), files);
        } catch (IOException e) {
            throw new AssetUnavailableException("Failed to fetch s3://" + bucket + "/" + key + " for " + logicalId, e);
        }
    }

    private static String describe(Map<String, Object> location) {
        Object bucket = location.get("Bucket");
        Object key = location.get("Key");
        return "s3://" + (bucket instanceof String ? bucket : "<computed>") + "/" + (key instanceof String ? key : "<computed>");
    }

    static String digest(Map<String, byte[]> files) {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            for (Map.Entry<String, byte[]> file : new TreeMap<>(files).entrySet()) {
                sha.update(file.getKey().getBytes(StandardCharsets.UTF_8));
                sha.update((byte) 0);
                sha.update(file.getValue());
            }
            return HexFormat.of().formatHex(sha.digest());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    /**
     * Where each supported resource type keeps its code
     */
    enum CodeSlot {
        SERVERLESS_FUNCTION("AWS::Serverless::Function", "CodeUri"),
        LAMBDA_FUNCTION("AWS::Lambda::Function", "Code"),
        SERVERLESS_LAYER("AWS::Serverless::LayerVersion", "ContentUri"),
        LAMBDA_LAYER("AWS::Lambda::LayerVersion", "Content");

        private final String type;
        private final String locationKey;

        CodeSlot(String type, String locationKey) {
            this.type = type;
            this.locationKey = locationKey;
        }

        static CodeSlot of(Resource resource) {
            for (CodeSlot slot : values()) {
                if (resource.isType(slot.type)) {
                    return slot;
                }
            }
            return null;
        }

        Object inlineCode(Resource resource) {
            if (this == SERVERLESS_FUNCTION) {
                return resource.property("InlineCode");
            }
            if (this == LAMBDA_FUNCTION) {
                Map<String, Object> code = resource.mapProperty("Code");
                return code == null ? null : code.get("ZipFile");
            }
            return null;
        }

        /**
         * {@code {Bucket, Key, Version}} of code stored in S3, null otherwise
         */
        Map<String, Object> remoteLocation(Resource resource) {
            Map<String, Object> location = Values.asMap(resource.property(locationKey));
            if (location == null) {
                return null;
            }
            if (location.containsKey("Bucket") && location.containsKey("Key")) {
                return location;
            }
            if (location.containsKey("S3Bucket") && location.containsKey("S3Key")) {
                return Values.mapOf("Bucket", location.get("S3Bucket"), "Key", location.get("S3Key"),
                        "Version", location.get("S3ObjectVersion"));
            }
            return null;
        }

        /**
         * Points the resource at a local path, keeping the property where the code used to be
         */
        void setLocation(Resource resource, String relativePath) {
            Map<String, Object> rebuilt = new LinkedHashMap<>();
            boolean placed = false;
            for (Map.Entry<String, Object> entry : resource.getProperties().entrySet()) {
                if (entry.getKey().equals(locationKey) || (this == SERVERLESS_FUNCTION && "InlineCode".equals(entry.getKey()))) {
                    if (!placed) {
                        rebuilt.put(locationKey, relativePath);
                        placed = true;
                    }
                } else {
                    rebuilt.put(entry.getKey(), entry.getValue());
                }
            }
            if (!placed) {
                rebuilt.put(locationKey, relativePath);
            }
            resource.setProperties(rebuilt);
        }
    }
}
