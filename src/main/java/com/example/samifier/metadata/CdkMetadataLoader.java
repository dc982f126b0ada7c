package com.example.samifier.metadata;

import com.example.samifier.exception.MetadataLoadingException;
import com.example.samifier.model.Resource;
import com.example.samifier.model.TemplateDocument;
import com.example.samifier.template.CdkCleaner;
import com.example.samifier.util.Values;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.InvalidJsonException;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.PathNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads CDK cloud assembly metadata: {@code manifest.json} for logical ID to construct path
 * entries and {@code tree.json} for the CloudFormation type of each construct.
 */
@Slf4j
@Component
public class CdkMetadataLoader {
    private static final String STACK_ARTIFACT = "aws:cloudformation:stack";
    private static final String LOGICAL_ID_ENTRY = "aws:cdk:logicalId";
    private static final String CFN_TYPE_ATTRIBUTE = "aws:cdk:cloudformation:type";
    private static final String MANIFEST_FILE = "manifest.json";
    private static final String TREE_FILE = "tree.json";

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Loads from a {@code cdk.out} directory or a single manifest file
     *
     * @param stackName artifact to read, null to read every stack artifact
     */
    public CdkMetadataBundle load(Path location, String stackName) {
        if (Files.isDirectory(location)) {
            Path manifest = location.resolve(MANIFEST_FILE);
            if (!Files.isRegularFile(manifest)) {
                throw new MetadataLoadingException("No " + MANIFEST_FILE + " in " + location);
            }
            Path tree = location.resolve(TREE_FILE);
            return load(manifest, Files.isRegularFile(tree) ? tree : null, stackName);
        }
        if (Files.isRegularFile(location)) {
            return load(location, null, stackName);
        }
        throw new MetadataLoadingException("CDK metadata path does not exist: " + location);
    }

    public CdkMetadataBundle load(Path manifest, Path tree, String stackName) {
        Map<String, ConstructInfo> constructs = readManifest(manifest, stackName);
        if (tree != null) {
            Map<String, String> types = readTreeTypes(tree);
            for (Map.Entry<String, ConstructInfo> entry : constructs.entrySet()) {
                String type = types.get(entry.getValue().getPath());
                if (type != null) {
                    entry.setValue(entry.getValue().toBuilder().resourceType(type).build());
                }
            }
        }
        log.info("Loaded CDK metadata for {} logical ID(s) from {}", constructs.size(), manifest);
        return new CdkMetadataBundle(constructs, manifest.toString());
    }

    /**
     * Harvests {@code aws:cdk:path} entries left in the template itself
     */
    public CdkMetadataBundle fromTemplate(TemplateDocument document) {
        Map<String, ConstructInfo> constructs = new TreeMap<>();
        for (Resource resource : document.getResources().values()) {
            String path = Values.asString(resource.getMetadata().get(CdkCleaner.PATH_METADATA));
            if (path != null) {
                constructs.put(resource.getLogicalId(), ConstructInfo.builder()
                        .logicalId(resource.getLogicalId())
                        .path(path)
                        .resourceType(resource.getType())
                        .build());
            }
        }
        return constructs.isEmpty() ? CdkMetadataBundle.empty() : new CdkMetadataBundle(constructs, "template");
    }

    /**
     * The synthesized template inside a {@code cdk.out} directory: {@code <stack>.template.json}
     * when the stack is named, otherwise the first template in name order
     */
    public Optional<Path> findTemplate(Path cdkOut, String stackName) {
        if (stackName != null) {
            Path named = cdkOut.resolve(stackName + ".template.json");
            if (Files.isRegularFile(named)) {
                return Optional.of(named);
            }
        }
        try (Stream<Path> files = Files.list(cdkOut)) {
            List<Path> templates = files
                    .filter(p -> p.getFileName().toString().endsWith(".template.json"))
                    .sorted()
                    .collect(Collectors.toList());
            return templates.isEmpty() ? Optional.empty() : Optional.of(templates.get(0));
        } catch (IOException e) {
            throw new MetadataLoadingException("Cannot list " + cdkOut + ": " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, ConstructInfo> readManifest(Path manifest, String stackName) {
        Map<String, Object> artifacts;
        try {
            DocumentContext context = JsonPath.parse(Files.readString(manifest, StandardCharsets.UTF_8));
            artifacts = context.read("$.artifacts");
        } catch (IOException | InvalidJsonException e) {
            throw new MetadataLoadingException("Cannot read " + manifest + ": " + e.getMessage(), e);
        } catch (PathNotFoundException e) {
            throw new MetadataLoadingException(manifest + " has no artifacts section", e);
        }

        Map<String, ConstructInfo> constructs = new TreeMap<>();
        for (String artifactId : new TreeMap<>(artifacts).keySet()) {
            Map<String, Object> artifact = Values.asMap(artifacts.get(artifactId));
            if (artifact == null || !STACK_ARTIFACT.equals(artifact.get("type"))) {
                continue;
            }
            if (stackName != null && !stackName.equals(artifactId) && !stackName.equals(declaredStackName(artifact))) {
                continue;
            }
            Map<String, Object> metadata = Values.asMap(artifact.get("metadata"));
            if (metadata == null) {
                continue;
            }
            for (Map.Entry<String, Object> entry : metadata.entrySet()) {
                for (Object item : Values.listOf(entry.getValue())) {
                    Map<String, Object> record = Values.asMap(item);
                    if (record == null || !LOGICAL_ID_ENTRY.equals(record.get("type"))
                            || !(record.get("data") instanceof String)) {
                        continue;
                    }
                    String logicalId = (String) record.get("data");
                    ConstructInfo previous = constructs.putIfAbsent(logicalId, ConstructInfo.builder()
                            .logicalId(logicalId)
                            .path(entry.getKey())
                            .stackName(artifactId)
                            .build());
                    if (previous != null) {
                        log.warn("Logical ID {} appears in several stacks, keeping {}", logicalId, previous.getPath());
                    }
                }
            }
        }
        return constructs;
    }

    private static String declaredStackName(Map<String, Object> artifact) {
        Map<String, Object> properties = Values.asMap(artifact.get("properties"));
        return properties == null ? null : Values.asString(properties.get("stackName"));
    }

    private Map<String, String> readTreeTypes(Path tree) {
        Map<String, Object> document;
        try {
            document = objectMapper.readValue(tree.toFile(), new TypeReference<Map<String, Object>>() {
            });
        } catch (IOException e) {
            throw new MetadataLoadingException("Cannot read " + tree + ": " + e.getMessage(), e);
        }
        Map<String, Object> root = Values.asMap(document.get("tree"));
        Map<String, String> types = new HashMap<>();
        collectTypes(root != null ? root : document, "", types);
        return types;
    }

    private void collectTypes(Map<String, Object> node, String currentPath, Map<String, String> types) {
        Map<String, Object> attributes = Values.asMap(node.get("attributes"));
        if (attributes != null && attributes.get(CFN_TYPE_ATTRIBUTE) instanceof String && !currentPath.isEmpty()) {
            types.put(currentPath, (String) attributes.get(CFN_TYPE_ATTRIBUTE));
        }
        Map<String, Object> children = Values.asMap(node.get("children"));
        if (children == null) {
            return;
        }
        for (Map.Entry<String, Object> child : children.entrySet()) {
            Map<String, Object> childNode = Values.asMap(child.getValue());
            if (childNode != null) {
                collectTypes(childNode, currentPath + "/" + child.getKey(), types);
            }
        }
    }
}
