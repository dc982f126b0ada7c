package com.example.samifier.service;

import com.example.samifier.asset.StagedAsset;
import com.example.samifier.exception.OutputWriteException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class OutputWriterTest {

    private final OutputWriter writer = new OutputWriter();

    @Test
    public void testWritesDocumentsAndAssets(@TempDir Path root) throws IOException {
        Path out = root.resolve("out");
        Map<String, String> documents = new LinkedHashMap<>();
        documents.put("template.yaml", "Resources: {}\n");
        documents.put("refactor-plan.json", "{}");
        StagedAsset directory = new StagedAsset("src/Worker", "d1", Map.of(
                "index.js", bytes("exports.handler = 1;"),
                "lib/util.js", bytes("module.exports = {};")));
        StagedAsset file = new StagedAsset("src/Fn/fn.zip", "d2", Map.of("", new byte[]{1, 2}));

        writer.write(out, documents, List.of(directory, file));

        assertEquals("Resources: {}\n", Files.readString(out.resolve("template.yaml")));
        assertEquals("{}", Files.readString(out.resolve("refactor-plan.json")));
        assertEquals("module.exports = {};", Files.readString(out.resolve("src/Worker/lib/util.js")));
        assertArrayEquals(new byte[]{1, 2}, Files.readAllBytes(out.resolve("src/Fn/fn.zip")));
        try (Stream<Path> siblings = Files.list(root)) {
            assertEquals(List.of(out), siblings.collect(Collectors.toList()));
        }
    }

    @Test
    public void testReplacesPreviousRunAndKeepsOtherFiles(@TempDir Path root) throws IOException {
        Path out = root.resolve("out");
        Files.createDirectories(out.resolve("src/Worker"));
        Files.writeString(out.resolve("src/Worker/stale.js"), "old");
        Files.writeString(out.resolve("README.md"), "notes");
        Files.writeString(out.resolve("template.yaml"), "old");

        writer.write(out, Map.of("template.yaml", "new"),
                List.of(new StagedAsset("src/Worker", "d", Map.of("index.js", bytes("fresh")))));

        assertEquals("new", Files.readString(out.resolve("template.yaml")));
        assertEquals("notes", Files.readString(out.resolve("README.md")));
        assertFalse(Files.exists(out.resolve("src/Worker/stale.js")));
        assertTrue(Files.exists(out.resolve("src/Worker/index.js")));
    }

    @Test
    public void testRefusesPathsOutsideOutput(@TempDir Path root) {
        Path out = root.resolve("out");

        OutputWriteException e = assertThrows(OutputWriteException.class,
                () -> writer.write(out, Map.of("../escape.yaml", "x"), List.of()));
        assertEquals(OutputWriteException.CODE, e.getCode());
        assertFalse(Files.exists(root.resolve("escape.yaml")));
        assertFalse(Files.exists(out));
    }

    @Test
    public void testInside(@TempDir Path root) {
        assertEquals(root.resolve("a/b.txt"), OutputWriter.inside(root, "a/./b.txt"));
        assertThrows(OutputWriteException.class, () -> OutputWriter.inside(root, "a/../../b.txt"));
        assertThrows(OutputWriteException.class, () -> OutputWriter.inside(root, "."));
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
