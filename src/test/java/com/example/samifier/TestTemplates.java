package com.example.samifier;

import com.example.samifier.config.SamifierProperties;
import com.example.samifier.fold.FoldRule;
import com.example.samifier.fold.PatternLibrary;
import com.example.samifier.fold.PolicyTemplateTranslator;
import com.example.samifier.fold.rules.BucketNotificationFoldRule;
import com.example.samifier.fold.rules.EventSourceMappingFoldRule;
import com.example.samifier.fold.rules.EventsRuleFoldRule;
import com.example.samifier.fold.rules.FunctionFoldRule;
import com.example.samifier.fold.rules.FunctionUrlFoldRule;
import com.example.samifier.fold.rules.HttpApiFoldRule;
import com.example.samifier.fold.rules.LayerFoldRule;
import com.example.samifier.fold.rules.RestApiFoldRule;
import com.example.samifier.fold.rules.SimpleTableFoldRule;
import com.example.samifier.model.TemplateDocument;
import com.example.samifier.template.TemplateParser;

import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

/**
 * Fixture access shared by the tests
 */
public final class TestTemplates {
    private static final TemplateParser PARSER = new TemplateParser();

    private TestTemplates() {
    }

    public static String read(String resource) {
        try (InputStream in = TestTemplates.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing test resource " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + resource, e);
        }
    }

    /**
     * @param name file under {@code /templates}
     */
    public static TemplateDocument template(String name) {
        return PARSER.parse(read("/templates/" + name));
    }

    public static TemplateDocument parse(String text) {
        return PARSER.parse(text);
    }

    public static Path path(String resource) {
        URL url = TestTemplates.class.getResource(resource);
        if (url == null) {
            throw new IllegalArgumentException("Missing test resource " + resource);
        }
        try {
            return Paths.get(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    public static List<FoldRule> allRules() {
        return Arrays.asList(
                new FunctionFoldRule(new PolicyTemplateTranslator()),
                new FunctionUrlFoldRule(),
                new RestApiFoldRule(),
                new HttpApiFoldRule(),
                new EventSourceMappingFoldRule(),
                new EventsRuleFoldRule(),
                new BucketNotificationFoldRule(),
                new LayerFoldRule(),
                new SimpleTableFoldRule());
    }

    public static PatternLibrary patternLibrary(SamifierProperties properties) {
        return new PatternLibrary(allRules(), properties);
    }

    public static PatternLibrary patternLibrary() {
        return patternLibrary(new SamifierProperties());
    }
}
