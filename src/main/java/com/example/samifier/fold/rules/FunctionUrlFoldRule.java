package com.example.samifier.fold.rules;

import com.example.samifier.fold.FoldContext;
import com.example.samifier.fold.FoldMatch;
import com.example.samifier.fold.FoldRewrite;
import com.example.samifier.fold.FoldRule;
import com.example.samifier.fold.ResourceAttributes;
import com.example.samifier.fold.SamProperties;
import com.example.samifier.model.Resource;
import com.example.samifier.util.Values;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@code AWS::Lambda::Url} becomes the {@code FunctionUrlConfig} of its function.
 * References to the URL move to the {@code <Function>Url} resource SAM generates.
 */
@Component
public class FunctionUrlFoldRule implements FoldRule {
    public static final String NAME = "function-url";

    static final String LAMBDA_URL = "AWS::Lambda::Url";
    private static final Set<String> URL_KEYS = Set.of("TargetFunctionArn", "AuthType", "Cors", "InvokeMode");
    private static final Set<String> CORS_KEYS = Set.of(
            "AllowCredentials", "AllowHeaders", "AllowMethods", "AllowOrigins", "ExposeHeaders", "MaxAge");

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getDefaultPriority() {
        return 20;
    }

    @Override
    public List<FoldMatch> match(FoldContext context) {
        List<FoldMatch> matches = new ArrayList<>();
        for (Resource url : context.getDocument().resourcesOfType(LAMBDA_URL)) {
            String urlId = url.getLogicalId();
            String functionId = context.functionTarget(url.property("TargetFunctionArn"));
            if (functionId == null) {
                context.annotate(NAME, urlId + " stays raw: target is not a function in this template");
                continue;
            }
            if (url.property("Qualifier") != null) {
                context.annotate(NAME, urlId + " stays raw: qualified URLs cannot be expressed");
                continue;
            }
            List<String> unsupported = SamProperties.unsupported(url.getProperties(), URL_KEYS);
            Object cors = url.property("Cors");
            if (cors != null) {
                if (Values.asMap(cors) == null) {
                    unsupported.add("Cors");
                } else {
                    SamProperties.unsupported(Values.asMap(cors), CORS_KEYS).forEach(key -> unsupported.add("Cors." + key));
                }
            }
            if (!unsupported.isEmpty()) {
                context.annotate(NAME, urlId + " stays raw: unsupported settings " + unsupported);
                continue;
            }
            String generated = functionId + "Url";
            if (!generated.equals(urlId) && context.getDocument().hasResource(generated)) {
                context.annotate(NAME, urlId + " stays raw: " + generated + " already exists");
                continue;
            }

            List<Resource> consumed = new ArrayList<>();
            consumed.add(url);
            // SAM only creates the public invoke permission for unauthenticated URLs
            if ("NONE".equals(url.property("AuthType"))) {
                for (Resource permission : context.permissionsFor(functionId, "*")) {
                    if ("NONE".equals(permission.property("FunctionUrlAuthType"))) {
                        consumed.add(permission);
                    }
                }
            }
            String blocker = ResourceAttributes.blocker(consumed, context.resource(functionId));
            if (blocker != null) {
                context.annotate(NAME, urlId + " stays raw: " + blocker);
                continue;
            }

            FoldMatch.FoldMatchBuilder match = FoldMatch.builder()
                    .rule(NAME)
                    .anchorId(urlId)
                    .host(functionId);
            consumed.forEach(resource -> match.consumed(resource.getLogicalId()));
            matches.add(match.build());
        }
        return matches;
    }

    @Override
    public FoldRewrite rewrite(FoldMatch match, FoldContext context) {
        String functionId = match.getHostIds().get(0);
        Resource function = context.foldedFunction(functionId);
        if (function == null) {
            return FoldRewrite.skip(functionId + " was not folded into a serverless function");
        }
        if (function.property("FunctionUrlConfig") != null) {
            return FoldRewrite.skip(functionId + " already has a FunctionUrlConfig");
        }
        Resource url = context.resource(match.getAnchorId());
        Resource host = function.copy();
        Map<String, Object> config = Values.mapOf(
                "AuthType", Values.deepCopy(url.property("AuthType")),
                "Cors", Values.deepCopy(url.property("Cors")),
                "InvokeMode", Values.deepCopy(url.property("InvokeMode")));
        host.getProperties().put("FunctionUrlConfig", config);

        FoldRewrite rewrite = new FoldRewrite().upsert(host);
        for (String consumed : match.getConsumedIds()) {
            ResourceAttributes.noteDropped(context.resource(consumed), match.group(), rewrite);
            rewrite.remove(consumed);
        }
        rewrite.repoint(match.getAnchorId(), functionId + "Url");
        return rewrite;
    }
}
