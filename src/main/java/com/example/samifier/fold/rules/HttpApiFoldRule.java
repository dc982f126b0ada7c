package com.example.samifier.fold.rules;

import com.example.samifier.fold.FoldContext;
import com.example.samifier.fold.FoldMatch;
import com.example.samifier.fold.FoldRewrite;
import com.example.samifier.fold.FoldRule;
import com.example.samifier.fold.ResourceAttributes;
import com.example.samifier.fold.SamEvents;
import com.example.samifier.fold.SamProperties;
import com.example.samifier.model.Ref;
import com.example.samifier.model.Resource;
import com.example.samifier.util.Values;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An HTTP API whose routes all target Lambda proxy integrations becomes an
 * {@code AWS::Serverless::HttpApi}; each route becomes an {@code HttpApi} event on its function.
 */
@Component
public class HttpApiFoldRule implements FoldRule {
    public static final String NAME = "http-api";

    static final String API = "AWS::ApiGatewayV2::Api";
    static final String ROUTE = "AWS::ApiGatewayV2::Route";
    static final String INTEGRATION = "AWS::ApiGatewayV2::Integration";
    static final String STAGE = "AWS::ApiGatewayV2::Stage";
    private static final String DEFAULT_STAGE = "$default";
    private static final String DEFAULT_ROUTE = "$default";
    private static final String API_GATEWAY_SERVICE = "apigateway.amazonaws.com";

    private static final Set<String> API_PASSTHROUGH = Set.of(
            "Name", "Description", "CorsConfiguration", "DisableExecuteApiEndpoint", "FailOnWarnings", "Tags");
    private static final Set<String> API_KEYS = union(API_PASSTHROUGH, Set.of("ProtocolType"));
    private static final Set<String> ROUTE_KEYS = Set.of("ApiId", "RouteKey", "Target", "AuthorizationType", "OperationName");
    private static final Set<String> INTEGRATION_KEYS = Set.of(
            "ApiId", "IntegrationType", "IntegrationUri", "PayloadFormatVersion", "IntegrationMethod");
    private static final Map<String, String> STAGE_MAPPED = new LinkedHashMap<>();

    static {
        STAGE_MAPPED.put("AccessLogSettings", "AccessLogSettings");
        STAGE_MAPPED.put("DefaultRouteSettings", "DefaultRouteSettings");
        STAGE_MAPPED.put("RouteSettings", "RouteSettings");
        STAGE_MAPPED.put("StageVariables", "StageVariables");
    }

    @Getter
    @AllArgsConstructor
    static class HttpRoute {
        private final String functionId;
        /** Null for the default route */
        private final String method;
        private final String path;
        private final Object payloadFormatVersion;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getDefaultPriority() {
        return 35;
    }

    @Override
    public List<FoldMatch> match(FoldContext context) {
        List<FoldMatch> matches = new ArrayList<>();
        for (Resource api : context.getDocument().resourcesOfType(API)) {
            FoldMatch match = matchApi(api, context);
            if (match != null) {
                matches.add(match);
            }
        }
        return matches;
    }

    private FoldMatch matchApi(Resource api, FoldContext context) {
        String apiId = api.getLogicalId();
        if (!"HTTP".equals(api.property("ProtocolType"))) {
            return reject(context, apiId, "only HTTP APIs are folded");
        }
        List<String> unsupported = SamProperties.unsupported(api.getProperties(), API_KEYS);
        if (!unsupported.isEmpty()) {
            return reject(context, apiId, "unsupported API settings " + unsupported);
        }
        List<Resource> stages = members(context, STAGE, apiId);
        if (stages.size() > 1) {
            return reject(context, apiId, "more than one stage");
        }
        Resource stage = stages.isEmpty() ? null : stages.get(0);
        if (stage != null && !(stage.property("StageName") instanceof String)) {
            return reject(context, apiId, "stage name is not a literal");
        }

        List<Resource> integrations = members(context, INTEGRATION, apiId);
        Map<String, Resource> integrationsById = new LinkedHashMap<>();
        for (Resource integration : integrations) {
            if (!"AWS_PROXY".equals(integration.property("IntegrationType"))
                    || !SamProperties.unsupported(integration.getProperties(), INTEGRATION_KEYS).isEmpty()
                    || context.functionTarget(integration.property("IntegrationUri")) == null) {
                return reject(context, apiId, "integration " + integration.getLogicalId() + " is not a plain Lambda proxy");
            }
            integrationsById.put(integration.getLogicalId(), integration);
        }

        List<HttpRoute> routes = new ArrayList<>();
        List<Resource> routeResources = members(context, ROUTE, apiId);
        for (Resource route : routeResources) {
            Object authorization = route.property("AuthorizationType");
            if (!SamProperties.unsupported(route.getProperties(), ROUTE_KEYS).isEmpty()
                    || (authorization != null && !"NONE".equals(authorization))
                    || !(route.property("RouteKey") instanceof String)) {
                return reject(context, apiId, "route " + route.getLogicalId() + " cannot be expressed as an event");
            }
            Resource integration = null;
            for (String id : Values.referencedIds(route.property("Target"))) {
                integration = integrationsById.get(id);
            }
            if (integration == null) {
                return reject(context, apiId, "route " + route.getLogicalId() + " does not target a Lambda integration");
            }
            String functionId = context.functionTarget(integration.property("IntegrationUri"));
            String routeKey = route.stringProperty("RouteKey");
            Object payloadFormat = integration.property("PayloadFormatVersion");
            if (DEFAULT_ROUTE.equals(routeKey)) {
                routes.add(new HttpRoute(functionId, null, null, payloadFormat));
            } else {
                String[] parts = routeKey.split(" ", 2);
                if (parts.length != 2) {
                    return reject(context, apiId, "route key " + routeKey + " is not METHOD /path");
                }
                routes.add(new HttpRoute(functionId, parts[0], parts[1], payloadFormat));
            }
        }
        if (routes.isEmpty()) {
            return reject(context, apiId, "no Lambda routes");
        }

        List<Resource> members = new ArrayList<>(routeResources);
        members.addAll(integrations);
        if (stage != null) {
            members.add(stage);
        }
        String blocker = ResourceAttributes.blocker(members, api);
        if (blocker != null) {
            return reject(context, apiId, blocker);
        }

        FoldMatch.FoldMatchBuilder match = FoldMatch.builder()
                .rule(NAME)
                .anchorId(apiId)
                .consumed(apiId)
                .attribute("routes", routes);
        routeResources.forEach(route -> match.consumed(route.getLogicalId()));
        integrations.forEach(integration -> match.consumed(integration.getLogicalId()));
        if (stage != null) {
            match.consumed(stage.getLogicalId()).attribute("stageId", stage.getLogicalId());
        }
        Set<String> functions = new LinkedHashSet<>();
        routes.forEach(route -> functions.add(route.getFunctionId()));
        for (String functionId : functions) {
            match.host(functionId);
            for (Resource permission : context.permissionsFor(functionId, API_GATEWAY_SERVICE)) {
                if (Values.referencedIds(permission.property("SourceArn")).contains(apiId)) {
                    blocker = ResourceAttributes.blocker(permission, context.resource(functionId));
                    if (blocker != null) {
                        return reject(context, apiId, blocker);
                    }
                    match.consumed(permission.getLogicalId());
                }
            }
        }
        return match.build();
    }

    @Override
    public FoldRewrite rewrite(FoldMatch match, FoldContext context) {
        String apiId = match.getAnchorId();
        Map<String, Resource> hosts = new LinkedHashMap<>();
        for (String functionId : match.getHostIds()) {
            Resource function = context.foldedFunction(functionId);
            if (function == null) {
                return FoldRewrite.skip(functionId + " was not folded into a serverless function");
            }
            hosts.put(functionId, function.copy());
        }

        FoldRewrite rewrite = new FoldRewrite();
        Resource api = context.resource(apiId);
        Resource folded = api.copy();
        folded.setType("AWS::Serverless::HttpApi");
        Map<String, Object> properties = new LinkedHashMap<>();
        SamProperties.copy(api.getProperties(), properties, API_PASSTHROUGH);

        String stageId = match.attribute("stageId");
        if (stageId != null) {
            Resource stage = context.resource(stageId);
            String stageName = stage.stringProperty("StageName");
            if (!DEFAULT_STAGE.equals(stageName)) {
                properties.put("StageName", stageName);
            }
            for (Map.Entry<String, Object> entry : stage.getProperties().entrySet()) {
                String mapped = STAGE_MAPPED.get(entry.getKey());
                if (mapped != null) {
                    properties.put(mapped, Values.deepCopy(entry.getValue()));
                } else if (!"ApiId".equals(entry.getKey()) && !"StageName".equals(entry.getKey())
                        && !"AutoDeploy".equals(entry.getKey())) {
                    rewrite.loss(String.format("Stage %s: %s is not carried over", stageId, entry.getKey()));
                }
            }
            if (!Boolean.TRUE.equals(stage.property("AutoDeploy"))) {
                rewrite.loss(String.format("Stage %s was not auto-deployed; SAM deploys it on every update", stageId));
            }
            rewrite.replaceWithLiteral(stageId, stageName);
        }
        folded.setProperties(properties);
        rewrite.upsert(folded);

        List<HttpRoute> routes = match.attribute("routes");
        for (HttpRoute route : routes) {
            Resource host = hosts.get(route.getFunctionId());
            Map<String, Object> event = new LinkedHashMap<>();
            event.put("ApiId", new Ref(apiId));
            if (route.getMethod() != null) {
                event.put("Method", route.getMethod().toLowerCase());
                event.put("Path", route.getPath());
            }
            if (route.getPayloadFormatVersion() != null) {
                event.put("PayloadFormatVersion", Values.deepCopy(route.getPayloadFormatVersion()));
            }
            String name = route.getMethod() == null
                    ? "HttpApiDefault"
                    : ApiEvents.eventName("HttpApi", route.getMethod(), route.getPath());
            SamEvents.add(host, name, "HttpApi", event);
        }
        hosts.values().forEach(rewrite::upsert);
        for (String consumed : match.getConsumedIds()) {
            if (!consumed.equals(apiId)) {
                Resource resource = context.resource(consumed);
                if (resource.isType(ROUTE) && resource.property("OperationName") != null) {
                    rewrite.loss(String.format("Route %s: OperationName is not carried over", consumed));
                }
                ResourceAttributes.noteDropped(resource, match.group(), rewrite);
                rewrite.remove(consumed);
            }
        }
        return rewrite;
    }

    private static FoldMatch reject(FoldContext context, String apiId, String reason) {
        context.annotate(NAME, apiId + " stays raw: " + reason);
        return null;
    }

    private static List<Resource> members(FoldContext context, String type, String apiId) {
        List<Resource> members = new ArrayList<>();
        for (Resource resource : context.getDocument().resourcesOfType(type)) {
            if (apiId.equals(Values.directTarget(resource.property("ApiId")))) {
                members.add(resource);
            }
        }
        return members;
    }

    private static Set<String> union(Set<String> first, Set<String> second) {
        Set<String> all = new LinkedHashSet<>(first);
        all.addAll(second);
        return all;
    }
}
