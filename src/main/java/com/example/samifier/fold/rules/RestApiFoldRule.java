package com.example.samifier.fold.rules;

import com.example.samifier.fold.FoldContext;
import com.example.samifier.fold.FoldMatch;
import com.example.samifier.fold.FoldRewrite;
import com.example.samifier.fold.FoldRule;
import com.example.samifier.fold.ResourceAttributes;
import com.example.samifier.fold.SamEvents;
import com.example.samifier.fold.SamProperties;
import com.example.samifier.model.GetAtt;
import com.example.samifier.model.Ref;
import com.example.samifier.model.Resource;
import com.example.samifier.util.Values;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A REST API whose methods are Lambda proxies and CORS preflights, with one deployment and stage,
 * becomes an {@code AWS::Serverless::Api}. Every proxy method turns into an {@code Api} event
 * on its function.
 */
@Slf4j
@Component
public class RestApiFoldRule implements FoldRule {
    public static final String NAME = "rest-api";

    static final String REST_API = "AWS::ApiGateway::RestApi";
    static final String API_RESOURCE = "AWS::ApiGateway::Resource";
    static final String METHOD = "AWS::ApiGateway::Method";
    static final String DEPLOYMENT = "AWS::ApiGateway::Deployment";
    static final String STAGE = "AWS::ApiGateway::Stage";
    private static final String API_GATEWAY_SERVICE = "apigateway.amazonaws.com";
    private static final String HEADER_PREFIX = "method.response.header.";

    private static final Set<String> API_PASSTHROUGH = Set.of(
            "Name", "Description", "BinaryMediaTypes", "MinimumCompressionSize", "ApiKeySourceType",
            "DisableExecuteApiEndpoint", "FailOnWarnings", "Mode");
    private static final Set<String> API_KEYS = union(API_PASSTHROUGH,
            Set.of("EndpointConfiguration", "Tags", "Body", "BodyS3Location"));
    private static final Set<String> STAGE_PASSTHROUGH = Set.of(
            "Variables", "MethodSettings", "TracingEnabled", "AccessLogSetting", "CacheClusterEnabled",
            "CacheClusterSize", "CanarySetting");
    private static final Set<String> STAGE_CONSUMED = Set.of("RestApiId", "DeploymentId", "StageName");
    private static final Set<String> RESOURCE_KEYS = Set.of("ParentId", "PathPart", "RestApiId");
    private static final Set<String> PROXY_METHOD_KEYS = Set.of(
            "HttpMethod", "ResourceId", "RestApiId", "AuthorizationType", "Integration", "OperationName");
    private static final Set<String> PROXY_INTEGRATION_KEYS = Set.of("Type", "IntegrationHttpMethod", "Uri");
    private static final Map<String, String> CORS_HEADERS = new LinkedHashMap<>();

    static {
        CORS_HEADERS.put("Access-Control-Allow-Origin", "AllowOrigin");
        CORS_HEADERS.put("Access-Control-Allow-Headers", "AllowHeaders");
        CORS_HEADERS.put("Access-Control-Allow-Methods", "AllowMethods");
        CORS_HEADERS.put("Access-Control-Allow-Credentials", "AllowCredentials");
        CORS_HEADERS.put("Access-Control-Max-Age", "MaxAge");
    }

    @Getter
    @AllArgsConstructor
    static class Route {
        private final String functionId;
        private final String method;
        private final String path;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getDefaultPriority() {
        return 30;
    }

    @Override
    public List<FoldMatch> match(FoldContext context) {
        List<FoldMatch> matches = new ArrayList<>();
        for (Resource api : context.getDocument().resourcesOfType(REST_API)) {
            FoldMatch match = matchApi(api, context);
            if (match != null) {
                matches.add(match);
            }
        }
        return matches;
    }

    private FoldMatch matchApi(Resource api, FoldContext context) {
        String apiId = api.getLogicalId();
        List<String> unsupported = SamProperties.unsupported(api.getProperties(), API_KEYS);
        if (!unsupported.isEmpty()) {
            return reject(context, apiId, "unsupported API settings " + unsupported);
        }
        if (api.property("EndpointConfiguration") != null && endpointConfiguration(api.property("EndpointConfiguration")) == null) {
            return reject(context, apiId, "endpoint configuration cannot be expressed");
        }
        if (api.property("Tags") != null && SamProperties.tagsToMap(api.property("Tags")) == null) {
            return reject(context, apiId, "Tags cannot be converted to a map");
        }

        List<Resource> apiResources = members(context, API_RESOURCE, apiId);
        List<Resource> methods = members(context, METHOD, apiId);
        List<Resource> deployments = members(context, DEPLOYMENT, apiId);
        List<Resource> stages = members(context, STAGE, apiId);
        if (deployments.size() != 1 || stages.size() > 1) {
            return reject(context, apiId, "expected one deployment and at most one stage, found "
                    + deployments.size() + " and " + stages.size());
        }
        Resource deployment = deployments.get(0);
        Resource stage = stages.isEmpty() ? null : stages.get(0);
        Object stageName = stage != null ? stage.property("StageName") : deployment.property("StageName");
        if (!(stageName instanceof String)) {
            return reject(context, apiId, "stage name is not a literal");
        }
        if (stage != null && !deployment.getLogicalId().equals(Values.directTarget(stage.property("DeploymentId")))) {
            return reject(context, apiId, "stage does not deploy " + deployment.getLogicalId());
        }
        for (Resource resource : apiResources) {
            if (!SamProperties.unsupported(resource.getProperties(), RESOURCE_KEYS).isEmpty()
                    || !(resource.property("PathPart") instanceof String)) {
                return reject(context, apiId, "resource " + resource.getLogicalId() + " cannot be expressed as a path");
            }
        }

        Map<String, Object> cors = null;
        Set<String> preflightPaths = new LinkedHashSet<>();
        List<Route> routes = new ArrayList<>();
        for (Resource method : methods) {
            String path = pathOf(method.property("ResourceId"), apiId, context);
            if (path == null) {
                return reject(context, apiId, "cannot resolve the path of " + method.getLogicalId());
            }
            Map<String, Object> integration = method.mapProperty("Integration");
            String integrationType = integration == null ? null : Values.asString(integration.get("Type"));
            if ("OPTIONS".equals(method.property("HttpMethod")) && "MOCK".equals(integrationType)) {
                Map<String, Object> methodCors = preflightCors(integration);
                if (methodCors == null) {
                    return reject(context, apiId, "preflight " + method.getLogicalId() + " sets headers SAM cannot express");
                }
                if (cors != null && !cors.equals(methodCors)) {
                    return reject(context, apiId, "preflight headers differ between paths");
                }
                cors = methodCors;
                preflightPaths.add(path);
            } else if ("AWS_PROXY".equals(integrationType)) {
                Route route = proxyRoute(method, integration, path, context);
                if (route == null) {
                    return reject(context, apiId, "method " + method.getLogicalId() + " is not a plain Lambda proxy");
                }
                routes.add(route);
            } else {
                return reject(context, apiId, "method " + method.getLogicalId() + " is neither a Lambda proxy nor a CORS preflight");
            }
        }
        if (cors != null) {
            for (Route route : routes) {
                if (!preflightPaths.contains(route.getPath())) {
                    return reject(context, apiId, "path " + route.getPath() + " has no preflight while others do");
                }
            }
        }

        List<Resource> members = new ArrayList<>(apiResources);
        members.addAll(methods);
        members.add(deployment);
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
                .attribute("stageName", stageName)
                .attribute("routes", routes)
                .attribute("deploymentId", deployment.getLogicalId());
        if (cors != null) {
            match.attribute("cors", cors);
        }
        if (stage != null) {
            match.attribute("stageId", stage.getLogicalId());
        }
        apiResources.forEach(resource -> match.consumed(resource.getLogicalId()));
        methods.forEach(method -> match.consumed(method.getLogicalId()));
        match.consumed(deployment.getLogicalId());
        if (stage != null) {
            match.consumed(stage.getLogicalId());
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
        List<Route> routes = match.attribute("routes");
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
        folded.setType("AWS::Serverless::Api");
        Map<String, Object> properties = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : api.getProperties().entrySet()) {
            Object value = Values.deepCopy(entry.getValue());
            switch (entry.getKey()) {
                case "EndpointConfiguration":
                    properties.put("EndpointConfiguration", endpointConfiguration(value));
                    break;
                case "Tags":
                    properties.put("Tags", SamProperties.tagsToMap(value));
                    break;
                case "Body":
                    properties.put("DefinitionBody", value);
                    break;
                case "BodyS3Location":
                    Map<String, Object> location = Values.asMap(value);
                    properties.put("DefinitionUri", Values.mapOf(
                            "Bucket", location.get("Bucket"), "Key", location.get("Key"), "Version", location.get("Version")));
                    if (location.containsKey("ETag")) {
                        rewrite.loss("BodyS3Location.ETag of " + apiId + " has no SAM equivalent");
                    }
                    break;
                default:
                    properties.put(entry.getKey(), value);
            }
        }
        properties.put("StageName", match.attribute("stageName"));
        Map<String, Object> cors = match.attribute("cors");
        if (cors != null) {
            properties.put("Cors", Values.deepCopy(cors));
        }

        String stageId = match.attribute("stageId");
        if (stageId != null) {
            Resource stage = context.resource(stageId);
            SamProperties.copy(stage.getProperties(), properties, STAGE_PASSTHROUGH);
            for (String key : stage.getProperties().keySet()) {
                if (!STAGE_PASSTHROUGH.contains(key) && !STAGE_CONSUMED.contains(key)) {
                    rewrite.loss(String.format("Stage %s: %s is not carried over", stageId, key));
                }
            }
            rewrite.replaceWithLiteral(stageId, (String) match.attribute("stageName"));
        }
        Resource deployment = context.resource((String) match.attribute("deploymentId"));
        for (String key : deployment.getProperties().keySet()) {
            if (!"RestApiId".equals(key) && !"StageName".equals(key)) {
                rewrite.loss(String.format("Deployment %s: %s is not carried over", deployment.getLogicalId(), key));
            }
        }
        folded.setProperties(properties);
        rewrite.upsert(folded);

        for (Route route : routes) {
            Resource host = hosts.get(route.getFunctionId());
            String method = route.getMethod().toLowerCase();
            SamEvents.add(host, ApiEvents.eventName("Api", route.getMethod(), route.getPath()), "Api",
                    Values.mapOf("RestApiId", new Ref(apiId), "Path", route.getPath(), "Method", method));
        }
        hosts.values().forEach(rewrite::upsert);
        for (String consumed : match.getConsumedIds()) {
            if (!consumed.equals(apiId)) {
                Resource resource = context.resource(consumed);
                if (resource.isType(METHOD) && resource.property("OperationName") != null) {
                    rewrite.loss(String.format("Method %s: OperationName is not carried over", consumed));
                }
                ResourceAttributes.noteDropped(resource, match.group(), rewrite);
                rewrite.remove(consumed);
            }
        }
        rewrite.generated(apiId + match.attribute("stageName") + "Stage");
        log.debug("Folded REST API {} with {} route(s)", apiId, routes.size());
        return rewrite;
    }

    private static FoldMatch reject(FoldContext context, String apiId, String reason) {
        context.annotate(NAME, apiId + " stays raw: " + reason);
        return null;
    }

    private static List<Resource> members(FoldContext context, String type, String apiId) {
        List<Resource> members = new ArrayList<>();
        for (Resource resource : context.getDocument().resourcesOfType(type)) {
            if (apiId.equals(Values.directTarget(resource.property("RestApiId")))) {
                members.add(resource);
            }
        }
        return members;
    }

    /**
     * Full path of an API resource, walking ParentId up to the root resource
     */
    static String pathOf(Object resourceId, String apiId, FoldContext context) {
        List<String> parts = new ArrayList<>();
        Object current = resourceId;
        for (int depth = 0; depth < 64; depth++) {
            if (current instanceof GetAtt && apiId.equals(((GetAtt) current).getLogicalId())
                    && ((GetAtt) current).hasAttribute("RootResourceId")) {
                StringBuilder path = new StringBuilder();
                for (int i = parts.size() - 1; i >= 0; i--) {
                    path.append('/').append(parts.get(i));
                }
                return path.length() == 0 ? "/" : path.toString();
            }
            Resource resource = context.target(current, API_RESOURCE);
            if (resource == null || !(current instanceof Ref)) {
                return null;
            }
            parts.add(resource.stringProperty("PathPart"));
            current = resource.property("ParentId");
        }
        return null;
    }

    private static Map<String, Object> preflightCors(Map<String, Object> integration) {
        List<Object> responses = Values.listOf(integration.get("IntegrationResponses"));
        if (responses.isEmpty()) {
            return null;
        }
        Map<String, Object> parameters = Values.asMap(Values.asMap(responses.get(0)) == null
                ? null : Values.asMap(responses.get(0)).get("ResponseParameters"));
        if (parameters == null) {
            return null;
        }
        Map<String, Object> cors = new LinkedHashMap<>();
        for (Map.Entry<String, String> header : CORS_HEADERS.entrySet()) {
            Object value = parameters.get(HEADER_PREFIX + header.getKey());
            if (value == null) {
                continue;
            }
            if (!(value instanceof String)) {
                return null;
            }
            if ("AllowCredentials".equals(header.getValue())) {
                cors.put("AllowCredentials", "'true'".equals(value));
            } else {
                cors.put(header.getValue(), value);
            }
        }
        for (String key : parameters.keySet()) {
            String header = key.startsWith(HEADER_PREFIX) ? key.substring(HEADER_PREFIX.length()) : key;
            if (!CORS_HEADERS.containsKey(header) && !"Vary".equals(header)) {
                return null;
            }
        }
        return cors.containsKey("AllowOrigin") ? cors : null;
    }

    private static Route proxyRoute(Resource method, Map<String, Object> integration, String path, FoldContext context) {
        Object authorization = method.property("AuthorizationType");
        if (!SamProperties.unsupported(method.getProperties(), PROXY_METHOD_KEYS).isEmpty()
                || !SamProperties.unsupported(integration, PROXY_INTEGRATION_KEYS).isEmpty()
                || (authorization != null && !"NONE".equals(authorization))
                || !(method.property("HttpMethod") instanceof String)) {
            return null;
        }
        String functionId = null;
        for (String id : Values.referencedIds(integration.get("Uri"))) {
            Resource resource = context.resource(id);
            if (resource != null && resource.isType(FoldContext.LAMBDA_FUNCTION)) {
                if (functionId != null) {
                    return null;
                }
                functionId = id;
            }
        }
        return functionId == null ? null : new Route(functionId, method.stringProperty("HttpMethod"), path);
    }

    /**
     * {@code {Types: [X], VpcEndpointIds}} as SAM's {@code {Type: X, VPCEndpointIds}}, null when there are several types
     */
    private static Map<String, Object> endpointConfiguration(Object value) {
        Map<String, Object> config = Values.asMap(value);
        if (config == null || !SamProperties.unsupported(config, Set.of("Types", "VpcEndpointIds")).isEmpty()) {
            return null;
        }
        List<Object> types = Values.listOf(config.get("Types"));
        if (types.size() > 1) {
            return null;
        }
        return Values.mapOf(
                "Type", types.isEmpty() ? null : Values.deepCopy(types.get(0)),
                "VPCEndpointIds", Values.deepCopy(config.get("VpcEndpointIds")));
    }

    private static Set<String> union(Set<String> first, Set<String> second) {
        Set<String> all = new LinkedHashSet<>(first);
        all.addAll(second);
        return all;
    }
}
