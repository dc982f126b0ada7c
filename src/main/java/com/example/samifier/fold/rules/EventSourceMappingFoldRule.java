package com.example.samifier.fold.rules;

import com.example.samifier.fold.FoldContext;
import com.example.samifier.fold.FoldMatch;
import com.example.samifier.fold.FoldRewrite;
import com.example.samifier.fold.FoldRule;
import com.example.samifier.fold.ResourceAttributes;
import com.example.samifier.fold.SamEvents;
import com.example.samifier.model.Resource;
import com.example.samifier.util.Values;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code AWS::Lambda::EventSourceMapping} becomes an event on the function it invokes, named after
 * the mapping. Fields the event type cannot carry are kept under
 * {@code Metadata.SamEventOverrides.<Event>} of the function and noted as a loss.
 */
@Slf4j
@Component
public class EventSourceMappingFoldRule implements FoldRule {
    public static final String NAME = "event-source-mapping";

    static final String MAPPING = "AWS::Lambda::EventSourceMapping";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getDefaultPriority() {
        return 40;
    }

    @Override
    public List<FoldMatch> match(FoldContext context) {
        List<FoldMatch> matches = new ArrayList<>();
        for (Resource mapping : context.getDocument().resourcesOfType(MAPPING)) {
            String mappingId = mapping.getLogicalId();
            String functionId = context.functionTarget(mapping.property("FunctionName"));
            if (functionId == null) {
                context.annotate(NAME, mappingId + " stays raw: function is not defined in this template");
                continue;
            }
            EventSourceKind kind = kindOf(mapping, context);
            if (kind == null) {
                context.annotate(NAME, mappingId + " stays raw: event source type is unknown");
                continue;
            }
            String blocker = ResourceAttributes.blocker(mapping, context.resource(functionId));
            if (blocker != null) {
                context.annotate(NAME, mappingId + " stays raw: " + blocker);
                continue;
            }
            matches.add(FoldMatch.builder()
                    .rule(NAME)
                    .anchorId(mappingId)
                    .consumed(mappingId)
                    .host(functionId)
                    .attribute("kind", kind)
                    .build());
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
        EventSourceKind kind = match.attribute("kind");
        Resource mapping = context.resource(match.getAnchorId());
        Resource host = function.copy();
        FoldRewrite rewrite = new FoldRewrite();

        Map<String, Object> event = new LinkedHashMap<>();
        Map<String, Object> overrides = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : mapping.getProperties().entrySet()) {
            String field = entry.getKey();
            Object value = Values.deepCopy(entry.getValue());
            if ("FunctionName".equals(field)) {
                continue;
            }
            if ("EventSourceArn".equals(field) && kind.getSourceProperty() != null) {
                event.put(kind.getSourceProperty(), value);
            } else if (kind.getFields().contains(field)) {
                event.put(field, value);
            } else if (!flatten(kind, field, value, event)) {
                overrides.put(field, value);
            }
        }

        String eventName = SamEvents.add(host, match.getAnchorId(), kind.getEventType(), event);
        for (Map.Entry<String, Object> override : overrides.entrySet()) {
            SamEvents.addOverride(host, eventName, override.getKey(), override.getValue());
            rewrite.loss(String.format("%s.%s has no %s event equivalent, kept under Metadata.%s.%s",
                    match.getAnchorId(), override.getKey(), kind.getEventType(), SamEvents.OVERRIDES, eventName));
        }
        ResourceAttributes.noteDropped(mapping, match.group(), rewrite);
        log.debug("Mapping {} becomes {} event {} on {}", match.getAnchorId(), kind.getEventType(), eventName, functionId);
        return rewrite.upsert(host).remove(match.getAnchorId());
    }

    /**
     * Nested mapping settings that SAM events expose as top-level fields
     *
     * @return whether the field was consumed
     */
    private static boolean flatten(EventSourceKind kind, String field, Object value, Map<String, Object> event) {
        Map<String, Object> config = Values.asMap(value);
        if (config == null) {
            return false;
        }
        if ((kind == EventSourceKind.MSK && "AmazonManagedKafkaEventSourceConfig".equals(field))
                || (kind == EventSourceKind.SELF_MANAGED_KAFKA && "SelfManagedKafkaEventSourceConfig".equals(field))) {
            if (config.size() == 1 && config.containsKey("ConsumerGroupId")) {
                event.put("ConsumerGroupId", config.get("ConsumerGroupId"));
                return true;
            }
            return false;
        }
        if (kind == EventSourceKind.SELF_MANAGED_KAFKA && "SelfManagedEventSource".equals(field)) {
            Map<String, Object> endpoints = Values.asMap(config.get("Endpoints"));
            if (config.size() == 1 && endpoints != null && endpoints.size() == 1 && endpoints.containsKey("KafkaBootstrapServers")) {
                event.put("KafkaBootstrapServers", endpoints.get("KafkaBootstrapServers"));
                return true;
            }
            return false;
        }
        if (kind == EventSourceKind.DOCUMENTDB && "DocumentDBEventSourceConfig".equals(field)) {
            event.putAll(config);
            return true;
        }
        return false;
    }

    /**
     * Source family, from the referenced resource type first and the ARN text otherwise
     */
    static EventSourceKind kindOf(Resource mapping, FoldContext context) {
        Object source = mapping.property("EventSourceArn");
        if (source == null) {
            return mapping.property("SelfManagedEventSource") != null ? EventSourceKind.SELF_MANAGED_KAFKA : null;
        }
        Resource target = context.resource(Values.directTarget(source));
        for (EventSourceKind kind : EventSourceKind.values()) {
            if (target != null && kind.getResourceType() != null && target.isType(kind.getResourceType())) {
                return kind;
            }
        }
        if (target != null) {
            return null;
        }
        for (EventSourceKind kind : EventSourceKind.values()) {
            if (kind.getArnFragment() != null && Values.containsText(source, kind.getArnFragment())) {
                return kind;
            }
        }
        return null;
    }
}
