package com.example.samifier.fold.rules;

import com.example.samifier.fold.FoldContext;
import com.example.samifier.fold.FoldMatch;
import com.example.samifier.fold.FoldRewrite;
import com.example.samifier.fold.FoldRule;
import com.example.samifier.fold.ResourceAttributes;
import com.example.samifier.fold.SamEvents;
import com.example.samifier.fold.SamProperties;
import com.example.samifier.model.Resource;
import com.example.samifier.util.Values;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An EventBridge rule with a single function target becomes a {@code Schedule} or
 * {@code EventBridgeRule} event on that function.
 */
@Component
public class EventsRuleFoldRule implements FoldRule {
    public static final String NAME = "events-rule";

    static final String EVENTS_RULE = "AWS::Events::Rule";
    private static final String EVENTS_SERVICE = "events.amazonaws.com";
    private static final Set<String> RULE_KEYS = Set.of(
            "ScheduleExpression", "EventPattern", "State", "Targets", "Description", "Name", "EventBusName");
    private static final Set<String> TARGET_KEYS = Set.of("Arn", "Id", "Input", "DeadLetterConfig", "RetryPolicy");

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getDefaultPriority() {
        return 45;
    }

    @Override
    public List<FoldMatch> match(FoldContext context) {
        List<FoldMatch> matches = new ArrayList<>();
        for (Resource rule : context.getDocument().resourcesOfType(EVENTS_RULE)) {
            String ruleId = rule.getLogicalId();
            List<Object> targets = Values.listOf(rule.property("Targets"));
            if (!SamProperties.unsupported(rule.getProperties(), RULE_KEYS).isEmpty() || targets.size() != 1) {
                context.annotate(NAME, ruleId + " stays raw: only single-target rules without extra settings are folded");
                continue;
            }
            Map<String, Object> target = Values.asMap(targets.get(0));
            String functionId = target == null ? null : context.functionTarget(target.get("Arn"));
            if (functionId == null || !SamProperties.unsupported(target, TARGET_KEYS).isEmpty()) {
                context.annotate(NAME, ruleId + " stays raw: target is not a plain function invocation");
                continue;
            }
            if ((rule.property("ScheduleExpression") == null) == (rule.property("EventPattern") == null)) {
                context.annotate(NAME, ruleId + " stays raw: needs exactly one of a schedule or an event pattern");
                continue;
            }
            List<Resource> consumed = new ArrayList<>();
            consumed.add(rule);
            for (Resource permission : context.permissionsFor(functionId, EVENTS_SERVICE)) {
                if (ruleId.equals(Values.directTarget(permission.property("SourceArn")))) {
                    consumed.add(permission);
                }
            }
            String blocker = ResourceAttributes.blocker(consumed, context.resource(functionId));
            if (blocker != null) {
                context.annotate(NAME, ruleId + " stays raw: " + blocker);
                continue;
            }
            FoldMatch.FoldMatchBuilder match = FoldMatch.builder()
                    .rule(NAME)
                    .anchorId(ruleId)
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
        Resource rule = context.resource(match.getAnchorId());
        Map<String, Object> target = Values.asMap(Values.listOf(rule.property("Targets")).get(0));
        FoldRewrite rewrite = new FoldRewrite();
        Map<String, Object> event = new LinkedHashMap<>();
        String type;
        if (rule.property("ScheduleExpression") != null) {
            type = "Schedule";
            event.put("Schedule", Values.deepCopy(rule.property("ScheduleExpression")));
            putIfPresent(event, "Name", rule.property("Name"));
            putIfPresent(event, "Description", rule.property("Description"));
            if (rule.property("EventBusName") != null) {
                rewrite.loss(match.getAnchorId() + ": EventBusName does not apply to schedules and is dropped");
            }
        } else {
            type = "EventBridgeRule";
            event.put("Pattern", Values.deepCopy(rule.property("EventPattern")));
            putIfPresent(event, "EventBusName", rule.property("EventBusName"));
            putIfPresent(event, "RuleName", rule.property("Name"));
            if (rule.property("Description") != null) {
                rewrite.loss(match.getAnchorId() + ": Description has no EventBridgeRule event equivalent");
            }
        }
        putIfPresent(event, "State", rule.property("State"));
        putIfPresent(event, "Input", target.get("Input"));
        putIfPresent(event, "DeadLetterConfig", target.get("DeadLetterConfig"));
        putIfPresent(event, "RetryPolicy", target.get("RetryPolicy"));
        if (target.get("Id") != null && "EventBridgeRule".equals(type)) {
            event.put("Target", Values.mapOf("Id", Values.deepCopy(target.get("Id"))));
        }

        Resource host = function.copy();
        SamEvents.add(host, match.getAnchorId(), type, event);
        rewrite.upsert(host);
        for (String consumed : match.getConsumedIds()) {
            ResourceAttributes.noteDropped(context.resource(consumed), match.group(), rewrite);
            rewrite.remove(consumed);
        }
        return rewrite;
    }

    private static void putIfPresent(Map<String, Object> event, String key, Object value) {
        if (value != null) {
            event.put(key, Values.deepCopy(value));
        }
    }
}
