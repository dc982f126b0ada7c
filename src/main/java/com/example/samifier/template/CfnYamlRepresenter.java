package com.example.samifier.template;

import com.example.samifier.model.ConditionRef;
import com.example.samifier.model.FnCall;
import com.example.samifier.model.GetAtt;
import com.example.samifier.model.Ref;
import com.example.samifier.model.Sub;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.representer.Represent;
import org.yaml.snakeyaml.representer.Representer;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Writes intrinsic nodes with CloudFormation short-form tags and multi-line strings as literal blocks.
 */
class CfnYamlRepresenter extends Representer {

    CfnYamlRepresenter(DumperOptions options) {
        super(options);
        this.representers.put(String.class, new RepresentText());
        this.representers.put(Ref.class, new RepresentRef());
        this.representers.put(ConditionRef.class, new RepresentConditionRef());
        this.representers.put(GetAtt.class, new RepresentGetAtt());
        this.representers.put(Sub.class, new RepresentSub());
        this.representers.put(FnCall.class, new RepresentFnCall());
    }

    private static DumperOptions.ScalarStyle styleFor(String value) {
        return value.indexOf('\n') >= 0 ? DumperOptions.ScalarStyle.LITERAL : DumperOptions.ScalarStyle.PLAIN;
    }

    private class RepresentText implements Represent {
        @Override
        public Node representData(Object data) {
            String value = data.toString();
            return representScalar(Tag.STR, value, styleFor(value));
        }
    }

    private class RepresentRef implements Represent {
        @Override
        public Node representData(Object data) {
            return representScalar(new Tag("!Ref"), ((Ref) data).getTarget());
        }
    }

    private class RepresentConditionRef implements Represent {
        @Override
        public Node representData(Object data) {
            return representScalar(new Tag("!Condition"), ((ConditionRef) data).getName());
        }
    }

    private class RepresentGetAtt implements Represent {
        @Override
        public Node representData(Object data) {
            GetAtt getAtt = (GetAtt) data;
            if (getAtt.getAttribute() instanceof String) {
                return representScalar(new Tag("!GetAtt"), getAtt.getLogicalId() + "." + getAtt.getAttribute());
            }
            return representSequence(new Tag("!GetAtt"),
                    Arrays.asList(getAtt.getLogicalId(), getAtt.getAttribute()), DumperOptions.FlowStyle.FLOW);
        }
    }

    private class RepresentSub implements Represent {
        @Override
        public Node representData(Object data) {
            Sub sub = (Sub) data;
            String text = sub.getTemplate().render();
            if (sub.getVariables() == null) {
                return representScalar(new Tag("!Sub"), text, styleFor(text));
            }
            return representSequence(new Tag("!Sub"), Arrays.asList(text, sub.getVariables()),
                    DumperOptions.FlowStyle.BLOCK);
        }
    }

    private class RepresentFnCall implements Represent {
        @Override
        public Node representData(Object data) {
            FnCall call = (FnCall) data;
            Tag tag = new Tag("!" + call.getShortName());
            Object argument = call.getArgument();
            if (argument instanceof List) {
                return representSequence(tag, (List<?>) argument, DumperOptions.FlowStyle.BLOCK);
            }
            if (argument instanceof Map) {
                return representMapping(tag, (Map<?, ?>) argument, DumperOptions.FlowStyle.BLOCK);
            }
            if (argument instanceof String) {
                return representScalar(tag, (String) argument, styleFor((String) argument));
            }
            // a tagged node cannot carry a second tag, so nested intrinsics and non-string scalars use the long form
            Map<String, Object> longForm = Collections.singletonMap(call.getFunctionName(), argument);
            return representMapping(Tag.MAP, longForm, DumperOptions.FlowStyle.BLOCK);
        }
    }
}
