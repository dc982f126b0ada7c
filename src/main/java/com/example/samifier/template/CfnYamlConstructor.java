package com.example.samifier.template;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.constructor.AbstractConstruct;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;
import org.yaml.snakeyaml.nodes.Tag;

/**
 * SnakeYAML constructor that understands CloudFormation short-form tags.
 * Timestamps are kept as strings so {@code AWSTemplateFormatVersion: 2010-09-09} survives a round trip.
 */
class CfnYamlConstructor extends SafeConstructor {

    CfnYamlConstructor(LoaderOptions options) {
        super(options);
        this.yamlConstructors.put(Tag.TIMESTAMP, new ConstructYamlStr());
        for (String shortName : Intrinsics.SHORT_FORMS) {
            this.yamlConstructors.put(new Tag("!" + shortName), new ConstructIntrinsic(shortName));
        }
    }

    private class ConstructIntrinsic extends AbstractConstruct {
        private final String shortName;

        ConstructIntrinsic(String shortName) {
            this.shortName = shortName;
        }

        @Override
        public Object construct(Node node) {
            Object value;
            if (node instanceof ScalarNode) {
                value = constructScalar((ScalarNode) node);
            } else if (node instanceof SequenceNode) {
                value = constructSequence((SequenceNode) node);
            } else {
                value = constructMapping((MappingNode) node);
            }
            return Intrinsics.fromShortForm(shortName, value);
        }
    }
}
