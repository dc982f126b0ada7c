package com.example.samifier.fold.rules;

import java.util.Set;

/**
 * Event source families an {@code AWS::Lambda::EventSourceMapping} can read from, with the
 * SAM event type and the fields that event type accepts.
 */
enum EventSourceKind {
    SQS("SQS", "Queue", "AWS::SQS::Queue", ":sqs:",
            Set.of("BatchSize", "Enabled", "FilterCriteria", "FunctionResponseTypes",
                    "MaximumBatchingWindowInSeconds", "ScalingConfig", "KmsKeyArn", "MetricsConfig")),
    KINESIS("Kinesis", "Stream", "AWS::Kinesis::Stream", ":kinesis:",
            Set.of("StartingPosition", "StartingPositionTimestamp", "BatchSize", "BisectBatchOnFunctionError",
                    "DestinationConfig", "Enabled", "FilterCriteria", "FunctionResponseTypes",
                    "MaximumBatchingWindowInSeconds", "MaximumRecordAgeInSeconds", "MaximumRetryAttempts",
                    "ParallelizationFactor", "TumblingWindowInSeconds", "KmsKeyArn", "MetricsConfig")),
    DYNAMODB("DynamoDB", "Stream", "AWS::DynamoDB::Table", ":dynamodb:",
            Set.of("StartingPosition", "StartingPositionTimestamp", "BatchSize", "BisectBatchOnFunctionError",
                    "DestinationConfig", "Enabled", "FilterCriteria", "FunctionResponseTypes",
                    "MaximumBatchingWindowInSeconds", "MaximumRecordAgeInSeconds", "MaximumRetryAttempts",
                    "ParallelizationFactor", "TumblingWindowInSeconds", "KmsKeyArn", "MetricsConfig")),
    MSK("MSK", "Stream", "AWS::MSK::Cluster", ":kafka:",
            Set.of("StartingPosition", "StartingPositionTimestamp", "Topics", "BatchSize", "Enabled",
                    "FilterCriteria", "MaximumBatchingWindowInSeconds", "SourceAccessConfigurations",
                    "DestinationConfig", "ProvisionedPollerConfig", "KmsKeyArn")),
    MQ("MQ", "Broker", "AWS::AmazonMQ::Broker", ":mq:",
            Set.of("Queues", "SourceAccessConfigurations", "BatchSize", "Enabled", "FilterCriteria",
                    "MaximumBatchingWindowInSeconds", "KmsKeyArn")),
    DOCUMENTDB("DocumentDB", "Cluster", "AWS::DocDB::DBCluster", ":rds:",
            Set.of("SourceAccessConfigurations", "BatchSize", "Enabled", "FilterCriteria",
                    "MaximumBatchingWindowInSeconds", "StartingPosition", "StartingPositionTimestamp", "KmsKeyArn")),
    SELF_MANAGED_KAFKA("SelfManagedKafka", null, null, null,
            Set.of("Topics", "SourceAccessConfigurations", "BatchSize", "Enabled", "FilterCriteria", "KmsKeyArn"));

    private final String eventType;
    /** SAM property holding the source ARN */
    private final String sourceProperty;
    private final String resourceType;
    /** ARN service fragment used when the source is not a resource of this template */
    private final String arnFragment;
    private final Set<String> fields;

    EventSourceKind(String eventType, String sourceProperty, String resourceType, String arnFragment, Set<String> fields) {
        this.eventType = eventType;
        this.sourceProperty = sourceProperty;
        this.resourceType = resourceType;
        this.arnFragment = arnFragment;
        this.fields = fields;
    }

    String getEventType() {
        return eventType;
    }

    String getSourceProperty() {
        return sourceProperty;
    }

    String getResourceType() {
        return resourceType;
    }

    String getArnFragment() {
        return arnFragment;
    }

    Set<String> getFields() {
        return fields;
    }
}
