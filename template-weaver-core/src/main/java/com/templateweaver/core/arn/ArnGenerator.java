package com.templateweaver.core.arn;

import java.util.Objects;

/**
 * Builds ARNs for common services within one partition, region and account.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ArnGenerator arns = new ArnGenerator("eu-west-1", "123456789012");
 * arns.lambdaFunction("Handler");  // arn:aws:lambda:eu-west-1:123456789012:function:Handler
 * arns.s3Bucket("assets");         // arn:aws:s3:::assets
 * }</pre>
 */
public class ArnGenerator {

    private final Partition partition;
    private final String region;
    private final String accountId;

    /**
     * Creates a generator whose partition follows the region.
     *
     * @param region region name
     * @param accountId account id
     */
    public ArnGenerator(String region, String accountId) {
        this(Partition.forRegion(region), region, accountId);
    }

    public ArnGenerator(Partition partition, String region, String accountId) {
        this.partition = Objects.requireNonNull(partition, "partition must not be null");
        this.region = Objects.requireNonNull(region, "region must not be null");
        this.accountId = Objects.requireNonNull(accountId, "accountId must not be null");
    }

    public Partition getPartition() {
        return partition;
    }

    // ==================== Lambda ====================

    public Arn lambdaFunction(String functionName) {
        return regional("lambda", "function:" + functionName);
    }

    public Arn lambdaAlias(String functionName, String alias) {
        return regional("lambda", "function:" + functionName + ":" + alias);
    }

    public Arn lambdaLayer(String layerName) {
        return regional("lambda", "layer:" + layerName);
    }

    public Arn lambdaLayerVersion(String layerName, int version) {
        return regional("lambda", "layer:" + layerName + ":" + version);
    }

    // ==================== IAM ====================

    public Arn iamRole(String roleName) {
        return iamRole("/", roleName);
    }

    /**
     * Builds a role ARN with a path. The path is normalized to start and end with a slash.
     *
     * @param path role path, {@code /} or empty for none
     * @param roleName role name
     * @return role ARN
     */
    public Arn iamRole(String path, String roleName) {
        String normalized = path == null || path.isEmpty() ? "/" : path;
        if (!normalized.startsWith("/")) {
            normalized = "/" + normalized;
        }
        if (!normalized.endsWith("/")) {
            normalized = normalized + "/";
        }
        return new Arn(partition.id(), "iam", "", accountId, "role" + normalized + roleName);
    }

    public Arn iamPolicy(String policyName) {
        return new Arn(partition.id(), "iam", "", accountId, "policy/" + policyName);
    }

    /**
     * Builds the ARN of a provider-managed policy, which lives in the {@code aws} account.
     *
     * @param policyName managed policy name
     * @return managed policy ARN
     */
    public Arn iamManagedPolicy(String policyName) {
        return new Arn(partition.id(), "iam", "", "aws", "policy/" + policyName);
    }

    // ==================== Storage and data ====================

    public Arn s3Bucket(String bucketName) {
        return new Arn(partition.id(), "s3", "", "", bucketName);
    }

    public Arn s3Object(String bucketName, String key) {
        return new Arn(partition.id(), "s3", "", "", bucketName + "/" + key);
    }

    public Arn dynamoDbTable(String tableName) {
        return regional("dynamodb", "table/" + tableName);
    }

    public Arn dynamoDbStream(String tableName, String streamLabel) {
        return regional("dynamodb", "table/" + tableName + "/stream/" + streamLabel);
    }

    // ==================== Messaging and workflow ====================

    public Arn snsTopic(String topicName) {
        return regional("sns", topicName);
    }

    public Arn sqsQueue(String queueName) {
        return regional("sqs", queueName);
    }

    public Arn kinesisStream(String streamName) {
        return regional("kinesis", "stream/" + streamName);
    }

    public Arn stateMachine(String stateMachineName) {
        return regional("states", "stateMachine:" + stateMachineName);
    }

    public Arn logGroup(String logGroupName) {
        return regional("logs", "log-group:" + logGroupName);
    }

    /**
     * Builds an API invocation ARN, e.g. {@code arn:aws:execute-api:us-east-1:123:abc/prod/GET/pets}.
     *
     * @param apiId API id
     * @param stage stage name
     * @param method HTTP method or {@code *}
     * @param path resource path, starting with a slash
     * @return invocation ARN
     */
    public Arn executeApi(String apiId, String stage, String method, String path) {
        return regional("execute-api", apiId + "/" + stage + "/" + method + path);
    }

    public Arn generic(String service, String resource) {
        return regional(service, resource);
    }

    private Arn regional(String service, String resource) {
        return new Arn(partition.id(), service, region, accountId, resource);
    }
}
