package com.templateweaver.core.arn;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Supported ARN partitions.
 */
public enum Partition {
    AWS("aws"),
    AWS_CN("aws-cn"),
    AWS_US_GOV("aws-us-gov");

    private final String id;

    Partition(String id) {
        this.id = id;
    }

    /**
     * Returns the partition identifier as it appears in an ARN.
     *
     * @return partition id, e.g. {@code aws-cn}
     */
    public String id() {
        return id;
    }

    public static Optional<Partition> fromId(String id) {
        return Arrays.stream(values()).filter(p -> p.id.equals(id)).findFirst();
    }

    /**
     * Returns the partition a region belongs to: {@code cn-*} regions are in
     * {@code aws-cn}, {@code us-gov-*} regions in {@code aws-us-gov}, all others in {@code aws}.
     *
     * @param region region name
     * @return owning partition
     */
    public static Partition forRegion(String region) {
        Objects.requireNonNull(region, "region must not be null");
        if (region.startsWith("cn-")) {
            return AWS_CN;
        }
        if (region.startsWith("us-gov-")) {
            return AWS_US_GOV;
        }
        return AWS;
    }

    @Override
    public String toString() {
        return id;
    }
}
