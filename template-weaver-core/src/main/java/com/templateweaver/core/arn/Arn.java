package com.templateweaver.core.arn;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed Amazon Resource Name: {@code arn:partition:service:region:account:resource}.
 *
 * <p>Partition, service and resource are non-empty; region and account may be empty
 * for global services. The resource may itself contain colons.
 *
 * @param partition partition id
 * @param service service namespace
 * @param region region, possibly empty
 * @param accountId account id, possibly empty
 * @param resource resource part
 */
public record Arn(String partition, String service, String region, String accountId, String resource) {

    private static final Pattern SHAPE = Pattern.compile("^arn:([^:]+):([^:]+):([^:]*):([^:]*):(.+)$");

    /**
     * Compact constructor with validation.
     */
    public Arn {
        Objects.requireNonNull(partition, "partition must not be null");
        Objects.requireNonNull(service, "service must not be null");
        Objects.requireNonNull(resource, "resource must not be null");
        region = region == null ? "" : region;
        accountId = accountId == null ? "" : accountId;
    }

    /**
     * Parses an ARN. The partition is not checked; use {@link ArnValidator#verify(String)}
     * for that.
     *
     * @param text ARN text
     * @return parsed ARN
     * @throws ArnException if the text is empty or not shaped like an ARN
     */
    public static Arn parse(String text) {
        if (text == null || text.isEmpty()) {
            throw new ArnException(ArnErrorKind.EMPTY, text, "ARN must not be empty");
        }
        Matcher matcher = SHAPE.matcher(text);
        if (!matcher.matches()) {
            throw new ArnException(ArnErrorKind.MALFORMED, text, "invalid ARN format: " + text);
        }
        return new Arn(matcher.group(1), matcher.group(2), matcher.group(3), matcher.group(4), matcher.group(5));
    }

    public static boolean isArn(String text) {
        return text != null && SHAPE.matcher(text).matches();
    }

    public Arn withPartition(String newPartition) {
        return new Arn(newPartition, service, region, accountId, resource);
    }

    public Arn withRegion(String newRegion) {
        return new Arn(partition, service, newRegion, accountId, resource);
    }

    public Arn withAccountId(String newAccountId) {
        return new Arn(partition, service, region, newAccountId, resource);
    }

    @Override
    public String toString() {
        return "arn:" + partition + ':' + service + ':' + region + ':' + accountId + ':' + resource;
    }
}
