package com.templateweaver.core.arn;

import java.util.function.Function;

/**
 * Verifies ARNs assembled when one resource references another.
 *
 * <p>{@link #verify(String)} checks shape and partition. The {@code verifyX} methods
 * re-parse the ARN and compare a single segment with an expected value.
 */
public final class ArnValidator {

    private ArnValidator() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Verifies that the text is a well-formed ARN in a supported partition.
     *
     * @param arn ARN text
     * @return the parsed ARN
     * @throws ArnException with kind {@code EMPTY}, {@code MALFORMED} or {@code UNSUPPORTED_PARTITION}
     */
    public static Arn verify(String arn) {
        Arn parsed = Arn.parse(arn);
        if (Partition.fromId(parsed.partition()).isEmpty()) {
            throw new ArnException(ArnErrorKind.UNSUPPORTED_PARTITION, arn,
                "invalid partition '" + parsed.partition() + "' in ARN");
        }
        return parsed;
    }

    public static void verifyPartition(String arn, String expected) {
        verifyField(arn, "partition", Arn::partition, expected);
    }

    public static void verifyService(String arn, String expected) {
        verifyField(arn, "service", Arn::service, expected);
    }

    public static void verifyRegion(String arn, String expected) {
        verifyField(arn, "region", Arn::region, expected);
    }

    public static void verifyAccountId(String arn, String expected) {
        verifyField(arn, "account id", Arn::accountId, expected);
    }

    private static void verifyField(String arn, String field, Function<Arn, String> accessor, String expected) {
        String actual = accessor.apply(Arn.parse(arn));
        if (!actual.equals(expected)) {
            throw new ArnException(ArnErrorKind.FIELD_MISMATCH, arn,
                "ARN " + field + " '" + actual + "' does not match expected " + field + " '" + expected + "'");
        }
    }
}
