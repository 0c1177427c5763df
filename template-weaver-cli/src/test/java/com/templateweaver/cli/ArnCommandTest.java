package com.templateweaver.cli;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ArnCommand}.
 */
class ArnCommandTest extends CommandTestSupport {

    private static final String LAMBDA_ARN = "arn:aws:lambda:us-east-1:123456789012:function:F";

    @Test
    void arn_validArn_printsSegments() {
        assertThat(run("arn", LAMBDA_ARN, "--service", "lambda", "--region", "us-east-1")).isZero();
        assertThat(stdout()).contains("Valid ARN: partition=aws service=lambda region=us-east-1 account=123456789012 resource=function:F");
    }

    @Test
    void arn_serviceMismatch_exitsOne() {
        assertThat(run("arn", LAMBDA_ARN, "--service", "s3")).isEqualTo(1);
        assertThat(stderr()).contains("Invalid ARN (FIELD_MISMATCH)");
    }

    @Test
    void arn_malformed_exitsOne() {
        assertThat(run("arn", "not-an-arn")).isEqualTo(1);
        assertThat(stderr()).contains("Invalid ARN (MALFORMED)");
    }

    @Test
    void arn_unknownPartition_exitsOne() {
        assertThat(run("arn", "arn:aws-mars:s3:::bucket")).isEqualTo(1);
        assertThat(stderr()).contains("UNSUPPORTED_PARTITION");
    }
}
