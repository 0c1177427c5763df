package com.templateweaver.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ValidateCommand}.
 */
class ValidateCommandTest extends CommandTestSupport {

    private static final String VALID = """
        Resources:
          Queue:
            Type: AWS::SQS::Queue
          Func:
            Type: AWS::Serverless::Function
            Properties:
              Environment:
                Variables:
                  QUEUE: !GetAtt Queue.Arn
        Outputs:
          QueueUrl:
            Value: !Ref Queue
        """;

    private static final String BAD_DIRECTIVES = """
        Resources:
          Bucket:
            Type: AWS::S3::Bucket
            Properties:
              BucketName: !If [IsProd, prod-bucket]
        """;

    @TempDir
    Path tempDir;

    @Test
    void validate_validTemplate_exitsZeroWithSummary() throws IOException {
        Path template = write("template.yaml", VALID);

        assertThat(run("validate", template.toString())).isEqualTo(ValidateCommand.EXIT_VALID);
        assertThat(stdout()).contains("template.yaml is valid (YAML, 2 resources, 0 parameters, 1 outputs)");
    }

    @Test
    void validate_jsonTemplate_isDetected() throws IOException {
        Path template = write("template.json", """
            {"Resources": {"Topic": {"Type": "AWS::SNS::Topic", "Properties": {"DisplayName": {"Fn::Sub": "${AWS::StackName}"}}}}}
            """);

        assertThat(run("validate", template.toString())).isZero();
        assertThat(stdout()).contains("(JSON, 1 resources");
    }

    @Test
    @DisplayName("Directive shape violations are listed with their path and position")
    void validate_badDirectives_exitsOneAndListsViolations() throws IOException {
        Path template = write("template.yaml", BAD_DIRECTIVES);

        assertThat(run("validate", template.toString())).isEqualTo(ValidateCommand.EXIT_INVALID);
        assertThat(stderr())
            .contains("1 directive shape violation(s):")
            .contains("Resources.Bucket.Properties.BucketName")
            .contains("line 5");
    }

    @Test
    void validate_strict_failsOnDirectiveViolations() throws IOException {
        Path template = write("template.yaml", BAD_DIRECTIVES);

        assertThat(run("validate", "--strict", template.toString())).isEqualTo(ValidateCommand.EXIT_INVALID);
        assertThat(stderr()).contains("1 directive shape violation(s):");
        assertThat(stdout()).doesNotContain("is valid");
    }

    @Test
    void validate_missingType_reportsModelError() throws IOException {
        Path template = write("template.yaml", "Resources:\n  Broken:\n    Properties: {}\n");

        assertThat(run("validate", template.toString())).isEqualTo(ValidateCommand.EXIT_INVALID);
        assertThat(stderr()).contains("Model error: Resources.Broken.Type: resource has no Type");
    }

    @Test
    void validate_violationsAndModelError_reportsBoth() throws IOException {
        Path template = write("template.yaml", """
            Resources:
              Bucket:
                Type: AWS::S3::Bucket
                Properties:
                  BucketName: !If [IsProd, prod-bucket]
              Broken:
                Properties: {}
            """);

        assertThat(run("validate", template.toString())).isEqualTo(ValidateCommand.EXIT_INVALID);
        assertThat(stderr())
            .contains("1 directive shape violation(s):")
            .contains("Resources.Bucket.Properties.BucketName")
            .contains("Model error: Resources.Broken.Type: resource has no Type");
    }

    @Test
    void validate_unknownTag_exitsTwo() throws IOException {
        Path template = write("template.yaml", "Resources:\n  A:\n    Type: !Foo x\n");

        assertThat(run("validate", template.toString())).isEqualTo(ValidateCommand.EXIT_UNREADABLE);
        assertThat(stderr()).contains("Parse error:").contains("!Foo");
    }

    @Test
    void validate_missingFile_exitsTwo() {
        assertThat(run("validate", tempDir.resolve("absent.yaml").toString())).isEqualTo(ValidateCommand.EXIT_UNREADABLE);
        assertThat(stderr()).contains("cannot read");
    }

    @Test
    void validate_forcedJsonOnYaml_exitsTwo() throws IOException {
        Path template = write("template.yaml", VALID);

        assertThat(run("validate", "--format", "json", template.toString())).isEqualTo(ValidateCommand.EXIT_UNREADABLE);
        assertThat(stderr()).contains("Parse error:");
    }

    @Test
    void validate_unknownFormat_exitsTwo() throws IOException {
        Path template = write("template.yaml", VALID);

        assertThat(run("validate", "--format", "xml", template.toString())).isEqualTo(ValidateCommand.EXIT_UNREADABLE);
        assertThat(stderr()).contains("Unknown template format: xml");
    }

    @Test
    void validate_configFile_makesViolationsFatal() throws IOException {
        Path template = write("template.yaml", BAD_DIRECTIVES);
        Path config = write("template-weaver.yaml", "validation:\n  failOnDirectiveErrors: true\n");

        assertThat(run("validate", "--config", config.toString(), template.toString()))
            .isEqualTo(ValidateCommand.EXIT_INVALID);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
