package com.templateweaver.cli;

import com.templateweaver.TemplateWeaverCLI;
import com.templateweaver.core.arn.Arn;
import com.templateweaver.core.arn.ArnException;
import com.templateweaver.core.arn.ArnValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

/**
 * Command to verify an ARN, optionally against expected segments.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * template-weaver arn arn:aws:s3:::my-bucket
 * template-weaver arn arn:aws:lambda:us-east-1:123456789012:function:F --service lambda --region us-east-1
 * }</pre>
 */
@Command(
    name = "arn",
    description = "Verify an ARN and optionally its partition, service, region and account",
    mixinStandardHelpOptions = true
)
public class ArnCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ArnCommand.class);

    @ParentCommand
    private TemplateWeaverCLI parent;

    @Parameters(index = "0", description = "ARN to verify")
    private String arn;

    @Option(names = "--partition", description = "Expected partition")
    private String partition;

    @Option(names = "--service", description = "Expected service")
    private String service;

    @Option(names = "--region", description = "Expected region")
    private String region;

    @Option(names = "--account", description = "Expected account id")
    private String account;

    @Override
    public Integer call() {
        if (parent != null) {
            parent.configureLogging();
        }

        try {
            Arn parsed = ArnValidator.verify(arn);
            if (partition != null) {
                ArnValidator.verifyPartition(arn, partition);
            }
            if (service != null) {
                ArnValidator.verifyService(arn, service);
            }
            if (region != null) {
                ArnValidator.verifyRegion(arn, region);
            }
            if (account != null) {
                ArnValidator.verifyAccountId(arn, account);
            }
            System.out.printf("Valid ARN: partition=%s service=%s region=%s account=%s resource=%s%n",
                parsed.partition(), parsed.service(), parsed.region(), parsed.accountId(), parsed.resource());
            return 0;
        } catch (ArnException e) {
            log.debug("ARN rejected ({}): {}", e.getKind(), arn);
            System.err.println("Invalid ARN (" + e.getKind() + "): " + e.getMessage());
            return 1;
        }
    }
}
