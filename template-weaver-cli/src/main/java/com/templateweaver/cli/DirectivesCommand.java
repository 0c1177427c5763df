package com.templateweaver.cli;

import com.templateweaver.core.directive.Directive;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

/**
 * Command to print the shorthand tag table.
 */
@Command(
    name = "directives",
    description = "List recognized shorthand tags and their canonical directive names",
    mixinStandardHelpOptions = true
)
public class DirectivesCommand implements Callable<Integer> {

    @Override
    public Integer call() {
        System.out.println("Recognized directives:");
        System.out.println();
        for (Directive directive : Directive.values()) {
            System.out.printf("  %-14s %s%n", directive.shorthandTag(), directive.canonicalName());
        }
        return 0;
    }
}
