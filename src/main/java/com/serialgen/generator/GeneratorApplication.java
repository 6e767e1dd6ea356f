package com.serialgen.generator;

import com.serialgen.generator.cli.DescribeCommand;
import picocli.CommandLine;

/**
 * Main entry point for the element tree inspector.
 */
public class GeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new DescribeCommand()).execute(args);
        System.exit(exitCode);
    }
}
