package com.praier.monitor.orchestrator;

import picocli.CommandLine;

/**
 * Main entry point for the Praier pull request monitor.
 *
 * <p>Usage:
 * <pre>
 *   java -jar praier.jar monitor                   # configuration from the environment
 *   java -jar praier.jar -c praier.yaml monitor    # configuration from a YAML file
 *   java -jar praier.jar status
 *   java -jar praier.jar generate-config -o praier.yaml
 *   java -jar praier.jar test-connection owner/repo --server default
 * </pre>
 */
public class MonitorApp {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PraierCommand()).execute(args);
        System.exit(exitCode);
    }
}
