package com.waveforge.dispatch.cli;

import picocli.CommandLine.Option;

/**
 * {@code --registry} option shared by every command that reads or writes the process registry.
 */
public class RegistryOption {

    @Option(names = "--registry", paramLabel = "PATH",
            description = "Registry file (default: waveforge.registry.path)")
    String path;
}
