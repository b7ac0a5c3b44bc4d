package io.cadence.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(
    name = "cadence",
    mixinStandardHelpOptions = true,
    description = "Schedules recurring jobs and one-off background tasks. Pair `cadence due` with an external timer."
)
public final class CadenceCliCommand implements Runnable {

    @Spec
    CommandSpec commandSpec;

    @Override
    public void run() {
        commandSpec.commandLine().usage(System.out);
    }
}
