package io.chorus.app;

import io.chorus.cli.ChorusCliCommand;
import io.chorus.cli.CliContext;
import io.chorus.cli.ConverseCommand;
import io.chorus.cli.OnboardCommand;
import io.chorus.cli.StatusCommand;
import io.chorus.core.config.ConfigPaths;
import io.chorus.core.config.ConfigService;
import io.chorus.core.participant.ParticipantRoster;
import picocli.CommandLine;

public final class ChorusApplication {

    private ChorusApplication() {
    }

    public static void main(String[] args) {
        CliContext context = new CliContext(
            new ConfigService(),
            ConfigPaths.defaultConfigPath(),
            ParticipantRoster::fromConfig,
            System.getenv()
        );

        CommandLine commandLine = new CommandLine(new ChorusCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("converse", new ConverseCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }
}
