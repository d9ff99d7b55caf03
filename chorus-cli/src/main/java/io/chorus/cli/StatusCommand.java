package io.chorus.cli;

import io.chorus.core.config.ConfigPaths;
import io.chorus.core.config.model.ChorusConfig;
import io.chorus.core.config.model.ProviderConfig;
import java.nio.file.Files;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "status", description = "Show configuration and participant status")
public final class StatusCommand implements Callable<Integer> {
    private final CliContext context;

    public StatusCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            ChorusConfig config = context.configService().applyEnvironment(
                context.configService().load(context.configPath()),
                context.environment()
            );
            System.out.println("Config path: " + context.configPath());
            System.out.println("Config exists: " + Files.exists(context.configPath()));
            System.out.println("Log directory: " + ConfigPaths.resolveLogDir(config.conversation().logDir()));
            System.out.println("Default topic: " + config.conversation().topic());
            System.out.println(String.format(Locale.ROOT, "Token limit: %,d", config.conversation().tokenLimit()));
            for (ProviderConfig provider : config.allProviders()) {
                System.out.println(String.format(
                    Locale.ROOT,
                    "%s (%s) configured: %s, $%.2f / $%.2f per 1M tokens",
                    provider.participant(),
                    provider.model(),
                    provider.configured(),
                    provider.inputCostPerMillion(),
                    provider.outputCostPerMillion()
                ));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status command failed: " + e.getMessage());
            return 1;
        }
    }
}
