package io.cadence.app;

import io.cadence.cli.AtCommand;
import io.cadence.cli.CadenceCliCommand;
import io.cadence.cli.CancelCommand;
import io.cadence.cli.ClearCommand;
import io.cadence.cli.CliContext;
import io.cadence.cli.DueCommand;
import io.cadence.cli.ListCommand;
import io.cadence.cli.PendingCommand;
import io.cadence.cli.RemoveCommand;
import io.cadence.cli.RunCommand;
import io.cadence.cli.ScheduleCommand;
import io.cadence.core.config.ConfigPaths;
import io.cadence.core.config.ConfigService;
import io.cadence.core.config.model.CadenceConfig;
import io.cadence.core.detached.DetachedScheduler;
import io.cadence.core.detached.ProcessLauncher;
import io.cadence.core.engine.SchedulerEngine;
import io.cadence.core.job.FileJobStore;
import io.cadence.core.schedule.OccurrenceCalculator;
import io.cadence.core.time.TimeExpressionParser;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

public final class CadenceApplication {
    private static final Logger LOG = LoggerFactory.getLogger(CadenceApplication.class);

    private CadenceApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();
        CadenceConfig config = loadConfig(configService);
        ZoneId zone = resolveZone(config);
        Clock clock = Clock.system(zone);

        Path storePath = ConfigPaths.resolve(config.store().path(), "jobs.json");
        SchedulerEngine engine = new SchedulerEngine(
            new FileJobStore(storePath),
            new OccurrenceCalculator(zone),
            config.dispatch().toDispatcher(),
            clock
        );
        DetachedScheduler detachedScheduler = new DetachedScheduler(
            ConfigPaths.resolve(config.detached().spoolDir(), "detached"),
            config.detached().javaLauncher(),
            config.dispatch(),
            ProcessLauncher.background(),
            new TimeExpressionParser(zone),
            clock
        );
        LOG.debug("Using job store {} in zone {}", storePath, zone);

        CliContext context = new CliContext(engine, detachedScheduler, clock, zone);

        CommandLine commandLine = new CommandLine(new CadenceCliCommand());
        commandLine.addSubcommand("schedule", new ScheduleCommand(context));
        commandLine.addSubcommand("list", new ListCommand(context));
        commandLine.addSubcommand("remove", new RemoveCommand(context));
        commandLine.addSubcommand("run", new RunCommand(context));
        commandLine.addSubcommand("clear", new ClearCommand(context));
        commandLine.addSubcommand("due", new DueCommand(context));
        commandLine.addSubcommand("at", new AtCommand(context));
        commandLine.addSubcommand("pending", new PendingCommand(context));
        commandLine.addSubcommand("cancel", new CancelCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    private static CadenceConfig loadConfig(ConfigService configService) {
        Path configPath = ConfigPaths.defaultConfigPath();
        try {
            return configService.load(configPath);
        } catch (Exception e) {
            LOG.warn("Failed to load config {}, using defaults: {}", configPath, e.getMessage());
            return CadenceConfig.defaults();
        }
    }

    private static ZoneId resolveZone(CadenceConfig config) {
        try {
            return config.zone();
        } catch (IllegalArgumentException e) {
            LOG.warn("{}, using system default", e.getMessage());
            return ZoneId.systemDefault();
        }
    }
}
