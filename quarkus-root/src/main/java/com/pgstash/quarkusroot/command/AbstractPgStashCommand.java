package com.pgstash.quarkusroot.command;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Base of every subcommand: applies {@code -v/-q} to the {@code com.pgstash} loggers, runs the command
 * and turns any exception into exit code 1.
 */
@Slf4j
public abstract class AbstractPgStashCommand implements Callable<Integer> {
    public static final String LOGGER_NAME = "com.pgstash";

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Increase output verbosity, can be repeated.")
    boolean[] verbose = new boolean[0];

    @CommandLine.Option(names = {"-q", "--quiet"}, description = "Decrease output verbosity, can be repeated.")
    boolean[] quiet = new boolean[0];

    @CommandLine.Option(names = "--help", usageHelp = true, description = "Show this help message and exit.")
    boolean helpRequested;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    protected abstract int execute() throws Exception;

    /**
     * Level of the {@code com.pgstash} loggers when neither {@code -v} nor {@code -q} is given.
     */
    protected Level getDefaultLogLevel() {
        return Level.INFO;
    }

    @Override
    public Integer call() {
        Logger.getLogger(LOGGER_NAME).setLevel(resolveLogLevel(getDefaultLogLevel(), verbose.length - quiet.length));
        try {
            return execute();
        } catch (Exception e) {
            log.error("{} failed", spec == null ? getClass().getSimpleName() : spec.name(), e);
            getErr().println("ERROR: " + e.getMessage());
            return ExitCodes.FAILURE;
        }
    }

    protected PrintWriter getOut() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter getErr() {
        return spec.commandLine().getErr();
    }

    static Level resolveLogLevel(Level defaultLevel, int verbosity) {
        Level[] levels = {Level.OFF, Level.SEVERE, Level.WARNING, Level.INFO, Level.FINE};
        int index = 0;
        for (int i = 0; i < levels.length; i++) {
            if (levels[i].equals(defaultLevel)) {
                index = i;
            }
        }
        index = Math.max(0, Math.min(levels.length - 1, index + verbosity));
        return levels[index];
    }
}
