package com.pgstash.quarkusroot;

import com.pgstash.quarkusroot.command.ArchiveWalCommand;
import com.pgstash.quarkusroot.command.BackupCommand;
import com.pgstash.quarkusroot.command.CheckCommand;
import com.pgstash.quarkusroot.command.CloudBackupCommand;
import com.pgstash.quarkusroot.command.CronCommand;
import com.pgstash.quarkusroot.command.ReceiveWalCommand;
import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine;

@TopCommand
@CommandLine.Command(
        name = "pgstash",
        mixinStandardHelpOptions = true,
        versionProvider = PgStashCommand.VersionProvider.class,
        description = "Backup and WAL archiving for PostgreSQL servers.",
        subcommands = {
                CloudBackupCommand.class,
                BackupCommand.class,
                ArchiveWalCommand.class,
                ReceiveWalCommand.class,
                CheckCommand.class,
                CronCommand.class
        }
)
public class PgStashCommand implements Runnable {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    public static class VersionProvider implements CommandLine.IVersionProvider {
        public static final String UNKNOWN_VERSION = "unknown";

        @Override
        public String[] getVersion() {
            String version = PgStashCommand.class.getPackage().getImplementationVersion();
            return new String[]{"pgstash " + (version == null ? UNKNOWN_VERSION : version)};
        }
    }
}
