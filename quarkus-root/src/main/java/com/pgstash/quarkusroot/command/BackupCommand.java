package com.pgstash.quarkusroot.command;

import com.pgstash.catalog.model.BackupInfo;
import com.pgstash.orchestration.service.api.BackupService;
import jakarta.inject.Inject;
import picocli.CommandLine;

@CommandLine.Command(name = "backup", description = "Take a base backup of a server.")
public class BackupCommand extends AbstractPgStashCommand {

    @CommandLine.Mixin
    ServerNameParameter server = new ServerNameParameter();

    @Inject
    BackupService backupService;

    @Override
    protected int execute() {
        BackupInfo backupInfo = backupService.backup(server.getServerName());
        getOut().printf("Backup completed: %s (%s)%n", backupInfo.getBackupId(), backupInfo.getServerName());
        return ExitCodes.OK;
    }
}
