package com.pgstash.quarkusroot.command;

import com.pgstash.orchestration.service.api.WalArchivingService;
import jakarta.inject.Inject;
import picocli.CommandLine;

@CommandLine.Command(name = "archive-wal", description = "Move incoming WAL files of a server into the archive.")
public class ArchiveWalCommand extends AbstractPgStashCommand {

    @CommandLine.Mixin
    ServerNameParameter server = new ServerNameParameter();

    @Inject
    WalArchivingService walArchivingService;

    @Override
    protected int execute() {
        int archived = walArchivingService.archiveWal(server.getServerName(), verbose.length > 0);
        if (verbose.length > 0 || archived > 0) {
            getOut().printf("Archived %d WAL file(s) for server %s%n", archived, server.getServerName());
        }
        return ExitCodes.OK;
    }
}
