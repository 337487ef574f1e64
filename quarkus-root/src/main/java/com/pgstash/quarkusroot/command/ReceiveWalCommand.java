package com.pgstash.quarkusroot.command;

import com.pgstash.orchestration.service.api.WalArchivingService;
import jakarta.inject.Inject;
import picocli.CommandLine;

@CommandLine.Command(name = "receive-wal", description = "Stream WAL of a server in the foreground.")
public class ReceiveWalCommand extends AbstractPgStashCommand {

    @CommandLine.Mixin
    ServerNameParameter server = new ServerNameParameter();

    @Inject
    WalArchivingService walArchivingService;

    @Override
    protected int execute() {
        walArchivingService.receiveWal(server.getServerName());
        return ExitCodes.OK;
    }
}
