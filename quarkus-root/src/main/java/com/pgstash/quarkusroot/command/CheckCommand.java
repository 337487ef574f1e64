package com.pgstash.quarkusroot.command;

import com.pgstash.orchestration.archiver.CheckOutputStrategy;
import com.pgstash.orchestration.service.api.WalArchivingService;
import jakarta.inject.Inject;
import picocli.CommandLine;

import java.io.PrintStream;

@CommandLine.Command(name = "check", description = "Check connectivity and WAL archiving of a server.")
public class CheckCommand extends AbstractPgStashCommand {

    @CommandLine.Mixin
    ServerNameParameter server = new ServerNameParameter();

    @Inject
    WalArchivingService walArchivingService;

    PrintStream out = System.out;

    @Override
    protected int execute() {
        out.printf("Server %s:%n", server.getServerName());
        boolean ok = walArchivingService.check(server.getServerName(), new CheckOutputStrategy(out));
        return ok ? ExitCodes.OK : ExitCodes.FAILURE;
    }
}
