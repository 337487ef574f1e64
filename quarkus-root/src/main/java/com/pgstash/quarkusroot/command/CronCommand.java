package com.pgstash.quarkusroot.command;

import com.pgstash.catalog.exception.LockFileBusyException;
import com.pgstash.orchestration.service.api.CronService;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;

@Slf4j
@CommandLine.Command(name = "cron", description = "Run maintenance of every configured server.")
public class CronCommand extends AbstractPgStashCommand {

    @Inject
    CronService cronService;

    @Override
    protected int execute() {
        try {
            cronService.cron(verbose.length > 0);
        } catch (LockFileBusyException e) {
            log.debug("Cron lock is busy", e);
            getErr().println("ERROR: " + e.getMessage());
            return ExitCodes.LOCK_BUSY;
        }
        return ExitCodes.OK;
    }
}
