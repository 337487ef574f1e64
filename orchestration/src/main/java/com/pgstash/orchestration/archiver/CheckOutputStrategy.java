package com.pgstash.orchestration.archiver;

import com.pgstash.orchestration.model.CheckResult;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Prints one line per check, {@code name: OK} or {@code name: FAILED (hint)}.
 */
@Slf4j
public class CheckOutputStrategy implements CheckStrategy {
    private final PrintStream out;
    private final List<CheckResult> checkResults = new ArrayList<>();

    public CheckOutputStrategy(PrintStream out) {
        this.out = out;
    }

    @Override
    public void result(String serverName, String checkName, boolean status, String hint) {
        checkResults.add(new CheckResult(serverName, checkName, status));

        if (status) {
            out.printf("\t%s: OK%n", checkName);
            log.debug("Check '{}' succeeded for server {}", checkName, serverName);
        } else if (hint != null) {
            out.printf("\t%s: FAILED (%s)%n", checkName, hint);
            log.error("Check '{}' failed for server {}: {}", checkName, serverName, hint);
        } else {
            out.printf("\t%s: FAILED%n", checkName);
            log.error("Check '{}' failed for server {}", checkName, serverName);
        }
    }

    @Override
    public List<CheckResult> getCheckResults() {
        return Collections.unmodifiableList(checkResults);
    }

    @Override
    public boolean hasError() {
        return checkResults.stream().anyMatch(result -> !result.isStatus());
    }
}
