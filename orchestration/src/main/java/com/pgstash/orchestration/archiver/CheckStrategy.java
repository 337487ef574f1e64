package com.pgstash.orchestration.archiver;

import com.pgstash.orchestration.model.CheckResult;

import java.util.List;

/**
 * Receives the outcome of every check.
 */
public interface CheckStrategy {

    /**
     * @param hint shown next to a failed check, may be null
     */
    void result(String serverName, String checkName, boolean status, String hint);

    List<CheckResult> getCheckResults();

    boolean hasError();
}
