package com.pgstash.quarkusroot.command;

import picocli.CommandLine;

/**
 * Mixin for commands working on one configured server.
 */
public class ServerNameParameter {

    @CommandLine.Parameters(index = "0", paramLabel = "SERVER_NAME", description = "Name of a server configured under pgstash.servers.")
    String serverName;

    public String getServerName() {
        return serverName;
    }
}
