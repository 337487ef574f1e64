package com.pgstash.quarkusroot.validator;

import com.pgstash.configuration.properties.predefined.PgStashProperties;
import com.pgstash.orchestration.util.ShellUtils;
import com.pgstash.postgres.util.ConnInfoUtils;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.regex.Pattern;

@Slf4j
@ApplicationScoped
public class ServersConfigurationValidator implements ConfigurationValidator {
    private static final Pattern SLOT_NAME_PATTERN = Pattern.compile("[a-z0-9_]+");

    @Inject
    PgStashProperties pgStashProperties;

    @Override
    public boolean validate() {
        boolean flag = true;
        for (Map.Entry<String, PgStashProperties.ServerProperties> entry : pgStashProperties.servers().entrySet()) {
            if (!validateServer(entry.getKey(), entry.getValue())) {
                flag = false;
            }
        }
        return flag;
    }

    private boolean validateServer(String serverName, PgStashProperties.ServerProperties server) {
        boolean flag = true;

        if (!isValidConnInfo(serverName, "conninfo", server.conninfo())) {
            flag = false;
        }
        if (server.streamingConninfo().isPresent() && !isValidConnInfo(serverName, "streaming-conninfo", server.streamingConninfo().get())) {
            flag = false;
        }

        if (server.sshCommand().isPresent()) {
            try {
                ShellUtils.split(server.sshCommand().get());
            } catch (IllegalArgumentException e) {
                log.error("Invalid configuration. ssh-command of server {} can not be parsed: {}", serverName, e.getMessage());
                flag = false;
            }
        }

        if (server.bandwidthLimit().isPresent() && server.bandwidthLimit().getAsInt() < 0) {
            log.error("Invalid configuration. bandwidth-limit of server {} must not be negative.", serverName);
            flag = false;
        }

        if (server.slotName().isPresent() && !SLOT_NAME_PATTERN.matcher(server.slotName().get()).matches()) {
            log.error("Invalid configuration. slot-name of server {} may only contain lower case letters, numbers and the underscore character.", serverName);
            flag = false;
        }

        if (!server.archiver() && !server.streamingArchiver()) {
            log.warn("Server {} has neither archiver nor streaming-archiver enabled. Its backups will not be recoverable.", serverName);
        }

        return flag;
    }

    private static boolean isValidConnInfo(String serverName, String key, String conninfo) {
        try {
            ConnInfoUtils.parse(conninfo);
            return true;
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration. {} of server {} can not be parsed: {}", key, serverName, e.getMessage());
            return false;
        }
    }
}
