package com.pgstash.quarkusroot;

import com.pgstash.configuration.exception.ConfigurationException;
import com.pgstash.quarkusroot.validator.ConfigurationValidator;
import io.quarkus.arc.All;
import io.quarkus.runtime.StartupEvent;
import jakarta.annotation.Priority;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import jakarta.interceptor.Interceptor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

@Slf4j
@ApplicationScoped
public class QuarkusStartupHandler {

    @Inject
    @All
    List<ConfigurationValidator> configurationValidators;

    public void startup(@Observes @Priority(Interceptor.Priority.PLATFORM_BEFORE) StartupEvent startupEvent) {
        log.debug("Checking provided configuration...");
        validateConfiguration();
        log.debug("Provided configuration is valid!");
    }

    void validateConfiguration() {
        boolean configurationValid = true;
        for (ConfigurationValidator configurationValidator : configurationValidators) {
            if (!configurationValidator.validate()) {
                configurationValid = false;
            }
        }

        if (!configurationValid) {
            log.error("CONFIGURATION INVALID. PGSTASH WILL NOT RUN!");
            throw new ConfigurationException("Provided configuration is invalid");
        }
    }
}
