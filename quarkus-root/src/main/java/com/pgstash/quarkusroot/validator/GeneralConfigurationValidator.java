package com.pgstash.quarkusroot.validator;

import com.pgstash.configuration.properties.predefined.PgStashProperties;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@ApplicationScoped
public class GeneralConfigurationValidator implements ConfigurationValidator {
    // S3 rejects every part but the last one below 5 MiB
    public static final long MIN_CHUNK_SIZE = 5L * 1024 * 1024;

    @Inject
    PgStashProperties pgStashProperties;

    @Override
    public boolean validate() {
        boolean flag = true;
        if (pgStashProperties.copy().parallelJobs() < 1) {
            log.error("Invalid configuration. pgstash.copy.parallel-jobs must be at least 1.");
            flag = false;
        }
        if (pgStashProperties.cloud().chunkSize() < MIN_CHUNK_SIZE) {
            log.error("Invalid configuration. pgstash.cloud.chunk-size must be at least {} bytes.", MIN_CHUNK_SIZE);
            flag = false;
        }
        if (pgStashProperties.lock().timeout().isNegative() || pgStashProperties.lock().retryInterval().isNegative()) {
            log.error("Invalid configuration. Lock timeout and retry interval must not be negative.");
            flag = false;
        }
        return flag;
    }
}
