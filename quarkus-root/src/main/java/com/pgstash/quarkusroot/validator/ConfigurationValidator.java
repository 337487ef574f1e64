package com.pgstash.quarkusroot.validator;

public interface ConfigurationValidator {

    /**
     * Logs every problem found.
     *
     * @return false if the configuration can not be used
     */
    boolean validate();
}
