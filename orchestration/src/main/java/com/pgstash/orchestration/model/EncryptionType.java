package com.pgstash.orchestration.model;

import java.util.Arrays;

/**
 * Server side encryption requested for uploaded objects.
 */
public enum EncryptionType {
    AES256("AES256"),
    AWS_KMS("aws:kms");

    private final String value;

    EncryptionType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static EncryptionType fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported encryption '" + value + "', expected AES256 or aws:kms"));
    }
}
