package com.pgstash.orchestration.model;

import lombok.Value;

@Value
public class UploadedPart {
    int partNumber;
    String eTag;
}
