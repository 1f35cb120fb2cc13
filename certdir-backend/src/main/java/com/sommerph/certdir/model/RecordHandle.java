package com.sommerph.certdir.model;

import lombok.Value;

import java.nio.file.Path;

@Value
public class RecordHandle {

    Tier tier;
    Fingerprint fingerprint;
    Path path;

    // false when the write was elided by dry run
    boolean written;

}
