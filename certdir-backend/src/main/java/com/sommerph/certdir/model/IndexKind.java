package com.sommerph.certdir.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum IndexKind {

    BY_FINGERPRINT("by-fpr"),
    BY_KEYID("by-keyid"),
    BY_EMAIL("by-email");

    // directory name below external/links
    private final String directoryName;

}
