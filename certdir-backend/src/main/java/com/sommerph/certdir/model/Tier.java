package com.sommerph.certdir.model;

public enum Tier {

    // complete record including unverified user ids, internal only
    FULL,

    // suspicious records, never indexed or served
    QUARANTINED,

    // the record served to the public
    PUBLISHED

}
