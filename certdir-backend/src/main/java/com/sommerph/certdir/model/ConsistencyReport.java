package com.sommerph.certdir.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConsistencyReport {

    private long publishedRecords;
    private long fingerprintLinks;
    private long keyIdLinks;
    private long emailLinks;
    private Instant completedAt;

}
