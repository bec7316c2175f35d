package com.dbkeeper.server.model.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetentionPolicy {

    private int keepFullCount;

    private int keepDiffPerFull;

    private int keepOrphanDiff;

    private boolean enabled;

    // cron of the cleanup system job
    private String schedule;
}
