package com.dbkeeper.server.model.internal;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Instant;

@Data
@AllArgsConstructor
public class BackupCompletedEvent {

    private String jobId;

    private String resourceKey;

    private Instant completedAt;
}
