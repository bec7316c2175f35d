package com.dbkeeper.server.model.internal;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Duration;

@Data
@AllArgsConstructor
public class BackupResult {

    private String filePath;

    private long sizeBytes;

    private Duration duration;
}
