package com.dbkeeper.server.model.internal;

import com.dbkeeper.server.enums.BackupTypeEnum;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BackupFile {

    private String filePath;

    private String fileName;

    private String databaseName;

    private BackupTypeEnum backupType;

    private Instant createdAt;

    private long sizeBytes;

    public double getSizeMb() {
        return this.sizeBytes / (1024.0 * 1024.0);
    }

    @JsonIgnore
    public Path toPath() {
        return Path.of(this.filePath);
    }
}
