package com.dbkeeper.server.model.internal;

import lombok.Data;

import java.util.List;

@Data
public class RetentionPlan {

    private final List<BackupFile> keep;

    private final List<BackupFile> delete;

    public RetentionPlan(List<BackupFile> keep, List<BackupFile> delete) {
        this.keep = List.copyOf(keep);
        this.delete = List.copyOf(delete);
    }

    public long getKeepSizeBytes() {
        return this.keep.stream().mapToLong(BackupFile::getSizeBytes).sum();
    }

    public long getDeleteSizeBytes() {
        return this.delete.stream().mapToLong(BackupFile::getSizeBytes).sum();
    }

    public double getKeepSizeMb() {
        return this.getKeepSizeBytes() / (1024.0 * 1024.0);
    }

    public double getDeleteSizeMb() {
        return this.getDeleteSizeBytes() / (1024.0 * 1024.0);
    }
}
