package com.dbkeeper.server.model.internal;

import com.dbkeeper.server.enums.SyncModeEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncSettings {

    private boolean enabled;

    private SyncModeEnum mode;

    // daily fire time in SCHEDULED mode
    private LocalTime syncTime;

    // delay after the last backup completion in AFTER_BACKUPS mode
    private int bufferMinutes;

    private String backupPath;
}
