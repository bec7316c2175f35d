package com.dbkeeper.server.model.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncResult {

    private String archiveName;

    private long filesTotal;

    private long bytesOriginal;

    private long bytesDeduplicated;

    private Duration duration;

    // prune or compact problems after the archive was written
    @Builder.Default
    private List<String> warnings = new ArrayList<>();
}
