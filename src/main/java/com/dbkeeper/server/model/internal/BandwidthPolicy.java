package com.dbkeeper.server.model.internal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BandwidthPolicy {

    private boolean enabled;

    // KB/s, null = unlimited, 0 = paused
    private Long peakLimitKBs;

    // KB/s, null = unlimited, 0 = paused
    private Long offpeakLimitKBs;

    private LocalTime peakStart;

    private LocalTime peakEnd;

    private boolean weekendUnlimited;
}
