package com.dbkeeper.server.model.internal;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SummarySettings {

    private boolean enabled;

    private LocalTime summaryTime;
}
