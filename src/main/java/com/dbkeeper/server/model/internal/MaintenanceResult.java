package com.dbkeeper.server.model.internal;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.time.Duration;

@Data
@AllArgsConstructor
public class MaintenanceResult {

    private Duration duration;

    private String message;
}
