package com.dbkeeper.server.service.driver;

import com.dbkeeper.server.enums.BackupTypeEnum;
import com.dbkeeper.server.enums.MaintenanceTypeEnum;
import com.dbkeeper.server.exception.BusinessException;
import com.dbkeeper.server.model.internal.BackupResult;
import com.dbkeeper.server.model.internal.MaintenanceResult;

import java.nio.file.Path;
import java.util.Map;

/**
 * Runs backup and maintenance commands against the database server. Calls
 * block until the server finishes and are bounded by the driver's own timeout.
 */
public interface DatabaseDriver {

    BackupResult runBackup(
            String databaseName,
            BackupTypeEnum backupType,
            Path targetFile) throws BusinessException;

    MaintenanceResult runMaintenance(
            String databaseName,
            MaintenanceTypeEnum maintenanceType,
            Map<String, Object> options) throws BusinessException;
}
