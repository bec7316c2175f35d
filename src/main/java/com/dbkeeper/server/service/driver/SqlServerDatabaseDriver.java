package com.dbkeeper.server.service.driver;

import com.dbkeeper.server.enums.BackupTypeEnum;
import com.dbkeeper.server.enums.MaintenanceTypeEnum;
import com.dbkeeper.server.exception.BusinessException;
import com.dbkeeper.server.exception.ValidationException;
import com.dbkeeper.server.model.internal.BackupResult;
import com.dbkeeper.server.model.internal.MaintenanceResult;
import com.dbkeeper.server.util.EntityValidationUtil;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * SQL Server over plain JDBC. Maintenance relies on the Ola Hallengren
 * procedures being installed in master.
 */
@Service
@Slf4j
public class SqlServerDatabaseDriver implements DatabaseDriver {

    private static final int DEFAULT_FRAGMENTATION_LEVEL_1 = 5;

    private static final int DEFAULT_FRAGMENTATION_LEVEL_2 = 30;

    @Value("${dbkeeper.server.sqlserver.url}")
    private String url;

    @Value("${dbkeeper.server.sqlserver.username}")
    private String username;

    @Value("${dbkeeper.server.sqlserver.password}")
    private String password;

    @Value("${dbkeeper.server.sqlserver.backupTimeoutSec:7200}")
    private int backupTimeoutSec;

    @Value("${dbkeeper.server.sqlserver.maintenanceTimeoutSec:14400}")
    private int maintenanceTimeoutSec;

    @Value("${dbkeeper.server.sqlserver.compression:false}")
    private boolean compression;

    @Value("${dbkeeper.server.sqlserver.checksum:true}")
    private boolean checksum;

    @Override
    public BackupResult runBackup(
            String databaseName,
            BackupTypeEnum backupType,
            Path targetFile) throws BusinessException {
        EntityValidationUtil.isDatabaseNameValid(databaseName);
        if (ObjectUtils.anyNull(backupType, targetFile)) {
            throw new ValidationException("runBackup failed. backupType or targetFile is null");
        }
        String backupCommand = buildBackupCommand(
                databaseName, backupType, targetFile, this.compression, this.checksum);
        Instant startedAt = Instant.now();
        try (Connection connection = this.getConnection()) {
            this.createFolder(connection, targetFile.getParent());
            try (Statement statement = connection.createStatement()) {
                statement.setQueryTimeout(this.backupTimeoutSec);
                log.info("runBackup start. database is {}, command is {}", databaseName, backupCommand);
                statement.execute(backupCommand);
            }
            Duration duration = Duration.between(startedAt, Instant.now());
            long sizeBytes = this.getLastBackupSize(connection, databaseName, targetFile);
            return new BackupResult(targetFile.toString(), sizeBytes, duration);
        } catch (SQLException e) {
            throw new BusinessException("runBackup failed. database is %s, backupType is %s"
                    .formatted(databaseName, backupType), e);
        }
    }

    @Override
    public MaintenanceResult runMaintenance(
            String databaseName,
            MaintenanceTypeEnum maintenanceType,
            Map<String, Object> options) throws BusinessException {
        EntityValidationUtil.isDatabaseNameValid(databaseName);
        if (ObjectUtils.isEmpty(maintenanceType)) {
            throw new ValidationException("runMaintenance failed. maintenanceType is null");
        }
        Instant startedAt = Instant.now();
        try (Connection connection = this.getConnection()) {
            switch (maintenanceType) {
                case INDEX -> {
                    try (PreparedStatement statement = connection.prepareStatement("""
                            EXECUTE dbo.IndexOptimize
                                @Databases = ?,
                                @FragmentationLow = NULL,
                                @FragmentationMedium = 'INDEX_REORGANIZE',
                                @FragmentationHigh = 'INDEX_REBUILD_ONLINE,INDEX_REBUILD_OFFLINE',
                                @FragmentationLevel1 = ?,
                                @FragmentationLevel2 = ?,
                                @LogToTable = 'Y'""")) {
                        statement.setQueryTimeout(this.maintenanceTimeoutSec);
                        statement.setString(1, databaseName);
                        statement.setInt(2, MapUtils.getIntValue(
                                options, "fragmentationLevel1", DEFAULT_FRAGMENTATION_LEVEL_1));
                        statement.setInt(3, MapUtils.getIntValue(
                                options, "fragmentationLevel2", DEFAULT_FRAGMENTATION_LEVEL_2));
                        statement.execute();
                    }
                }
                case INTEGRITY -> {
                    try (PreparedStatement statement = connection.prepareStatement("""
                            EXECUTE dbo.DatabaseIntegrityCheck
                                @Databases = ?,
                                @LogToTable = 'Y'""")) {
                        statement.setQueryTimeout(this.maintenanceTimeoutSec);
                        statement.setString(1, databaseName);
                        statement.execute();
                    }
                }
                case STATS -> {
                    try (Statement statement = connection.createStatement()) {
                        statement.setQueryTimeout(this.maintenanceTimeoutSec);
                        statement.execute("USE %s; EXEC sp_updatestats;".formatted(quoteName(databaseName)));
                    }
                }
            }
        } catch (SQLException e) {
            throw new BusinessException("runMaintenance failed. database is %s, maintenanceType is %s"
                    .formatted(databaseName, maintenanceType), e);
        }
        return new MaintenanceResult(
                Duration.between(startedAt, Instant.now()),
                maintenanceType.getCompletedMessage());
    }

    static String buildBackupCommand(
            String databaseName,
            BackupTypeEnum backupType,
            Path targetFile,
            boolean compression,
            boolean checksum) {
        String disk = "N'%s'".formatted(targetFile.toString().replace("'", "''"));
        List<String> withOptions = new ArrayList<>();
        String command = switch (backupType) {
            case FULL -> "BACKUP DATABASE %s TO DISK = %s".formatted(quoteName(databaseName), disk);
            case DIFF -> {
                withOptions.add("DIFFERENTIAL");
                yield "BACKUP DATABASE %s TO DISK = %s".formatted(quoteName(databaseName), disk);
            }
            case LOG -> "BACKUP LOG %s TO DISK = %s".formatted(quoteName(databaseName), disk);
        };
        // COMPRESSION is not available on Express editions
        if (compression) {
            withOptions.add("COMPRESSION");
        }
        if (checksum) {
            withOptions.add("CHECKSUM");
        }
        withOptions.add("INIT");
        return command + " WITH " + String.join(", ", withOptions);
    }

    private Connection getConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(this.url, this.username, this.password);
        connection.setAutoCommit(true);
        return connection;
    }

    private void createFolder(Connection connection, Path folder) throws SQLException {
        if (ObjectUtils.isEmpty(folder)) {
            return;
        }
        try (PreparedStatement statement = connection.prepareStatement("EXEC master.dbo.xp_create_subdir ?")) {
            statement.setQueryTimeout(60);
            statement.setString(1, folder.toString());
            statement.execute();
        }
    }

    private long getLastBackupSize(Connection connection, String databaseName, Path targetFile) {
        try (PreparedStatement statement = connection.prepareStatement("""
                SELECT TOP 1 backup_size
                FROM msdb.dbo.backupset
                WHERE database_name = ?
                ORDER BY backup_finish_date DESC""")) {
            statement.setQueryTimeout(60);
            statement.setString(1, databaseName);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (resultSet.next()) {
                    return resultSet.getLong(1);
                }
            }
        } catch (SQLException e) {
            log.warn("getLastBackupSize failed. fall back to file size. database is {}", databaseName, e);
        }
        try {
            return Files.exists(targetFile) ? Files.size(targetFile) : 0L;
        } catch (IOException e) {
            log.warn("getLastBackupSize failed. can't read file size. file is {}", targetFile, e);
            return 0L;
        }
    }

    // [name] with closing brackets doubled
    static String quoteName(String databaseName) {
        return "[" + databaseName.replace("]", "]]") + "]";
    }
}
