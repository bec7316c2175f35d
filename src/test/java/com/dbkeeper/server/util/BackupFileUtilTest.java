package com.dbkeeper.server.util;

import com.dbkeeper.server.enums.BackupTypeEnum;
import com.dbkeeper.server.model.internal.BackupFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BackupFileUtilTest {

    private static final ZoneId ZONE = ZoneId.of("Europe/Istanbul");

    @TempDir
    Path root;

    private Path write(String type, String date, String name, int size) throws IOException {
        Path folder = this.root.resolve(type).resolve(date);
        Files.createDirectories(folder);
        return Files.write(folder.resolve(name), new byte[size]);
    }

    @Test
    void buildsPathUnderTypeAndDateFolders() {
        Path path = BackupFileUtil.buildBackupFilePath(
                this.root, "Sales", BackupTypeEnum.DIFF, LocalDateTime.of(2024, 3, 5, 7, 8, 9));
        assertEquals(this.root.resolve("DIFF").resolve("2024-03-05").resolve("Sales_DIFF_20240305_070809.bak"),
                path);
    }

    @Test
    void listsCurrentAndLegacyNamesAndSkipsForeignFiles() throws IOException {
        this.write("FULL", "2024-03-05", "Sales_FULL_20240305_010000.bak", 10);
        this.write("FULL", "2024-03-04", "Sales_FULL_230000.bak", 20);
        this.write("DIFF", "2024-03-05", "Hr_DIFF_20240305_120000.bak", 5);
        this.write("DIFF", "2024-03-05", "notes.txt", 1);
        this.write("DIFF", "not-a-date", "Hr_DIFF_20240305_130000.bak", 1);
        // type folder and name disagree
        this.write("LOG", "2024-03-05", "Hr_FULL_20240305_140000.bak", 1);

        List<BackupFile> all = BackupFileUtil.listBackupFiles(this.root, null, ZONE);
        assertEquals(3, all.size());

        List<BackupFile> sales = BackupFileUtil.listBackupFiles(this.root, "Sales", ZONE);
        assertEquals(2, sales.size());
        BackupFile legacy = sales.stream()
                .filter(backupFile -> backupFile.getFileName().equals("Sales_FULL_230000.bak"))
                .findFirst()
                .orElseThrow();
        assertEquals(LocalDateTime.of(2024, 3, 4, 23, 0).atZone(ZONE).toInstant(), legacy.getCreatedAt());
        assertEquals(20, legacy.getSizeBytes());

        assertEquals(List.of("Hr", "Sales"), BackupFileUtil.listDatabaseNames(this.root, ZONE));
    }

    @Test
    void databaseNamesMayContainUnderscores() throws IOException {
        Path file = this.write("FULL", "2024-03-05", "My_App_Db_FULL_20240305_010000.bak", 1);
        BackupFile backupFile = BackupFileUtil.parseBackupFile(file, LocalDate.of(2024, 3, 5), ZONE);
        assertNotNull(backupFile);
        assertEquals("My_App_Db", backupFile.getDatabaseName());
        assertEquals(BackupTypeEnum.FULL, backupFile.getBackupType());
    }

    @Test
    void recognizesNamesRegardlessOfCase() throws IOException {
        this.write("FULL", "2024-03-05", "Sales_full_20240305_010000.BAK", 10);
        this.write("DIFF", "2024-03-05", "Hr_Diff_120000.bak", 5);

        List<BackupFile> all = BackupFileUtil.listBackupFiles(this.root, null, ZONE);

        assertEquals(2, all.size());
        BackupFile full = all.stream()
                .filter(backupFile -> backupFile.getDatabaseName().equals("Sales"))
                .findFirst()
                .orElseThrow();
        assertEquals(BackupTypeEnum.FULL, full.getBackupType());
        BackupFile legacyDiff = all.stream()
                .filter(backupFile -> backupFile.getDatabaseName().equals("Hr"))
                .findFirst()
                .orElseThrow();
        assertEquals(BackupTypeEnum.DIFF, legacyDiff.getBackupType());
        assertEquals(LocalDateTime.of(2024, 3, 5, 12, 0).atZone(ZONE).toInstant(), legacyDiff.getCreatedAt());
    }

    @Test
    void missingRootListsNothing() {
        assertTrue(BackupFileUtil.listBackupFiles(this.root.resolve("missing"), null, ZONE).isEmpty());
        assertEquals(0, BackupFileUtil.removeEmptyDateFolders(this.root.resolve("missing")));
    }

    @Test
    void removesOnlyEmptyDateFolders() throws IOException {
        this.write("FULL", "2024-03-05", "Sales_FULL_20240305_010000.bak", 1);
        Files.createDirectories(this.root.resolve("FULL").resolve("2024-03-04"));
        Files.createDirectories(this.root.resolve("LOG").resolve("2024-03-01"));

        assertEquals(2, BackupFileUtil.removeEmptyDateFolders(this.root));
        assertTrue(Files.exists(this.root.resolve("FULL").resolve("2024-03-05")));
        assertFalse(Files.exists(this.root.resolve("FULL").resolve("2024-03-04")));
        assertFalse(Files.exists(this.root.resolve("LOG").resolve("2024-03-01")));
    }
}
