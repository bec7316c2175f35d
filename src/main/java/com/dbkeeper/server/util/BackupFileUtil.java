package com.dbkeeper.server.util;

import com.dbkeeper.server.enums.BackupTypeEnum;
import com.dbkeeper.server.exception.FileOperationException;
import com.dbkeeper.server.exception.ValidationException;
import com.dbkeeper.server.model.internal.BackupFile;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.file.PathUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Backup files are laid out as
 * {@code {root}/{FULL|DIFF|LOG}/{yyyy-MM-dd}/{db}_{TYPE}_{yyyyMMdd}_{HHmmss}.bak}.
 * Older files named {@code {db}_{TYPE}_{HHmmss}.bak} take their date from the folder.
 */
@Slf4j
public class BackupFileUtil {

    public static final String BACKUP_EXTENSION = "bak";

    private static final DateTimeFormatter FOLDER_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private static final DateTimeFormatter FILE_TIME = DateTimeFormatter.ofPattern("HHmmss");

    private static final Pattern FILE_NAME = Pattern.compile(
            "^(.+)_(FULL|DIFF|LOG)_(\\d{8})_(\\d{6})$", Pattern.CASE_INSENSITIVE);

    private static final Pattern LEGACY_FILE_NAME = Pattern.compile(
            "^(.+)_(FULL|DIFF|LOG)_(\\d{6})$", Pattern.CASE_INSENSITIVE);

    public static Path buildBackupFilePath(
            Path root,
            String databaseName,
            BackupTypeEnum backupType,
            LocalDateTime createdAt) throws ValidationException {
        if (ObjectUtils.anyNull(root, backupType, createdAt) || StringUtils.isBlank(databaseName)) {
            throw new ValidationException("buildBackupFilePath failed. " +
                    "root, databaseName, backupType or createdAt is null");
        }
        String fileName = "%s_%s_%s_%s.%s".formatted(
                databaseName,
                backupType.name(),
                createdAt.format(FILE_DATE),
                createdAt.format(FILE_TIME),
                BACKUP_EXTENSION);
        return root.resolve(backupType.name())
                .resolve(createdAt.toLocalDate().format(FOLDER_DATE))
                .resolve(fileName);
    }

    /**
     * Every recognizable backup file under root, optionally restricted to one
     * database. Files that do not follow the naming scheme are ignored.
     */
    public static List<BackupFile> listBackupFiles(
            Path root,
            String databaseName,
            ZoneId zoneId) throws FileOperationException {
        List<BackupFile> result = new ArrayList<>();
        if (ObjectUtils.isEmpty(root) || !Files.isDirectory(root)) {
            return result;
        }
        for (BackupTypeEnum backupType : BackupTypeEnum.values()) {
            Path typeFolder = root.resolve(backupType.name());
            if (!Files.isDirectory(typeFolder)) {
                continue;
            }
            for (Path dateFolder : listChildren(typeFolder)) {
                LocalDate folderDate = parseFolderDate(dateFolder);
                if (folderDate == null) {
                    continue;
                }
                for (Path file : listChildren(dateFolder)) {
                    BackupFile backupFile = parseBackupFile(file, folderDate, zoneId);
                    if (backupFile == null || backupFile.getBackupType() != backupType) {
                        continue;
                    }
                    if (StringUtils.isNotBlank(databaseName) &&
                            !databaseName.equals(backupFile.getDatabaseName())) {
                        continue;
                    }
                    result.add(backupFile);
                }
            }
        }
        return result;
    }

    public static List<String> listDatabaseNames(Path root, ZoneId zoneId) throws FileOperationException {
        TreeSet<String> names = new TreeSet<>();
        for (BackupFile backupFile : listBackupFiles(root, null, zoneId)) {
            names.add(backupFile.getDatabaseName());
        }
        return new ArrayList<>(names);
    }

    static BackupFile parseBackupFile(Path file, LocalDate folderDate, ZoneId zoneId) {
        if (!Files.isRegularFile(file) ||
                !BACKUP_EXTENSION.equalsIgnoreCase(FilenameUtils.getExtension(file.toString()))) {
            return null;
        }
        String baseName = FilenameUtils.getBaseName(file.toString());
        LocalDateTime createdAt;
        String databaseName;
        String backupType;
        try {
            Matcher matcher = FILE_NAME.matcher(baseName);
            Matcher legacyMatcher = LEGACY_FILE_NAME.matcher(baseName);
            if (matcher.matches()) {
                databaseName = matcher.group(1);
                backupType = matcher.group(2).toUpperCase(Locale.ROOT);
                createdAt = LocalDateTime.of(
                        LocalDate.parse(matcher.group(3), FILE_DATE),
                        LocalTime.parse(matcher.group(4), FILE_TIME));
            } else if (legacyMatcher.matches()) {
                databaseName = legacyMatcher.group(1);
                backupType = legacyMatcher.group(2).toUpperCase(Locale.ROOT);
                createdAt = LocalDateTime.of(folderDate, LocalTime.parse(legacyMatcher.group(3), FILE_TIME));
            } else {
                return null;
            }
        } catch (DateTimeParseException e) {
            log.debug("parseBackupFile skipped. file name has an invalid timestamp. file is {}", file);
            return null;
        }
        long sizeBytes;
        try {
            sizeBytes = Files.size(file);
        } catch (IOException e) {
            log.warn("parseBackupFile skipped. can't read file size. file is {}", file, e);
            return null;
        }
        return BackupFile.builder()
                .filePath(file.toString())
                .fileName(file.getFileName().toString())
                .databaseName(databaseName)
                .backupType(BackupTypeEnum.fromName(backupType))
                .createdAt(createdAt.atZone(zoneId).toInstant())
                .sizeBytes(sizeBytes)
                .build();
    }

    /**
     * Removes date folders left empty under each backup type folder.
     *
     * @return number of folders removed
     */
    public static int removeEmptyDateFolders(Path root) throws FileOperationException {
        int removed = 0;
        if (ObjectUtils.isEmpty(root) || !Files.isDirectory(root)) {
            return removed;
        }
        for (BackupTypeEnum backupType : BackupTypeEnum.values()) {
            Path typeFolder = root.resolve(backupType.name());
            if (!Files.isDirectory(typeFolder)) {
                continue;
            }
            for (Path dateFolder : listChildren(typeFolder)) {
                try {
                    if (Files.isDirectory(dateFolder) && PathUtils.isEmptyDirectory(dateFolder)) {
                        Files.delete(dateFolder);
                        removed++;
                    }
                } catch (IOException e) {
                    log.warn("removeEmptyDateFolders failed. folder is {}", dateFolder, e);
                }
            }
        }
        return removed;
    }

    private static LocalDate parseFolderDate(Path dateFolder) {
        if (!Files.isDirectory(dateFolder)) {
            return null;
        }
        try {
            return LocalDate.parse(dateFolder.getFileName().toString(), FOLDER_DATE);
        } catch (DateTimeParseException e) {
            log.debug("parseFolderDate skipped. folder is not a date folder. folder is {}", dateFolder);
            return null;
        }
    }

    private static List<Path> listChildren(Path folder) throws FileOperationException {
        try (Stream<Path> children = Files.list(folder)) {
            return children.sorted().toList();
        } catch (IOException e) {
            throw new FileOperationException("listChildren failed. folder is %s".formatted(folder), e);
        }
    }
}
