package com.dbkeeper.server.service.driver;

import com.dbkeeper.server.exception.BusinessException;
import com.dbkeeper.server.exception.ValidationException;
import com.dbkeeper.server.model.internal.BandwidthLimit;
import com.dbkeeper.server.model.internal.SyncResult;
import com.dbkeeper.server.util.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.exec.CommandLine;
import org.apache.commons.exec.DefaultExecutor;
import org.apache.commons.exec.ExecuteException;
import org.apache.commons.exec.ExecuteWatchdog;
import org.apache.commons.exec.Executor;
import org.apache.commons.exec.PumpStreamHandler;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Map;

@Service
@Slf4j
public class BorgSyncDriver implements SyncDriver {

    private static final DateTimeFormatter ARCHIVE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");

    // borg exit code 1 means finished with warnings
    private static final int[] ACCEPTED_EXIT_VALUES = {0, 1};

    @Value("${dbkeeper.server.borg.binary:borg}")
    private String borgBinary;

    @Value("${dbkeeper.server.borg.repository}")
    private String repository;

    @Value("${dbkeeper.server.borg.passphrase}")
    private String passphrase;

    @Value("${dbkeeper.server.borg.rsh:ssh -o ServerAliveInterval=30 -o ServerAliveCountMax=10 -o TCPKeepAlive=yes}")
    private String rsh;

    @Value("${dbkeeper.server.borg.archivePrefix:dbkeeper}")
    private String archivePrefix;

    @Value("${dbkeeper.server.borg.compression:lz4}")
    private String compression;

    @Value("${dbkeeper.server.borg.createTimeoutSec:21600}")
    private long createTimeoutSec;

    @Value("${dbkeeper.server.borg.maintenanceTimeoutSec:1800}")
    private long maintenanceTimeoutSec;

    @Value("${dbkeeper.server.borg.keepDaily:7}")
    private int keepDaily;

    @Value("${dbkeeper.server.borg.keepWeekly:4}")
    private int keepWeekly;

    @Value("${dbkeeper.server.borg.keepMonthly:6}")
    private int keepMonthly;

    private final ZoneId zoneId;

    @Autowired
    public BorgSyncDriver(ZoneId zoneId) {
        this.zoneId = zoneId;
    }

    @Override
    public SyncResult sync(String backupPath, BandwidthLimit limit) throws BusinessException {
        if (StringUtils.isBlank(backupPath) || ObjectUtils.isEmpty(limit)) {
            throw new ValidationException("borg sync failed. backupPath or limit is null");
        }
        if (limit.isPaused()) {
            throw new BusinessException("borg sync failed. bandwidth limit is 0 KB/s, transfers are paused");
        }
        if (StringUtils.isAnyBlank(this.repository, this.passphrase)) {
            throw new ValidationException("borg sync failed. repository or passphrase is not configured");
        }
        Instant startedAt = Instant.now();
        String archiveName = "%s-%s".formatted(
                this.archivePrefix,
                LocalDateTime.ofInstant(startedAt, this.zoneId).format(ARCHIVE_TIME));
        // 1. create
        CommandLine create = this.borgCommand("create")
                .addArgument("--json")
                .addArgument("--compression")
                .addArgument(this.compression);
        if (!limit.isUnlimited()) {
            create.addArgument("--remote-ratelimit=" + limit.getKbs());
        }
        create.addArgument(this.repository + "::" + archiveName, false)
                .addArgument(backupPath, false);
        log.info("borg create start. archive is {}, limit is {}", archiveName, limit);
        String createOutput = this.execute(create, Duration.ofSeconds(this.createTimeoutSec));
        SyncResult syncResult = parseCreateOutput(archiveName, createOutput);
        // 2. prune and compact, a failure here keeps the archive
        CommandLine prune = this.borgCommand("prune")
                .addArgument("--keep-daily=" + this.keepDaily)
                .addArgument("--keep-weekly=" + this.keepWeekly)
                .addArgument("--keep-monthly=" + this.keepMonthly)
                .addArgument("--glob-archives=" + this.archivePrefix + "-*", false)
                .addArgument(this.repository, false);
        CommandLine compact = this.borgCommand("compact")
                .addArgument(this.repository, false);
        for (CommandLine commandLine : new CommandLine[]{prune, compact}) {
            try {
                this.execute(commandLine, Duration.ofSeconds(this.maintenanceTimeoutSec));
            } catch (BusinessException e) {
                log.warn("borg repository maintenance failed. command is {}", commandLine.getArguments()[0], e);
                syncResult.getWarnings().add(e.getDbKeeperMessage());
            }
        }
        syncResult.setDuration(Duration.between(startedAt, Instant.now()));
        return syncResult;
    }

    static SyncResult parseCreateOutput(String archiveName, String createOutput) {
        SyncResult syncResult = SyncResult.builder().archiveName(archiveName).build();
        if (StringUtils.isBlank(createOutput)) {
            return syncResult;
        }
        JsonNode stats = JsonUtil.parseCommandJsonDocument(createOutput).path("archive").path("stats");
        syncResult.setFilesTotal(stats.path("nfiles").asLong(0));
        syncResult.setBytesOriginal(stats.path("original_size").asLong(0));
        syncResult.setBytesDeduplicated(stats.path("deduplicated_size").asLong(0));
        return syncResult;
    }

    private CommandLine borgCommand(String subCommand) {
        CommandLine commandLine = new CommandLine(this.borgBinary);
        commandLine.addArgument(subCommand);
        return commandLine;
    }

    private String execute(CommandLine commandLine, Duration timeout) throws BusinessException {
        Executor executor = DefaultExecutor.builder().get();
        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        executor.setStreamHandler(new PumpStreamHandler(stdout, stderr));
        ExecuteWatchdog watchdog = ExecuteWatchdog.builder().setTimeout(timeout).get();
        executor.setWatchdog(watchdog);
        executor.setExitValues(ACCEPTED_EXIT_VALUES);
        try {
            int exitCode = executor.execute(commandLine, this.getEnv());
            if (exitCode != 0) {
                log.warn("borg finished with warnings. command is {}, stderr is {}",
                        commandLine.getArguments()[0], getStdAsString(stderr));
            }
            return getStdAsString(stdout);
        } catch (ExecuteException e) {
            if (watchdog.killedProcess()) {
                throw new BusinessException("borg %s timed out after %s"
                        .formatted(commandLine.getArguments()[0], timeout), e);
            }
            throw new BusinessException("borg %s failed. exit code is %d. stderr is %s"
                    .formatted(commandLine.getArguments()[0], e.getExitValue(), getStdAsString(stderr)), e);
        } catch (IOException e) {
            throw new BusinessException("borg %s failed before command exec."
                    .formatted(commandLine.getArguments()[0]), e);
        }
    }

    private Map<String, String> getEnv() {
        Map<String, String> result = new HashMap<>(System.getenv());
        result.put("BORG_REPO", this.repository);
        result.put("BORG_PASSPHRASE", this.passphrase);
        if (StringUtils.isNotBlank(this.rsh)) {
            result.put("BORG_RSH", this.rsh);
        }
        // never prompt, the process has no terminal
        result.put("BORG_UNKNOWN_UNENCRYPTED_REPO_ACCESS_IS_OK", "no");
        result.put("BORG_RELOCATED_REPO_ACCESS_IS_OK", "yes");
        return result;
    }

    private static String getStdAsString(ByteArrayOutputStream std) {
        return std.toString(StandardCharsets.UTF_8).trim();
    }
}
