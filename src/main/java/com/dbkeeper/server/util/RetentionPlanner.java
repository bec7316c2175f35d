package com.dbkeeper.server.util;

import com.dbkeeper.server.exception.ValidationException;
import com.dbkeeper.server.model.internal.BackupFile;
import com.dbkeeper.server.model.internal.RetentionPlan;
import com.dbkeeper.server.model.internal.RetentionPolicy;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Decides which backup files survive a cleanup. Side effect free, the same plan
 * serves the dry-run preview and the cleanup job.
 * <p>
 * Per database, FULL backups are ranked newest first and the first
 * {@code keepFullCount} are kept. A FULL owns every DIFF created at or after it
 * and before the next newer FULL. Kept chains keep their newest
 * {@code keepDiffPerFull} DIFFs, evicted chains go entirely. DIFFs with no FULL
 * on disk at or before them are orphans, of which the newest
 * {@code keepOrphanDiff} are kept. LOG backups are never planned for deletion.
 */
public class RetentionPlanner {

    // newest first, path as tie-break so that repeated plans are identical
    public static final Comparator<BackupFile> NEWEST_FIRST = Comparator
            .comparing(BackupFile::getCreatedAt, Comparator.reverseOrder())
            .thenComparing(BackupFile::getFilePath);

    public static RetentionPlan plan(List<BackupFile> files, RetentionPolicy policy) throws ValidationException {
        isPolicyValid(policy);
        List<BackupFile> keep = new ArrayList<>();
        List<BackupFile> delete = new ArrayList<>();
        if (CollectionUtils.isEmpty(files)) {
            return new RetentionPlan(keep, delete);
        }
        Map<String, List<BackupFile>> filesByDatabase = new TreeMap<>();
        for (BackupFile file : files) {
            if (ObjectUtils.anyNull(file.getDatabaseName(), file.getBackupType(), file.getCreatedAt())) {
                throw new ValidationException("plan retention failed. backup file is incomplete. file is %s"
                        .formatted(file));
            }
            filesByDatabase.computeIfAbsent(file.getDatabaseName(), k -> new ArrayList<>()).add(file);
        }
        for (List<BackupFile> databaseFiles : filesByDatabase.values()) {
            planDatabase(databaseFiles, policy, keep, delete);
        }
        keep.sort(NEWEST_FIRST);
        delete.sort(NEWEST_FIRST);
        return new RetentionPlan(keep, delete);
    }

    private static void planDatabase(
            List<BackupFile> databaseFiles,
            RetentionPolicy policy,
            List<BackupFile> keep,
            List<BackupFile> delete) {
        List<BackupFile> fulls = new ArrayList<>();
        List<BackupFile> diffs = new ArrayList<>();
        for (BackupFile file : databaseFiles) {
            switch (file.getBackupType()) {
                case FULL -> fulls.add(file);
                case DIFF -> diffs.add(file);
                default -> keep.add(file);
            }
        }
        fulls.sort(NEWEST_FIRST);
        diffs.sort(NEWEST_FIRST);
        // chain per FULL, in FULL rank order
        Map<BackupFile, List<BackupFile>> chains = new LinkedHashMap<>();
        fulls.forEach(full -> chains.put(full, new ArrayList<>()));
        List<BackupFile> orphans = new ArrayList<>();
        for (BackupFile diff : diffs) {
            BackupFile owner = findOwner(fulls, diff);
            if (owner == null) {
                orphans.add(diff);
            } else {
                chains.get(owner).add(diff);
            }
        }
        int rank = 0;
        for (Map.Entry<BackupFile, List<BackupFile>> chain : chains.entrySet()) {
            if (rank < policy.getKeepFullCount()) {
                keep.add(chain.getKey());
                splitNewest(chain.getValue(), policy.getKeepDiffPerFull(), keep, delete);
            } else {
                delete.add(chain.getKey());
                delete.addAll(chain.getValue());
            }
            rank++;
        }
        splitNewest(orphans, policy.getKeepOrphanDiff(), keep, delete);
    }

    // newest FULL created at or before the DIFF, fulls sorted newest first
    private static BackupFile findOwner(List<BackupFile> fulls, BackupFile diff) {
        for (BackupFile full : fulls) {
            if (!full.getCreatedAt().isAfter(diff.getCreatedAt())) {
                return full;
            }
        }
        return null;
    }

    private static void splitNewest(
            List<BackupFile> newestFirst,
            int keepCount,
            List<BackupFile> keep,
            List<BackupFile> delete) {
        for (int i = 0; i < newestFirst.size(); i++) {
            if (i < keepCount) {
                keep.add(newestFirst.get(i));
            } else {
                delete.add(newestFirst.get(i));
            }
        }
    }

    public static void isPolicyValid(RetentionPolicy policy) throws ValidationException {
        if (ObjectUtils.isEmpty(policy)) {
            throw new ValidationException("isPolicyValid failed. policy is null");
        }
        if (policy.getKeepFullCount() < 0 || policy.getKeepDiffPerFull() < 0 || policy.getKeepOrphanDiff() < 0) {
            throw new ValidationException("isPolicyValid failed. keep counts must not be negative. policy is %s"
                    .formatted(policy));
        }
    }
}
