package com.dbkeeper.server.util;

import com.dbkeeper.server.enums.BackupTypeEnum;
import com.dbkeeper.server.enums.JobKindEnum;
import com.dbkeeper.server.enums.MaintenanceTypeEnum;
import com.dbkeeper.server.enums.ScheduleTypeEnum;
import com.dbkeeper.server.exception.DbKeeperException;
import com.dbkeeper.server.exception.ValidationException;
import com.dbkeeper.server.model.api.job.BulkCreateJobRequest;
import com.dbkeeper.server.model.api.job.CreateJobRequest;
import com.dbkeeper.server.model.api.job.StaggerPreviewRequest;
import com.dbkeeper.server.model.api.job.UpdateJobRequest;
import com.dbkeeper.server.model.internal.BandwidthPolicy;
import com.dbkeeper.server.model.internal.SyncSettings;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;

import java.util.regex.Pattern;

public class EntityValidationUtil {

    // SQL Server identifier, bracket-escaped by the driver
    private static final Pattern DATABASE_NAME = Pattern.compile("^[A-Za-z0-9_\\-. ]{1,128}$");

    public static void isCreateJobRequestValid(CreateJobRequest createJobRequest) throws ValidationException {
        if (ObjectUtils.isEmpty(createJobRequest)) {
            throw new ValidationException("isCreateJobRequestValid failed. createJobRequest is null");
        }
        if (StringUtils.isAnyBlank(
                createJobRequest.getJobKind(),
                createJobRequest.getJobSubType(),
                createJobRequest.getCronExpression(),
                createJobRequest.getDatabaseName())) {
            throw new ValidationException("isCreateJobRequestValid failed. " +
                    "jobKind, jobSubType, cronExpression or databaseName is null. " +
                    "createJobRequest is %s".formatted(createJobRequest));
        }
        JobKindEnum jobKindEnum = isStoredJobKindValid(createJobRequest.getJobKind());
        isJobSubTypeValid(jobKindEnum, createJobRequest.getJobSubType());
        isDatabaseNameValid(createJobRequest.getDatabaseName());
        isJobOptionsValid(createJobRequest.getJobOptions());
        createJobRequest.setJobKindEnum(jobKindEnum);
        if (ObjectUtils.isEmpty(createJobRequest.getEnabled())) {
            createJobRequest.setEnabled(true);
        }
    }

    public static void isUpdateJobRequestValid(UpdateJobRequest updateJobRequest) throws ValidationException {
        if (ObjectUtils.isEmpty(updateJobRequest)) {
            throw new ValidationException("isUpdateJobRequestValid failed. updateJobRequest is null");
        }
        if (StringUtils.isBlank(updateJobRequest.getJobId())) {
            throw new ValidationException("isUpdateJobRequestValid failed. jobId is null");
        }
        if (ObjectUtils.allNull(
                updateJobRequest.getCronExpression(),
                updateJobRequest.getEnabled(),
                updateJobRequest.getJobSubType(),
                updateJobRequest.getJobOptions())) {
            throw new ValidationException("isUpdateJobRequestValid failed. nothing to update. " +
                    "jobId is %s".formatted(updateJobRequest.getJobId()));
        }
        updateJobRequest.setJobIdInner(isStoredJobIdValid(updateJobRequest.getJobId()));
        isJobOptionsValid(updateJobRequest.getJobOptions());
    }

    public static void isBulkCreateJobRequestValid(
            BulkCreateJobRequest bulkCreateJobRequest) throws ValidationException {
        if (ObjectUtils.isEmpty(bulkCreateJobRequest)) {
            throw new ValidationException("isBulkCreateJobRequestValid failed. bulkCreateJobRequest is null");
        }
        if (StringUtils.isAnyBlank(
                bulkCreateJobRequest.getJobKind(),
                bulkCreateJobRequest.getJobSubType(),
                bulkCreateJobRequest.getScheduleType())) {
            throw new ValidationException("isBulkCreateJobRequestValid failed. " +
                    "jobKind, jobSubType or scheduleType is null");
        }
        if (CollectionUtils.isEmpty(bulkCreateJobRequest.getDatabaseNames())) {
            throw new ValidationException("isBulkCreateJobRequestValid failed. databaseNames is empty");
        }
        if (ObjectUtils.anyNull(bulkCreateJobRequest.getStartHour(), bulkCreateJobRequest.getWindowHours())) {
            throw new ValidationException("isBulkCreateJobRequestValid failed. startHour or windowHours is null");
        }
        JobKindEnum jobKindEnum = isStoredJobKindValid(bulkCreateJobRequest.getJobKind());
        isJobSubTypeValid(jobKindEnum, bulkCreateJobRequest.getJobSubType());
        for (String databaseName : bulkCreateJobRequest.getDatabaseNames()) {
            isDatabaseNameValid(databaseName);
        }
        isJobOptionsValid(bulkCreateJobRequest.getJobOptions());
        bulkCreateJobRequest.setJobKindEnum(jobKindEnum);
        bulkCreateJobRequest.setScheduleTypeEnum(isScheduleTypeValid(bulkCreateJobRequest.getScheduleType()));
        if (ObjectUtils.isEmpty(bulkCreateJobRequest.getSkipExisting())) {
            bulkCreateJobRequest.setSkipExisting(true);
        }
    }

    public static void isStaggerPreviewRequestValid(
            StaggerPreviewRequest staggerPreviewRequest) throws ValidationException {
        if (ObjectUtils.isEmpty(staggerPreviewRequest)) {
            throw new ValidationException("isStaggerPreviewRequestValid failed. staggerPreviewRequest is null");
        }
        if (ObjectUtils.anyNull(
                staggerPreviewRequest.getCount(),
                staggerPreviewRequest.getStartHour(),
                staggerPreviewRequest.getWindowHours())) {
            throw new ValidationException("isStaggerPreviewRequestValid failed. " +
                    "count, startHour or windowHours is null");
        }
        staggerPreviewRequest.setScheduleTypeEnum(isScheduleTypeValid(staggerPreviewRequest.getScheduleType()));
    }

    public static void isBandwidthPolicyValid(BandwidthPolicy bandwidthPolicy) throws ValidationException {
        if (ObjectUtils.isEmpty(bandwidthPolicy)) {
            throw new ValidationException("isBandwidthPolicyValid failed. bandwidthPolicy is null");
        }
        if (ObjectUtils.anyNull(bandwidthPolicy.getPeakStart(), bandwidthPolicy.getPeakEnd())) {
            throw new ValidationException("isBandwidthPolicyValid failed. peakStart or peakEnd is null");
        }
        if ((bandwidthPolicy.getPeakLimitKBs() != null && bandwidthPolicy.getPeakLimitKBs() < 0) ||
                (bandwidthPolicy.getOffpeakLimitKBs() != null && bandwidthPolicy.getOffpeakLimitKBs() < 0)) {
            throw new ValidationException("isBandwidthPolicyValid failed. limits must not be negative. " +
                    "bandwidthPolicy is %s".formatted(bandwidthPolicy));
        }
    }

    public static void isSyncSettingsValid(SyncSettings syncSettings) throws ValidationException {
        if (ObjectUtils.isEmpty(syncSettings)) {
            throw new ValidationException("isSyncSettingsValid failed. syncSettings is null");
        }
        if (ObjectUtils.anyNull(syncSettings.getMode(), syncSettings.getSyncTime())) {
            throw new ValidationException("isSyncSettingsValid failed. mode or syncTime is null");
        }
        if (syncSettings.getBufferMinutes() < 0) {
            throw new ValidationException("isSyncSettingsValid failed. bufferMinutes must not be negative. " +
                    "bufferMinutes is %d".formatted(syncSettings.getBufferMinutes()));
        }
    }

    public static void isDatabaseNameValid(String databaseName) throws ValidationException {
        if (StringUtils.isBlank(databaseName) || !DATABASE_NAME.matcher(databaseName).matches()) {
            throw new ValidationException("isDatabaseNameValid failed. databaseName is %s".formatted(databaseName));
        }
    }

    // stored jobs are addressed by their numeric row id
    public static Long isStoredJobIdValid(String jobId) throws ValidationException {
        if (StringUtils.isBlank(jobId)) {
            throw new ValidationException("isStoredJobIdValid failed. jobId is null");
        }
        try {
            return Long.parseLong(jobId);
        } catch (NumberFormatException e) {
            throw new ValidationException("isStoredJobIdValid failed. jobId %s is not a number".formatted(jobId));
        }
    }

    private static JobKindEnum isStoredJobKindValid(String jobKind) throws ValidationException {
        JobKindEnum jobKindEnum = JobKindEnum.fromName(jobKind);
        if (ObjectUtils.isEmpty(jobKindEnum) || jobKindEnum.isSystemJob()) {
            throw new ValidationException("isStoredJobKindValid failed. " +
                    "only BACKUP and MAINTENANCE jobs can be created. jobKind is %s".formatted(jobKind));
        }
        return jobKindEnum;
    }

    public static void isJobSubTypeValid(JobKindEnum jobKindEnum, String jobSubType) throws ValidationException {
        boolean valid = switch (jobKindEnum) {
            case BACKUP -> ObjectUtils.isNotEmpty(BackupTypeEnum.fromName(jobSubType));
            case MAINTENANCE -> ObjectUtils.isNotEmpty(MaintenanceTypeEnum.fromName(jobSubType));
            default -> true;
        };
        if (!valid) {
            throw new ValidationException("isJobSubTypeValid failed. jobSubType %s is not valid for %s"
                    .formatted(jobSubType, jobKindEnum));
        }
    }

    private static ScheduleTypeEnum isScheduleTypeValid(String scheduleType) throws ValidationException {
        ScheduleTypeEnum scheduleTypeEnum = ScheduleTypeEnum.fromName(scheduleType);
        if (ObjectUtils.isEmpty(scheduleTypeEnum)) {
            throw new ValidationException("isScheduleTypeValid failed. scheduleType is %s".formatted(scheduleType));
        }
        return scheduleTypeEnum;
    }

    private static void isJobOptionsValid(String jobOptions) throws ValidationException {
        if (StringUtils.isBlank(jobOptions)) {
            return;
        }
        try {
            JsonUtil.deserializeStringToMap(jobOptions);
        } catch (DbKeeperException e) {
            throw new ValidationException("isJobOptionsValid failed. " +
                    "jobOptions %s is not a json object".formatted(jobOptions));
        }
    }
}
