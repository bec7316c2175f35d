package com.dbkeeper.server.service.db.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.dbkeeper.server.enums.DeletedEnum;
import com.dbkeeper.server.exception.DbException;
import com.dbkeeper.server.exception.ValidationException;
import com.dbkeeper.server.mapper.ScheduledJobMapper;
import com.dbkeeper.server.model.entity.ScheduledJobEntity;
import com.dbkeeper.server.service.db.IScheduledJobService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
public class ScheduledJobService
        extends ServiceImpl<ScheduledJobMapper, ScheduledJobEntity>
        implements IScheduledJobService {

    public ScheduledJobEntity createScheduledJob(ScheduledJobEntity scheduledJobEntity) throws DbException {
        if (ObjectUtils.isEmpty(scheduledJobEntity)) {
            throw new ValidationException("createScheduledJob failed. scheduledJobEntity is null");
        }
        if (ObjectUtils.isNotEmpty(scheduledJobEntity.getScheduledJobId())) {
            throw new ValidationException("createScheduledJob failed. should use update method. " +
                    "scheduledJobId is %s".formatted(scheduledJobEntity.getScheduledJobId()));
        }
        boolean saved = this.save(scheduledJobEntity);
        if (!saved) {
            throw new DbException("createScheduledJob failed. can't write to database.");
        }
        return scheduledJobEntity;
    }

    public ScheduledJobEntity updateScheduledJob(ScheduledJobEntity scheduledJobEntity) throws DbException {
        if (ObjectUtils.isEmpty(scheduledJobEntity) || ObjectUtils.isEmpty(scheduledJobEntity.getScheduledJobId())) {
            throw new ValidationException("updateScheduledJob failed. scheduledJobEntity or id is null");
        }
        boolean updated = this.updateById(scheduledJobEntity);
        if (!updated) {
            throw new DbException("updateScheduledJob failed. can't write to database. " +
                    "scheduledJobId is %s".formatted(scheduledJobEntity.getScheduledJobId()));
        }
        return scheduledJobEntity;
    }

    public ScheduledJobEntity getByScheduledJobId(long scheduledJobId) {
        LambdaQueryWrapper<ScheduledJobEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(ScheduledJobEntity::getScheduledJobId, scheduledJobId);
        queryWrapper.eq(ScheduledJobEntity::getRecordDeleted, DeletedEnum.NOT_DELETED.getCode());

        List<ScheduledJobEntity> dbResult = this.list(queryWrapper);
        return CollectionUtils.isEmpty(dbResult) ? null : dbResult.get(0);
    }

    public List<ScheduledJobEntity> getAllScheduledJob() {
        LambdaQueryWrapper<ScheduledJobEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(ScheduledJobEntity::getRecordDeleted, DeletedEnum.NOT_DELETED.getCode());
        queryWrapper.orderByAsc(ScheduledJobEntity::getScheduledJobId);

        return this.list(queryWrapper);
    }

    public List<ScheduledJobEntity> getEnabledScheduledJob() {
        LambdaQueryWrapper<ScheduledJobEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(ScheduledJobEntity::getEnabled, true);
        queryWrapper.eq(ScheduledJobEntity::getRecordDeleted, DeletedEnum.NOT_DELETED.getCode());
        queryWrapper.orderByAsc(ScheduledJobEntity::getScheduledJobId);

        return this.list(queryWrapper);
    }

    public List<ScheduledJobEntity> getByKindAndSubType(String jobKind, String jobSubType) {
        LambdaQueryWrapper<ScheduledJobEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(ScheduledJobEntity::getJobKind, jobKind);
        queryWrapper.eq(ScheduledJobEntity::getJobSubType, jobSubType);
        queryWrapper.eq(ScheduledJobEntity::getRecordDeleted, DeletedEnum.NOT_DELETED.getCode());

        return this.list(queryWrapper);
    }

    public void deleteScheduledJob(ScheduledJobEntity scheduledJobEntity) throws DbException {
        scheduledJobEntity.setRecordDeleted(DeletedEnum.DELETED.getCode());
        scheduledJobEntity.setEnabled(false);
        boolean updated = this.updateById(scheduledJobEntity);
        if (!updated) {
            throw new DbException("deleteScheduledJob failed. can't write to database. " +
                    "scheduledJobId is %s".formatted(scheduledJobEntity.getScheduledJobId()));
        }
    }
}
