package com.dbkeeper.server.service.db.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.plugins.pagination.Page;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.dbkeeper.server.enums.DeletedEnum;
import com.dbkeeper.server.enums.JobRunStatusEnum;
import com.dbkeeper.server.exception.DbException;
import com.dbkeeper.server.mapper.JobRunMapper;
import com.dbkeeper.server.model.entity.JobRunEntity;
import com.dbkeeper.server.service.db.IJobRunService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Service
@Slf4j
public class JobRunService
        extends ServiceImpl<JobRunMapper, JobRunEntity>
        implements IJobRunService {

    public JobRunEntity addJobRun(JobRunEntity jobRunEntity) throws DbException {
        jobRunEntity.setRunStatus(JobRunStatusEnum.RUNNING.name());
        boolean saved = this.save(jobRunEntity);
        if (!saved) {
            throw new DbException("addJobRun failed. can't write to database. jobId is %s"
                    .formatted(jobRunEntity.getJobId()));
        }
        return jobRunEntity;
    }

    public void updateJobRun(JobRunEntity jobRunEntity) throws DbException {
        boolean updated = this.updateById(jobRunEntity);
        if (!updated) {
            throw new DbException("updateJobRun failed. can't write to database. jobRunId is %s"
                    .formatted(jobRunEntity.getJobRunId()));
        }
    }

    public List<JobRunEntity> getByJobId(String jobId, int limit) {
        LambdaQueryWrapper<JobRunEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(JobRunEntity::getJobId, jobId);
        queryWrapper.eq(JobRunEntity::getRecordDeleted, DeletedEnum.NOT_DELETED.getCode());
        queryWrapper.orderByDesc(JobRunEntity::getJobRunId);

        return this.page(new Page<>(1, Math.max(1, limit)), queryWrapper).getRecords();
    }

    // started in [from, to)
    public List<JobRunEntity> getStartedBetween(Instant from, Instant to) {
        LambdaQueryWrapper<JobRunEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.ge(JobRunEntity::getStartedAt, Timestamp.from(from));
        queryWrapper.lt(JobRunEntity::getStartedAt, Timestamp.from(to));
        queryWrapper.eq(JobRunEntity::getRecordDeleted, DeletedEnum.NOT_DELETED.getCode());
        queryWrapper.orderByAsc(JobRunEntity::getJobRunId);

        return this.list(queryWrapper);
    }
}
