package com.dbkeeper.server.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.sql.Timestamp;

@EqualsAndHashCode(callSuper = true)
@Data
@TableName("job_run")
public class JobRunEntity extends BaseEntity {

    @TableId(type = IdType.AUTO)
    private Long jobRunId;

    private String jobId;

    private String jobKind;

    private String resourceKey;

    private Timestamp startedAt;

    private Timestamp completedAt;

    private String runStatus;

    private Long durationMillis;

    private Long sizeBytes;

    private Integer filesAffected;

    private String errorMessage;

    // RunMetrics as json
    private String metrics;
}
