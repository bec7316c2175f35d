package com.dbkeeper.server.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;
import lombok.EqualsAndHashCode;

@EqualsAndHashCode(callSuper = true)
@Data
@TableName("scheduled_job")
public class ScheduledJobEntity extends BaseEntity {

    @TableId(type = IdType.AUTO)
    private Long scheduledJobId;

    // BACKUP or MAINTENANCE, see JobKindEnum
    private String jobKind;

    // FULL/DIFF/LOG for backups, INDEX/INTEGRITY/STATS for maintenance
    private String jobSubType;

    private String cronExpression;

    // database name
    private String resourceKey;

    private Boolean enabled;

    // json object, maintenance thresholds
    private String jobOptions;
}
