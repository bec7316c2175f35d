package com.dbkeeper.server.service.db;

import com.baomidou.mybatisplus.extension.service.IService;
import com.dbkeeper.server.model.entity.JobRunEntity;

public interface IJobRunService extends IService<JobRunEntity> {
}
