package com.dbkeeper.server.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.dbkeeper.server.model.entity.JobRunEntity;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface JobRunMapper extends BaseMapper<JobRunEntity> {
}
