package com.dbkeeper.server.service.db;

import com.baomidou.mybatisplus.extension.service.IService;
import com.dbkeeper.server.model.entity.SettingEntity;

public interface ISettingService extends IService<SettingEntity> {
}
