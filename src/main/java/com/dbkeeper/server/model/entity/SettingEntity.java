package com.dbkeeper.server.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;
import lombok.EqualsAndHashCode;

@EqualsAndHashCode(callSuper = true)
@Data
@TableName("setting")
public class SettingEntity extends BaseEntity {

    @TableId(type = IdType.AUTO)
    private Long settingId;

    private String settingKey;

    private String settingValue;
}
