package com.dbkeeper.server.service.db.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.dbkeeper.server.enums.DeletedEnum;
import com.dbkeeper.server.enums.SettingKeyEnum;
import com.dbkeeper.server.exception.DbException;
import com.dbkeeper.server.mapper.SettingMapper;
import com.dbkeeper.server.model.entity.SettingEntity;
import com.dbkeeper.server.service.db.ISettingService;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Key/value settings. Values are read on every call so a policy change takes
 * effect on the next resolve.
 */
@Service
@Slf4j
public class SettingService
        extends ServiceImpl<SettingMapper, SettingEntity>
        implements ISettingService {

    public String getValue(SettingKeyEnum settingKey) {
        SettingEntity settingEntity = this.getBySettingKey(settingKey.getKey());
        if (ObjectUtils.isEmpty(settingEntity)) {
            return settingKey.getDefaultValue();
        }
        return settingEntity.getSettingValue();
    }

    public Map<SettingKeyEnum, String> getValues(List<SettingKeyEnum> settingKeys) {
        LambdaQueryWrapper<SettingEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.in(SettingEntity::getSettingKey, settingKeys.stream().map(SettingKeyEnum::getKey).toList());
        queryWrapper.eq(SettingEntity::getRecordDeleted, DeletedEnum.NOT_DELETED.getCode());
        Map<String, String> stored = new HashMap<>();
        for (SettingEntity settingEntity : this.list(queryWrapper)) {
            stored.put(settingEntity.getSettingKey(), settingEntity.getSettingValue());
        }
        Map<SettingKeyEnum, String> result = new HashMap<>();
        for (SettingKeyEnum settingKey : settingKeys) {
            result.put(settingKey, stored.containsKey(settingKey.getKey()) ?
                    stored.get(settingKey.getKey()) :
                    settingKey.getDefaultValue());
        }
        return result;
    }

    public boolean getBoolean(SettingKeyEnum settingKey) {
        return parseBoolean(settingKey, this.getValue(settingKey));
    }

    @Transactional
    public void saveValue(SettingKeyEnum settingKey, String value) throws DbException {
        SettingEntity settingEntity = this.getBySettingKey(settingKey.getKey());
        boolean saved;
        if (ObjectUtils.isEmpty(settingEntity)) {
            settingEntity = new SettingEntity();
            settingEntity.setSettingKey(settingKey.getKey());
            settingEntity.setSettingValue(value);
            saved = this.save(settingEntity);
        } else {
            // set explicitly, a null value clears the setting
            LambdaUpdateWrapper<SettingEntity> updateWrapper = new LambdaUpdateWrapper<>();
            updateWrapper.eq(SettingEntity::getSettingId, settingEntity.getSettingId());
            updateWrapper.set(SettingEntity::getSettingValue, value);
            saved = this.update(new SettingEntity(), updateWrapper);
        }
        if (!saved) {
            throw new DbException("saveValue failed. can't write to database. settingKey is %s"
                    .formatted(settingKey.getKey()));
        }
    }

    @Transactional
    public void saveValues(Map<SettingKeyEnum, String> values) throws DbException {
        for (Map.Entry<SettingKeyEnum, String> entry : values.entrySet()) {
            this.saveValue(entry.getKey(), entry.getValue());
        }
    }

    private SettingEntity getBySettingKey(String settingKey) {
        LambdaQueryWrapper<SettingEntity> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(SettingEntity::getSettingKey, settingKey);
        queryWrapper.eq(SettingEntity::getRecordDeleted, DeletedEnum.NOT_DELETED.getCode());

        List<SettingEntity> dbResult = this.list(queryWrapper);
        return CollectionUtils.isEmpty(dbResult) ? null : dbResult.get(0);
    }

    public static boolean parseBoolean(SettingKeyEnum settingKey, String value) {
        if (StringUtils.isBlank(value)) {
            return BooleanUtils.toBoolean(settingKey.getDefaultValue());
        }
        return BooleanUtils.toBoolean(value.trim());
    }

    // blank means "not set" and yields null
    public static Long parseLong(SettingKeyEnum settingKey, String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.warn("parseLong failed. fall back to default. settingKey is {}, value is {}",
                    settingKey.getKey(), value);
            return StringUtils.isBlank(settingKey.getDefaultValue()) ? null : Long.parseLong(settingKey.getDefaultValue());
        }
    }

    public static int parseInt(SettingKeyEnum settingKey, String value) {
        Long parsed = parseLong(settingKey, value);
        if (parsed == null) {
            parsed = parseLong(settingKey, settingKey.getDefaultValue());
        }
        return parsed == null ? 0 : parsed.intValue();
    }

    public static LocalTime parseTime(SettingKeyEnum settingKey, String value) {
        String candidate = StringUtils.isBlank(value) ? settingKey.getDefaultValue() : value.trim();
        try {
            return LocalTime.parse(candidate);
        } catch (DateTimeParseException e) {
            log.warn("parseTime failed. fall back to default. settingKey is {}, value is {}",
                    settingKey.getKey(), value);
            return LocalTime.parse(settingKey.getDefaultValue());
        }
    }
}
