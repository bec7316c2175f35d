package com.dbkeeper.server.configuration;

import com.baomidou.mybatisplus.core.handlers.MetaObjectHandler;
import com.dbkeeper.server.enums.DeletedEnum;
import org.apache.ibatis.reflection.MetaObject;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Instant;

@Component
public class CustomMetaObjectHandler implements MetaObjectHandler {

    private static final String SYSTEM_USER = "System";

    @Override
    public void insertFill(MetaObject metaObject) {
        Timestamp now = Timestamp.from(Instant.now());
        this.strictInsertFill(metaObject, "createdUser", String.class, SYSTEM_USER);
        this.strictInsertFill(metaObject, "createdTime", Timestamp.class, now);
        this.strictInsertFill(metaObject, "lastUpdatedUser", String.class, SYSTEM_USER);
        this.strictInsertFill(metaObject, "lastUpdatedTime", Timestamp.class, now);
        this.strictInsertFill(metaObject, "recordDeleted", Integer.class, DeletedEnum.NOT_DELETED.getCode());
    }

    // updates always stamp, even when the entity was loaded with old values
    @Override
    public void updateFill(MetaObject metaObject) {
        this.setFieldValByName("lastUpdatedUser", SYSTEM_USER, metaObject);
        this.setFieldValByName("lastUpdatedTime", Timestamp.from(Instant.now()), metaObject);
    }
}
