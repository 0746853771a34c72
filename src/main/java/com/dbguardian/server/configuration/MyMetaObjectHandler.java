package com.dbguardian.server.configuration;

import com.baomidou.mybatisplus.core.handlers.MetaObjectHandler;
import com.dbguardian.server.enums.BackupStatusEnum;
import org.apache.ibatis.reflection.MetaObject;

import java.sql.Timestamp;
import java.time.Instant;

public class MyMetaObjectHandler implements MetaObjectHandler {

    @Override
    public void insertFill(MetaObject metaObject) {
        // 所有表的 created_at
        this.strictInsertFill(metaObject, "createdAt", Timestamp.class, Timestamp.from(Instant.now()));

        // backups 表
        this.strictInsertFill(metaObject, "status", String.class, BackupStatusEnum.COMPLETED.getStatus());
    }

    @Override
    public void updateFill(MetaObject metaObject) {
        // 没有需要自动更新的字段
    }
}
