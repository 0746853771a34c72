package com.dbguardian.server.model.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.sql.Timestamp;

@Data
@TableName("backup_schedules")
public class BackupScheduleEntity {

    @TableId(value = "id", type = IdType.AUTO)
    private Long id;

    private String databaseName;

    private String scheduleType;

    private Integer intervalMinutes;

    private String cronExpression;

    private Boolean enabled;

    @TableField(fill = FieldFill.INSERT)
    private Timestamp createdAt;

    private Timestamp lastRun;

    // advisory only, the dispatcher never reads it back
    private Timestamp nextRun;
}
