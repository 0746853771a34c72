package com.dbguardian.server.model.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.sql.Timestamp;

@Data
@TableName("backups")
public class BackupEntity {

    @TableId(value = "id", type = IdType.AUTO)
    private Long id;

    private String databaseName;

    private String backupName;

    private String storageType;

    private String storageLocation;

    @TableField(fill = FieldFill.INSERT)
    private Timestamp createdAt;

    private Long sizeBytes;

    @TableField(fill = FieldFill.INSERT)
    private String status;
}
