package com.dbguardian.server.model.entity;

import com.baomidou.mybatisplus.annotation.FieldFill;
import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;
import lombok.ToString;

import java.sql.Timestamp;

@Data
@TableName("database_credentials")
public class DatabaseCredentialEntity {

    @TableId(value = "id", type = IdType.AUTO)
    private Long id;

    private String name;

    private String host;

    private Integer port;

    // 列名就叫 database
    @TableField("database")
    private String databaseName;

    private String username;

    @ToString.Exclude
    private String password;

    private String version;

    @TableField(fill = FieldFill.INSERT)
    private Timestamp createdAt;
}
