package com.dbguardian.server.model.internal;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

@Data
@Builder
public class ConnectionParams {

    private String host;

    private int port;

    private String database;

    private String username;

    @ToString.Exclude
    private String password;
}
