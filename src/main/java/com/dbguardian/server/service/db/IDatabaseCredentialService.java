package com.dbguardian.server.service.db;

import com.dbguardian.server.model.entity.DatabaseCredentialEntity;

public interface IDatabaseCredentialService {

    DatabaseCredentialEntity getByName(String name);
}
