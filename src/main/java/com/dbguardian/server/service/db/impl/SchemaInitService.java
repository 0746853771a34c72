package com.dbguardian.server.service.db.impl;

import com.dbguardian.server.mapper.SchemaMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Installs tables, the notify function and its trigger. The store may come up after this
 * service does, so every step is retried with a fixed delay; after the last attempt the
 * service keeps running in degraded mode instead of aborting start-up.
 */
@Service
@Slf4j
public class SchemaInitService {

    static final String NOTIFY_TRIGGER_NAME = "schedule_change_trigger";

    private final SchemaMapper schemaMapper;

    private final int maxAttempts;

    private final long retryDelayMillis;

    @Autowired
    public SchemaInitService(
            SchemaMapper schemaMapper,
            @Value("${dbguardian.server.schema.initMaxAttempts:30}") int maxAttempts,
            @Value("${dbguardian.server.schema.initRetryDelayMillis:2000}") long retryDelayMillis) {
        this.schemaMapper = schemaMapper;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.retryDelayMillis = Math.max(0, retryDelayMillis);
    }

    // true 表示 schema 就绪, false 表示降级运行
    public boolean initWithRetry() {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                this.init();
                log.info("schema init success. attempt {}/{}", attempt, maxAttempts);
                return true;
            } catch (Exception e) {
                if (attempt == maxAttempts) {
                    log.error("schema init failed after {} attempts. continue in degraded mode.", maxAttempts, e);
                    return false;
                }
                log.warn("schema init failed (attempt {}/{}). retry in {} ms. error: {}",
                        attempt, maxAttempts, retryDelayMillis, e.toString());
                if (!sleep(retryDelayMillis)) {
                    log.warn("schema init interrupted. continue in degraded mode.");
                    return false;
                }
            }
        }
        return false;
    }

    private void init() {
        this.schemaMapper.createScheduleTable();
        this.schemaMapper.createBackupTable();
        this.schemaMapper.createCredentialTable();
        this.schemaMapper.createNotifyFunction();
        if (!this.schemaMapper.isTriggerExist(NOTIFY_TRIGGER_NAME)) {
            this.schemaMapper.createNotifyTrigger();
            log.info("created {}", NOTIFY_TRIGGER_NAME);
        }
    }

    private static boolean sleep(long millis) {
        try {
            TimeUnit.MILLISECONDS.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
