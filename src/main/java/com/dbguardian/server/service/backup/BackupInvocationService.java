package com.dbguardian.server.service.backup;

import com.dbguardian.server.enums.InvocationStateEnum;
import com.dbguardian.server.exception.ConfigurationException;
import com.dbguardian.server.exception.ValidationException;
import com.dbguardian.server.model.api.BackupResult;
import com.dbguardian.server.model.api.InvocationStatus;
import com.dbguardian.server.model.internal.BackupTarget;
import com.dbguardian.server.service.scheduler.BackupLauncher;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Queue layer in front of {@link BackupExecutor}: assigns invocation ids, runs backups on the
 * bounded backup pool, retries on request and keeps recent invocation states for polling.
 */
@Slf4j
@Service
public class BackupInvocationService implements BackupLauncher {

    private final BackupExecutor backupExecutor;

    private final TaskExecutor backupTaskExecutor;

    private final int maxRetries;

    private final long retryDelaySec;

    private final int historySize;

    // insertion ordered, guarded by itself
    private final Map<String, BackupInvocation> invocations = new LinkedHashMap<>();

    @Autowired
    public BackupInvocationService(
            BackupExecutor backupExecutor,
            @Qualifier("backupTaskExecutor") TaskExecutor backupTaskExecutor,
            @Value("${dbguardian.server.backup.maxRetries:0}") int maxRetries,
            @Value("${dbguardian.server.backup.retryDelaySec:60}") long retryDelaySec,
            @Value("${dbguardian.server.backup.invocationHistorySize:1000}") int invocationHistorySize) {
        this.backupExecutor = backupExecutor;
        this.backupTaskExecutor = backupTaskExecutor;
        this.maxRetries = Math.max(0, maxRetries);
        this.retryDelaySec = Math.max(0, retryDelaySec);
        this.historySize = Math.max(1, invocationHistorySize);
    }

    @Override
    public String launch(long scheduleId) {
        return this.submitSchedule(scheduleId).getInvocationId();
    }

    public BackupInvocation submitSchedule(long scheduleId) {
        return this.submit(BackupTarget.ofSchedule(scheduleId));
    }

    public BackupInvocation submitDatabase(String databaseName) {
        return this.submit(BackupTarget.ofDatabase(databaseName));
    }

    public Optional<InvocationStatus> getInvocationStatus(String invocationId) throws ValidationException {
        if (StringUtils.isBlank(invocationId)) {
            throw new ValidationException("getInvocationStatus failed. invocationId is blank");
        }
        BackupInvocation invocation;
        synchronized (this.invocations) {
            invocation = this.invocations.get(invocationId);
        }
        return Optional.ofNullable(invocation).map(BackupInvocation::toStatus);
    }

    private BackupInvocation submit(BackupTarget target) {
        BackupInvocation invocation = new BackupInvocation(UUID.randomUUID().toString(), target);
        synchronized (this.invocations) {
            this.invocations.put(invocation.getInvocationId(), invocation);
            this.evictFinished();
        }
        try {
            this.backupTaskExecutor.execute(() -> this.run(invocation));
            log.info("backup invocation {} submitted. target is {}", invocation.getInvocationId(), target);
        } catch (Exception e) {
            log.error("backup invocation {} rejected. target is {}", invocation.getInvocationId(), target, e);
            invocation.fail(e);
        }
        return invocation;
    }

    // 从最旧开始淘汰已结束的记录, 运行中的保留
    private void evictFinished() {
        Iterator<BackupInvocation> iterator = this.invocations.values().iterator();
        while (this.invocations.size() > this.historySize && iterator.hasNext()) {
            if (iterator.next().isTerminal()) {
                iterator.remove();
            }
        }
    }

    void run(BackupInvocation invocation) {
        int attempt = 0;
        while (true) {
            try {
                BackupResult backupResult = this.backupExecutor.execute(invocation.getTarget(), invocation);
                invocation.succeed(backupResult);
                log.info("backup invocation {} finished. result is {}", invocation.getInvocationId(), backupResult);
                return;
            } catch (Exception e) {
                // 配置错误不重试
                if (e instanceof ConfigurationException || attempt >= this.maxRetries) {
                    log.error("backup invocation {} failed. target is {}",
                            invocation.getInvocationId(), invocation.getTarget(), e);
                    invocation.fail(e);
                    return;
                }
                attempt++;
                log.warn("backup invocation {} failed, retry {}/{} in {} s",
                        invocation.getInvocationId(), attempt, this.maxRetries, this.retryDelaySec, e);
                invocation.updateState(InvocationStateEnum.PROGRESS,
                        "Retrying backup (attempt %s/%s)".formatted(attempt, this.maxRetries));
                try {
                    TimeUnit.SECONDS.sleep(this.retryDelaySec);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    invocation.fail(ie);
                    return;
                }
            }
        }
    }
}
