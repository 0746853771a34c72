package com.dbguardian.server.service.backup;

import com.dbguardian.server.enums.InvocationStateEnum;
import com.dbguardian.server.model.api.BackupResult;
import com.dbguardian.server.model.api.InvocationStatus;
import com.dbguardian.server.model.internal.BackupTarget;
import lombok.Getter;

import java.util.concurrent.CompletableFuture;

/**
 * Mutable state of one submitted backup. State only moves forward; once terminal it is frozen.
 */
public class BackupInvocation implements InvocationProgress {

    @Getter
    private final String invocationId;

    @Getter
    private final BackupTarget target;

    @Getter
    private final CompletableFuture<BackupResult> future = new CompletableFuture<>();

    private InvocationStateEnum state = InvocationStateEnum.PENDING;

    private String message;

    private BackupResult result;

    private String error;

    public BackupInvocation(String invocationId, BackupTarget target) {
        this.invocationId = invocationId;
        this.target = target;
    }

    @Override
    public synchronized void updateState(InvocationStateEnum state, String message) {
        if (this.state.isTerminal()) {
            return;
        }
        this.state = state;
        this.message = message;
    }

    public void succeed(BackupResult backupResult) {
        synchronized (this) {
            if (this.state.isTerminal()) {
                return;
            }
            this.state = InvocationStateEnum.SUCCESS;
            this.result = backupResult;
            this.message = backupResult.isSkipped()
                    ? "Schedule disabled, backup skipped"
                    : "Backup completed successfully";
        }
        this.future.complete(backupResult);
    }

    public void fail(Throwable throwable) {
        synchronized (this) {
            if (this.state.isTerminal()) {
                return;
            }
            this.state = InvocationStateEnum.FAILURE;
            this.error = throwable.getMessage() == null ? throwable.toString() : throwable.getMessage();
            this.message = this.error;
        }
        this.future.completeExceptionally(throwable);
    }

    public synchronized boolean isTerminal() {
        return this.state.isTerminal();
    }

    public synchronized InvocationStatus toStatus() {
        return new InvocationStatus()
                .setInvocationId(this.invocationId)
                .setState(this.state)
                .setMessage(this.message)
                .setResult(this.result)
                .setError(this.error);
    }
}
