package com.dbguardian.server.service.scheduler;

/**
 * Hand-off point between a firing trigger and the invocation pool. Must not run the backup on
 * the calling thread.
 */
@FunctionalInterface
public interface BackupLauncher {

    // returns the invocation id
    String launch(long scheduleId);
}
