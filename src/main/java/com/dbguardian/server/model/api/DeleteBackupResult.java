package com.dbguardian.server.model.api;

public record DeleteBackupResult(boolean deleted, String name) {
}
