package com.dbguardian.server.service.storage;

import com.dbguardian.server.exception.StorageException;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Primary backup store, keyed by {@code <database>/<file name>}.
 */
public interface ObjectStore {

    void put(String key, Path file) throws StorageException;

    // recursive, blank prefix means everything
    List<StoredObject> list(String prefix) throws StorageException;

    Optional<StoredObject> stat(String key) throws StorageException;

    void remove(String key) throws StorageException;

    record StoredObject(String key, long size, Instant lastModified) {
    }
}
