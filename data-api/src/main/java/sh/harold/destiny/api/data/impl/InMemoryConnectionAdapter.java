package sh.harold.destiny.api.data.impl;

import sh.harold.destiny.api.data.storage.ConnectionAdapter;
import sh.harold.destiny.api.data.storage.StorageType;

import java.nio.file.Path;

/**
 * Connection adapter selecting the in-memory backend.
 */
public class InMemoryConnectionAdapter implements ConnectionAdapter {

    @Override
    public StorageType getStorageType() {
        return StorageType.IN_MEMORY;
    }

    @Override
    public Path getJsonStoragePath() {
        return null;
    }
}
