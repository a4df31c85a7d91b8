package sh.harold.destiny.api.data.impl.json;

import sh.harold.destiny.api.data.storage.ConnectionAdapter;
import sh.harold.destiny.api.data.storage.StorageType;

import java.nio.file.Path;
import java.util.Objects;

/**
 * JSON file-based implementation of ConnectionAdapter.
 */
public class JsonConnectionAdapter implements ConnectionAdapter {

    private final Path storagePath;

    public JsonConnectionAdapter(Path storagePath) {
        this.storagePath = Objects.requireNonNull(storagePath, "storagePath");
    }

    @Override
    public StorageType getStorageType() {
        return StorageType.JSON;
    }

    @Override
    public Path getJsonStoragePath() {
        return storagePath;
    }
}
