package com.purchasingpower.codegraph.storage;

import com.purchasingpower.codegraph.configuration.CodeGraphProperties;
import com.purchasingpower.codegraph.configuration.StorageProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Locations of the persisted artifacts below a scanned root.
 */
@Component
@RequiredArgsConstructor
public class StorageLayout {

    private final CodeGraphProperties properties;

    public Path directory(Path root) {
        return root.resolve(storage().getDirectory());
    }

    public Path graphFile(Path root) {
        return directory(root).resolve(storage().getGraphFile());
    }

    public Path metadataFile(Path root) {
        return directory(root).resolve(storage().getMetadataFile());
    }

    public Path indexFile(Path root) {
        return directory(root).resolve(storage().getIndexFile());
    }

    private StorageProperties storage() {
        return properties.getStorage();
    }
}
