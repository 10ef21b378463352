package com.rms.restaurantservice.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.File;

/**
 * Creates the directory a file-backed SQLite URL points into; the driver will not create it.
 */
@Component
public class DatabaseDirectoryInitializer {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseDirectoryInitializer.class);
    private static final String SQLITE_PREFIX = "jdbc:sqlite:";

    public void ensureParentDirectory(String jdbcUrl) {
        if (jdbcUrl == null || !jdbcUrl.startsWith(SQLITE_PREFIX)) {
            return;
        }
        String path = jdbcUrl.substring(SQLITE_PREFIX.length());
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        if (path.isEmpty() || path.startsWith(":memory:") || path.startsWith("file::memory:")) {
            return;
        }

        File dataDir = new File(path).getAbsoluteFile().getParentFile();
        if (dataDir == null || dataDir.exists()) {
            return;
        }
        if (dataDir.mkdirs()) {
            logger.info("Created data directory: {}", dataDir.getAbsolutePath());
        } else {
            throw new IllegalStateException("Failed to create data directory: " + dataDir.getAbsolutePath());
        }
    }
}
