package com.rms.restaurantservice.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class DatabaseDirectoryInitializerTest {

    private final DatabaseDirectoryInitializer initializer = new DatabaseDirectoryInitializer();

    @TempDir
    Path tempDir;

    @Test
    void createsMissingParentDirectories() {
        File dbFile = tempDir.resolve("nested/data/restaurant.db").toFile();

        initializer.ensureParentDirectory("jdbc:sqlite:" + dbFile.getPath() + "?journal_mode=WAL");

        assertThat(dbFile.getParentFile()).isDirectory();
        assertThat(dbFile).doesNotExist();
    }

    @Test
    void ignoresInMemoryAndForeignUrls() {
        assertThatCode(() -> {
            initializer.ensureParentDirectory("jdbc:sqlite::memory:");
            initializer.ensureParentDirectory("jdbc:h2:mem:test");
            initializer.ensureParentDirectory(null);
        }).doesNotThrowAnyException();
    }
}
