/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal.store;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

class FileSystemPathCompletionTest {

    @TempDir
    Path home;

    private FileSystemPathCompletion completion;

    @BeforeEach
    void setUp() throws Exception {
        Files.createDirectories(home.resolve("music"));
        Files.createFile(home.resolve("music").resolve("house.db"));
        Files.createFile(home.resolve("music").resolve("hardcore.db"));
        Files.createFile(home.resolve("music").resolve("techno.db"));
        completion = new FileSystemPathCompletion(home);
    }

    @Test
    void shouldListDirectoryWhenPrefixEndsWithSeparator() {
        // When
        var paths = completion.complete(home.resolve("music") + "/");

        // Then
        assertThat(paths).containsExactly(
                home.resolve("music/hardcore.db").toString(),
                home.resolve("music/house.db").toString(),
                home.resolve("music/techno.db").toString());
    }

    @Test
    void shouldListSiblingsStartingWithLastSegment() {
        // When
        var paths = completion.complete(home.resolve("music").resolve("h").toString());

        // Then
        assertThat(paths).containsExactly(
                home.resolve("music/hardcore.db").toString(),
                home.resolve("music/house.db").toString());
    }

    @Test
    void shouldExpandHome() {
        // When
        var inHome = completion.complete("~");
        var inMusic = completion.complete("~/music/t");

        // Then
        assertThat(inHome).containsExactly(home.resolve("music").toString());
        assertThat(inMusic).containsExactly(home.resolve("music/techno.db").toString());
    }

    @Test
    void shouldReturnNothingForMissingDirectory() {
        // When/Then
        assertThat(completion.complete(home.resolve("nowhere").resolve("x").toString())).isEmpty();
        assertThat(completion.complete(home.resolve("nowhere") + "/")).isEmpty();
        assertThat(completion.complete("")).isEmpty();
    }
}
