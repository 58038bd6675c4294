/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal.store;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.stereo.server.service.PathCompletion;

/**
 * Completes paths against the local file system.
 *
 * <p>A prefix ending in a separator (or a bare {@code ~}) lists that directory. Any other prefix
 * lists the entries of its parent whose name starts with the last segment. A leading {@code ~}
 * stands for the user's home directory.</p>
 */
public class FileSystemPathCompletion implements PathCompletion {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemPathCompletion.class);

    private final Path home;

    public FileSystemPathCompletion() {
        this(Path.of(System.getProperty("user.home")));
    }

    public FileSystemPathCompletion(Path home) {
        this.home = home;
    }

    @Override
    public List<String> complete(String prefix) {
        Path parent;
        String partialName;
        try {
            Path path = expand(prefix);
            if (prefix.endsWith("/") || prefix.equals("~")) {
                parent = path;
                partialName = "";
            }
            else {
                parent = path.getParent();
                Path fileName = path.getFileName();
                partialName = fileName == null ? "" : fileName.toString();
            }
        }
        catch (InvalidPathException e) {
            return List.of();
        }
        if (parent == null || !Files.isDirectory(parent)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(parent)) {
            return entries
                    .filter(entry -> entry.getFileName().toString().startsWith(partialName))
                    .map(Path::toString)
                    .sorted()
                    .toList();
        }
        catch (IOException | UncheckedIOException | SecurityException e) {
            LOGGER.debug("Cannot list {}: {}", parent, e.getMessage());
            return List.of();
        }
    }

    private Path expand(String prefix) {
        if (prefix.equals("~")) {
            return home;
        }
        else if (prefix.startsWith("~/")) {
            return home.resolve(prefix.substring(2));
        }
        return Path.of(prefix);
    }
}
