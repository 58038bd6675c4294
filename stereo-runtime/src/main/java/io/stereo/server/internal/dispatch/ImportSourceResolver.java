/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal.dispatch;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.stereo.server.service.CatalogStore;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Turns the source of an import, a local path or an {@code http(s)} URL, into a validated local
 * collection file.
 *
 * <p>URL sources are downloaded into a temporary file which is deleted when the returned
 * {@link ImportSource} is closed.</p>
 */
public class ImportSourceResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(ImportSourceResolver.class);

    private static final String NOT_A_COLLECTION = "not a valid collection";

    private final CatalogStore store;
    private final HttpClient httpClient;
    private final Duration timeout;

    public ImportSourceResolver(CatalogStore store, Duration timeout) {
        this(store, HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(), timeout);
    }

    ImportSourceResolver(CatalogStore store, HttpClient httpClient, Duration timeout) {
        this.store = store;
        this.httpClient = httpClient;
        this.timeout = timeout;
    }

    /**
     * Locates {@code source} and checks it is a collection. Never throws for a bad source; the
     * returned value says what was wrong instead.
     */
    public ImportSource resolve(String source) throws InterruptedException {
        Path downloaded = null;
        Path location;
        try {
            if (isUrl(source)) {
                downloaded = download(source);
                location = downloaded;
            }
            else {
                location = Path.of(source);
            }
        }
        catch (IOException | IllegalArgumentException e) {
            LOGGER.info("Cannot fetch import source {}: {}", source, e.getMessage());
            return new ImportSource(source, downloaded, null, "cannot read " + source + ": " + e.getMessage());
        }

        if (!store.validateSchema(location)) {
            return new ImportSource(source, downloaded, null, source + " is " + NOT_A_COLLECTION);
        }
        return new ImportSource(source, downloaded, location, null);
    }

    static boolean isUrl(String source) {
        String lower = source.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    private Path download(String url) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(timeout)
                .GET()
                .build();
        Path target = Files.createTempFile("stereo-import-", ".db");
        try {
            HttpResponse<Path> response = httpClient.send(request, HttpResponse.BodyHandlers.ofFile(target));
            if (response.statusCode() / 100 != 2) {
                throw new IOException("HTTP status " + response.statusCode());
            }
            LOGGER.debug("Downloaded {} to {}", url, target);
            return target;
        }
        catch (IOException | InterruptedException | RuntimeException e) {
            deleteQuietly(target);
            throw e;
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        }
        catch (IOException e) {
            LOGGER.warn("Cannot delete temporary file {}: {}", file, e.getMessage());
        }
    }

    /**
     * A resolved import source. Close it once the import is done.
     */
    public static final class ImportSource implements AutoCloseable {

        private final String source;
        private final @Nullable Path downloaded;
        private final @Nullable Path location;
        private final @Nullable String problem;

        private ImportSource(String source, @Nullable Path downloaded, @Nullable Path location, @Nullable String problem) {
            this.source = source;
            this.downloaded = downloaded;
            this.location = location;
            this.problem = problem;
        }

        public String source() {
            return source;
        }

        public boolean isValid() {
            return location != null;
        }

        /**
         * @throws IllegalStateException if the source is not valid
         */
        public Path location() {
            if (location == null) {
                throw new IllegalStateException("Invalid import source " + source);
            }
            return location;
        }

        /**
         * Why the source cannot be imported, {@code null} if it can.
         */
        @Nullable
        public String problem() {
            return problem;
        }

        @Override
        public void close() {
            if (downloaded != null) {
                deleteQuietly(downloaded);
            }
        }
    }
}
