/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.config;

import java.nio.file.Path;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Top level configuration of the server.
 *
 * @param home directory holding the default collection and the log file
 * @param host interface to bind to
 * @param port port to listen on
 * @param verbosity 0 logs warnings, 1 adds info, 2 or more adds debug
 * @param dev development mode
 * @param session session engine tuning
 */
public record ServerConfig(Path home,
                           String host,
                           int port,
                           int verbosity,
                           boolean dev,
                           SessionSettings session) {

    public static final String DEFAULT_HOST = "localhost";
    public static final int DEFAULT_PORT = 8005;
    public static final String DEFAULT_COLLECTION_FILE = "stereo.db";
    public static final String LOG_FILE = "stereo.log";

    public ServerConfig {
        Objects.requireNonNull(home, "home");
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(session, "session");
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (verbosity < 0) {
            throw new IllegalArgumentException("verbosity must not be negative");
        }
    }

    public static Path defaultHome() {
        return Path.of(System.getProperty("user.home"), ".local", "share", "stereo");
    }

    public static ServerConfig defaults() {
        return new ServerConfig(defaultHome(), DEFAULT_HOST, DEFAULT_PORT, 0, false, SessionSettings.defaults());
    }

    @JsonCreator
    static ServerConfig fromConfig(@JsonProperty("home") @Nullable String home,
                                   @JsonProperty("host") @Nullable String host,
                                   @JsonProperty("port") @Nullable Integer port,
                                   @JsonProperty("verbosity") @Nullable Integer verbosity,
                                   @JsonProperty("dev") @Nullable Boolean dev,
                                   @JsonProperty("session") @Nullable SessionSettings session) {
        return new ServerConfig(
                home != null ? ConfigParser.expandHome(home) : defaultHome(),
                host != null ? host : DEFAULT_HOST,
                port != null ? port : DEFAULT_PORT,
                verbosity != null ? verbosity : 0,
                Boolean.TRUE.equals(dev),
                session != null ? session : SessionSettings.defaults());
    }

    /**
     * The collection every session starts with.
     */
    public Path defaultCollection() {
        return home.resolve(DEFAULT_COLLECTION_FILE);
    }

    public Path logFile() {
        return home.resolve(LOG_FILE);
    }

    public ServerConfig withHome(Path newHome) {
        return new ServerConfig(newHome, host, port, verbosity, dev, session);
    }

    public ServerConfig withHost(String newHost) {
        return new ServerConfig(home, newHost, port, verbosity, dev, session);
    }

    public ServerConfig withPort(int newPort) {
        return new ServerConfig(home, host, newPort, verbosity, dev, session);
    }

    public ServerConfig withVerbosity(int newVerbosity) {
        return new ServerConfig(home, host, port, newVerbosity, dev, session);
    }

    public ServerConfig withDev(boolean newDev) {
        return new ServerConfig(home, host, port, verbosity, newDev, session);
    }
}
