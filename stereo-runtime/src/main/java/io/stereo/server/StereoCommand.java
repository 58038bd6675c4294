/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server;

import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.stereo.server.config.ConfigParser;
import io.stereo.server.config.LoggingConfigurator;
import io.stereo.server.config.ServerConfig;
import io.stereo.server.internal.util.VersionInfo;
import io.stereo.server.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Command line entry point.
 *
 * <p>Settings come from the configuration file, then {@code STEREO_*} environment variables,
 * then options given here, each overriding the one before.</p>
 */
@Command(name = "stereo",
        mixinStandardHelpOptions = true,
        versionProvider = StereoCommand.VersionProvider.class,
        description = "Realtime session server for a personal music collection")
public final class StereoCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(StereoCommand.class);

    @Option(names = { "--config" }, description = "YAML configuration file")
    @Nullable
    Path configFile;

    @Option(names = { "--home" }, description = "Directory holding the default collection and the log file (default: ~/.local/share/stereo)")
    @Nullable
    String home;

    @Option(names = { "--host" }, description = "Interface to listen on (default: localhost)")
    @Nullable
    String host;

    @Option(names = { "-p", "--port" }, description = "Port to listen on (default: 8005)")
    @Nullable
    Integer port;

    @Option(names = { "-v", "--verbose" }, description = "More logging; repeat for debug output")
    boolean[] verbose = new boolean[0];

    @Option(names = { "--dev" }, description = "Development mode: logs network traffic")
    boolean dev;

    public static void main(String[] args) {
        System.exit(new CommandLine(new StereoCommand()).execute(args));
    }

    @Override
    public Integer call() throws Exception {
        ServerConfig config = resolveConfig(System.getenv());
        LoggingConfigurator.configure(config.verbosity(), config.home());

        StereoServer server = new StereoServer(config).startup();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                server.shutdown();
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "stereo-shutdown"));
        server.block();
        LOGGER.info("Server stopped");
        return 0;
    }

    @VisibleForTesting
    ServerConfig resolveConfig(Map<String, String> env) {
        ConfigParser parser = new ConfigParser();
        ServerConfig config = configFile != null ? parser.parseConfiguration(configFile) : ServerConfig.defaults();
        config = parser.applyEnvironment(config, env);
        if (home != null) {
            config = config.withHome(ConfigParser.expandHome(home));
        }
        if (host != null) {
            config = config.withHost(host);
        }
        if (port != null) {
            config = config.withPort(port);
        }
        if (verbose.length > 0) {
            config = config.withVerbosity(verbose.length);
        }
        if (dev) {
            config = config.withDev(true);
        }
        return config;
    }

    public static final class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            return new String[]{ "stereo " + VersionInfo.version() };
        }
    }
}
