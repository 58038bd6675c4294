/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Loads {@link ServerConfig} from YAML and from {@code STEREO_*} environment variables.
 *
 * <p>Precedence, lowest first: built in defaults, the configuration file, the environment,
 * command line options (applied by the caller).</p>
 */
public class ConfigParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigParser.class);

    public static final String ENV_HOME = "STEREO_HOME";
    public static final String ENV_VERBOSITY = "STEREO_VERBOSITY";
    public static final String ENV_DEV = "STEREO_DEV";

    private static final ObjectMapper MAPPER = createObjectMapper();

    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper(new YAMLFactory())
                .registerModule(new JavaTimeModule())
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public ServerConfig parseConfiguration(String yaml) {
        if (yaml.isBlank()) {
            return ServerConfig.defaults();
        }
        try {
            ServerConfig config = MAPPER.readValue(yaml, ServerConfig.class);
            return config != null ? config : ServerConfig.defaults();
        }
        catch (IOException e) {
            throw new IllegalArgumentException("Couldn't parse configuration: " + e.getMessage(), e);
        }
    }

    public ServerConfig parseConfiguration(Path file) {
        String yaml;
        try {
            yaml = Files.readString(file);
        }
        catch (IOException e) {
            throw new IllegalArgumentException("Couldn't read configuration file " + file + ": " + e.getMessage(), e);
        }
        LOGGER.debug("Read configuration from {}", file);
        return parseConfiguration(yaml);
    }

    /**
     * Overrides {@code config} with the {@code STEREO_*} variables present in {@code env}.
     *
     * @throws IllegalArgumentException if a variable has an unusable value
     */
    public ServerConfig applyEnvironment(ServerConfig config, Map<String, String> env) {
        ServerConfig result = config;
        String home = env.get(ENV_HOME);
        if (home != null && !home.isBlank()) {
            result = result.withHome(expandHome(home));
        }
        String verbosity = env.get(ENV_VERBOSITY);
        if (verbosity != null && !verbosity.isBlank()) {
            try {
                result = result.withVerbosity(Integer.parseInt(verbosity.trim()));
            }
            catch (NumberFormatException e) {
                throw new IllegalArgumentException(ENV_VERBOSITY + " must be an integer, was '" + verbosity + "'", e);
            }
        }
        Boolean dev = parseFlag(env.get(ENV_DEV));
        if (dev != null) {
            result = result.withDev(dev);
        }
        return result;
    }

    @Nullable
    private static Boolean parseFlag(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "1", "true", "yes", "on" -> Boolean.TRUE;
            case "0", "false", "no", "off" -> Boolean.FALSE;
            default -> throw new IllegalArgumentException(ENV_DEV + " must be a boolean, was '" + value + "'");
        };
    }

    /**
     * Resolves a leading {@code ~} to the user's home directory.
     */
    public static Path expandHome(String path) {
        if (path.equals("~")) {
            return Path.of(System.getProperty("user.home"));
        }
        if (path.startsWith("~/")) {
            return Path.of(System.getProperty("user.home"), path.substring(2));
        }
        return Path.of(path);
    }
}
