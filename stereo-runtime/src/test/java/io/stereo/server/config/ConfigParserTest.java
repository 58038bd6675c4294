/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.config;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigParserTest {

    private final ConfigParser parser = new ConfigParser();

    @Test
    void shouldParseFullConfiguration() {
        // Given
        String yaml = """
                home: /srv/stereo
                host: 0.0.0.0
                port: 9000
                verbosity: 2
                dev: true
                session:
                  queueCapacity: 500
                  batchSize: 20
                  batchDelay: PT0.25S
                  inboundHighWatermark: 10
                  inboundLowWatermark: 2
                """;

        // When
        ServerConfig config = parser.parseConfiguration(yaml);

        // Then
        assertThat(config.home()).isEqualTo(Path.of("/srv/stereo"));
        assertThat(config.defaultCollection()).isEqualTo(Path.of("/srv/stereo/stereo.db"));
        assertThat(config.host()).isEqualTo("0.0.0.0");
        assertThat(config.port()).isEqualTo(9000);
        assertThat(config.verbosity()).isEqualTo(2);
        assertThat(config.dev()).isTrue();
        assertThat(config.session().queueCapacity()).isEqualTo(500);
        assertThat(config.session().batchSize()).isEqualTo(20);
        assertThat(config.session().batchDelay()).isEqualTo(Duration.ofMillis(250));
        assertThat(config.session().debounceQuietPeriod()).isEqualTo(SessionSettings.DEFAULT_DEBOUNCE_QUIET_PERIOD);
        assertThat(config.session().inboundHighWatermark()).isEqualTo(10);
    }

    @Test
    void shouldFallBackToDefaultsForMissingValues() {
        // When
        ServerConfig partial = parser.parseConfiguration("port: 8123\n");
        ServerConfig blank = parser.parseConfiguration("  \n");

        // Then
        assertThat(partial).isEqualTo(ServerConfig.defaults().withPort(8123));
        assertThat(blank).isEqualTo(ServerConfig.defaults());
    }

    @Test
    void shouldReadConfigurationFile(@TempDir Path dir) throws Exception {
        // Given
        Path file = Files.writeString(dir.resolve("stereo.yaml"), "host: example.org\n");

        // When
        ServerConfig config = parser.parseConfiguration(file);

        // Then
        assertThat(config.host()).isEqualTo("example.org");
    }

    @Test
    void shouldRejectUnknownProperties() {
        // When/Then
        assertThatThrownBy(() -> parser.parseConfiguration("colour: blue\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("colour");
    }

    @Test
    void shouldRejectInconsistentWatermarks() {
        // When/Then
        assertThatThrownBy(() -> parser.parseConfiguration("session:\n  inboundHighWatermark: 2\n  inboundLowWatermark: 4\n"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldReportMissingFile(@TempDir Path dir) {
        // When/Then
        assertThatThrownBy(() -> parser.parseConfiguration(dir.resolve("absent.yaml")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("absent.yaml");
    }

    @Test
    void shouldApplyEnvironmentOverrides() {
        // Given
        Map<String, String> env = Map.of(
                ConfigParser.ENV_HOME, "/data/stereo",
                ConfigParser.ENV_VERBOSITY, " 1 ",
                ConfigParser.ENV_DEV, "yes",
                "UNRELATED", "ignored");

        // When
        ServerConfig config = parser.applyEnvironment(ServerConfig.defaults(), env);

        // Then
        assertThat(config.home()).isEqualTo(Path.of("/data/stereo"));
        assertThat(config.verbosity()).isEqualTo(1);
        assertThat(config.dev()).isTrue();
        assertThat(config.port()).isEqualTo(ServerConfig.DEFAULT_PORT);
    }

    @Test
    void shouldIgnoreBlankEnvironmentValues() {
        // When
        ServerConfig config = parser.applyEnvironment(ServerConfig.defaults(),
                Map.of(ConfigParser.ENV_HOME, "", ConfigParser.ENV_DEV, " "));

        // Then
        assertThat(config).isEqualTo(ServerConfig.defaults());
    }

    @ParameterizedTest
    @ValueSource(strings = { "maybe", "2" })
    void shouldRejectUnusableDevFlag(String value) {
        // When/Then
        assertThatThrownBy(() -> parser.applyEnvironment(ServerConfig.defaults(), Map.of(ConfigParser.ENV_DEV, value)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigParser.ENV_DEV);
    }

    @Test
    void shouldRejectNonNumericVerbosity() {
        // When/Then
        assertThatThrownBy(() -> parser.applyEnvironment(ServerConfig.defaults(), Map.of(ConfigParser.ENV_VERBOSITY, "loud")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigParser.ENV_VERBOSITY);
    }

    @Test
    void shouldExpandLeadingTilde() {
        // Given
        String userHome = System.getProperty("user.home");

        // When/Then
        assertThat(ConfigParser.expandHome("~")).isEqualTo(Path.of(userHome));
        assertThat(ConfigParser.expandHome("~/music/stereo.db")).isEqualTo(Path.of(userHome, "music", "stereo.db"));
        assertThat(ConfigParser.expandHome("/tmp/~x")).isEqualTo(Path.of("/tmp/~x"));
    }
}
