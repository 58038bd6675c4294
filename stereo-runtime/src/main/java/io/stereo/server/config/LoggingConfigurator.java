/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.config;

import java.nio.file.Path;

import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.rolling.FixedWindowRollingPolicy;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.SizeBasedTriggeringPolicy;
import ch.qos.logback.core.util.FileSize;

/**
 * Applies the configured verbosity to Logback and adds the rolling log file in the home directory.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);

    static final String FILE_APPENDER_NAME = "STEREO_FILE";
    private static final String FILE_PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} | %-5level | %logger | %msg%n";
    private static final FileSize MAX_FILE_SIZE = FileSize.valueOf("10MB");
    private static final int BACKUP_COUNT = 3;

    private LoggingConfigurator() {
    }

    /**
     * Maps a verbosity count to a root level: 0 is WARN, 1 is INFO, anything higher is DEBUG.
     */
    public static Level levelFor(int verbosity) {
        if (verbosity <= 0) {
            return Level.WARN;
        }
        return verbosity == 1 ? Level.INFO : Level.DEBUG;
    }

    public static void configure(int verbosity, Path home) {
        ILoggerFactory factory = LoggerFactory.getILoggerFactory();
        if (!(factory instanceof LoggerContext context)) {
            LOGGER.warn("Logging backend {} cannot be configured at runtime; keeping its defaults", factory.getClass().getName());
            return;
        }
        Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        root.setLevel(levelFor(verbosity));
        if (root.getAppender(FILE_APPENDER_NAME) == null) {
            root.addAppender(fileAppender(context, home.resolve(ServerConfig.LOG_FILE)));
        }
    }

    private static RollingFileAppender<ILoggingEvent> fileAppender(LoggerContext context, Path file) {
        RollingFileAppender<ILoggingEvent> appender = new RollingFileAppender<>();
        appender.setContext(context);
        appender.setName(FILE_APPENDER_NAME);
        appender.setFile(file.toString());

        FixedWindowRollingPolicy rollingPolicy = new FixedWindowRollingPolicy();
        rollingPolicy.setContext(context);
        rollingPolicy.setParent(appender);
        rollingPolicy.setFileNamePattern(file + ".%i");
        rollingPolicy.setMinIndex(1);
        rollingPolicy.setMaxIndex(BACKUP_COUNT);
        appender.setRollingPolicy(rollingPolicy);

        SizeBasedTriggeringPolicy<ILoggingEvent> triggeringPolicy = new SizeBasedTriggeringPolicy<>();
        triggeringPolicy.setContext(context);
        triggeringPolicy.setMaxFileSize(MAX_FILE_SIZE);
        appender.setTriggeringPolicy(triggeringPolicy);

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(context);
        encoder.setPattern(FILE_PATTERN);
        encoder.start();
        appender.setEncoder(encoder);

        rollingPolicy.start();
        triggeringPolicy.start();
        appender.start();
        return appender;
    }
}
