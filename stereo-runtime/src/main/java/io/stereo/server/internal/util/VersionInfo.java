/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Build version of the server, as stamped into {@code stereo-version.properties}.
 */
public final class VersionInfo {

    private static final String RESOURCE = "/stereo-version.properties";
    private static final String UNKNOWN = "unknown";

    private static final String VERSION;

    static {
        var properties = new Properties();
        try (InputStream in = VersionInfo.class.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        }
        catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        VERSION = properties.getProperty("version", UNKNOWN);
    }

    private VersionInfo() {
    }

    public static String version() {
        return VERSION;
    }
}
