/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.service;

import java.util.List;

/**
 * Suggests file system paths for a partially typed one.
 */
@FunctionalInterface
public interface PathCompletion {

    /**
     * @param prefix partial path, may start with {@code ~}
     * @return candidate paths, empty when the parent directory cannot be listed
     */
    List<String> complete(String prefix);
}
