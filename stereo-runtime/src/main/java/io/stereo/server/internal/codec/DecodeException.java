/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal.codec;

/**
 * A client frame is not a valid command: malformed JSON, an unknown {@code type}, a missing field or
 * a field of the wrong type.
 */
public class DecodeException extends Exception {

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }

    public DecodeException(String message) {
        super(message);
    }
}
