/*
 * Copyright Stereo Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.stereo.server.internal.dispatch;

import io.stereo.server.message.Command;

/**
 * Handles one kind of command for a session.
 *
 * @param <C> the command variant handled
 */
@FunctionalInterface
public interface CommandHandler<C extends Command> {

    /**
     * @throws InterruptedException if the session is being torn down
     * @throws Exception any other failure; the dispatcher logs it and carries on
     */
    void handle(C command) throws Exception;
}
