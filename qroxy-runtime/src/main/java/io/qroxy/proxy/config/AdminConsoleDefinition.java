/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.config;

import io.qroxy.proxy.admin.ConsoleMode;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Enables the admin console.
 * @param mode The console mode, {@link ConsoleMode#USER} if absent.
 */
public record AdminConsoleDefinition(@Nullable ConsoleMode mode) {

    public ConsoleMode consoleMode() {
        return mode == null ? ConsoleMode.USER : mode;
    }
}
