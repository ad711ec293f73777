/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.admin;

import java.io.PrintWriter;
import java.io.Writer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * One operator's connection to an {@link AdminConsole}. Input arrives in arbitrary chunks and is buffered
 * until a newline completes a command. At most {@link AdminConsole#MAX_COMMAND_LENGTH} characters of a
 * command, plus a trailing carriage return, are buffered; the rest of the line is counted and discarded.
 */
public final class AdminSession {

    private static final Logger LOGGER = LoggerFactory.getLogger(AdminSession.class);

    private final long id;
    private final @Nullable String client;
    private final PrintWriter out;
    private final AdminConsole console;
    private final StringBuilder pending = new StringBuilder();
    private long dropped;
    private boolean droppedCarriageReturn;
    private boolean closed;

    AdminSession(long id, @Nullable String client, Writer output, AdminConsole console) {
        this.id = id;
        this.client = client;
        this.out = output instanceof PrintWriter ? (PrintWriter) output : new PrintWriter(output);
        this.console = console;
    }

    public long id() {
        return id;
    }

    public @Nullable String client() {
        return client;
    }

    PrintWriter out() {
        return out;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Accepts input from the operator, running each complete command.
     *
     * @param input the input received
     * @return false once the session has ended
     */
    public boolean receive(CharSequence input) {
        if (closed) {
            return false;
        }
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (c != '\n') {
                buffer(c);
                continue;
            }
            String line = takeLine();
            if (!console.execute(this, line, out)) {
                out.println("Goodbye.");
                out.flush();
                close();
                return false;
            }
            out.print(AdminConsole.PROMPT);
        }
        out.flush();
        return true;
    }

    private void buffer(char c) {
        if (pending.length() <= AdminConsole.MAX_COMMAND_LENGTH) {
            pending.append(c);
        }
        else {
            dropped++;
            droppedCarriageReturn = c == '\r';
        }
    }

    int pendingLength() {
        return pending.length();
    }

    private String takeLine() {
        int end = pending.length();
        if (dropped == 0 && end > 0 && pending.charAt(end - 1) == '\r') {
            end--;
        }
        String line = pending.substring(0, end);
        long length = line.length() + dropped - (droppedCarriageReturn ? 1 : 0);
        pending.setLength(0);
        dropped = 0;
        droppedCarriageReturn = false;
        if (line.length() > AdminConsole.MAX_COMMAND_LENGTH) {
            LOGGER.warn("Admin console session {}: command of {} characters truncated to {}", id, length, AdminConsole.MAX_COMMAND_LENGTH);
            line = line.substring(0, AdminConsole.MAX_COMMAND_LENGTH);
        }
        return line;
    }

    /**
     * Ends the session. Closing a closed session has no effect.
     */
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        pending.setLength(0);
        dropped = 0;
        console.closed(this);
    }
}
