/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.admin;

import java.io.PrintWriter;
import java.io.Writer;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.qroxy.proxy.QueryProxy;
import io.qroxy.proxy.session.ClientSession;
import io.qroxy.proxy.session.SessionRegistry;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * <p>A line-oriented debugging console onto a running {@link QueryProxy}.</p>
 *
 * <p>Each connected operator gets an {@link AdminSession}, registered with the console until it quits or
 * is closed. Commands are {@code help}, {@code show services}, {@code show filters}, {@code show sessions},
 * {@code show consoles} and {@code quit}. In {@link ConsoleMode#DEVELOPER} mode
 * {@code close session <id>} is also available.</p>
 */
public final class AdminConsole {

    private static final Logger LOGGER = LoggerFactory.getLogger(AdminConsole.class);

    static final int MAX_COMMAND_LENGTH = 80;
    static final String PROMPT = "qroxy> ";

    private final QueryProxy proxy;
    private final ConsoleMode mode;
    private final SessionRegistry<AdminSession> consoles = new SessionRegistry<>();
    private final AtomicLong consoleIds = new AtomicLong();

    public AdminConsole(QueryProxy proxy, ConsoleMode mode) {
        this.proxy = Objects.requireNonNull(proxy);
        this.mode = Objects.requireNonNull(mode);
    }

    public ConsoleMode mode() {
        return mode;
    }

    /**
     * Opens a console session, writing the welcome banner and the first prompt.
     *
     * @param client the operator's address, if known
     * @param output where the session's output is written
     * @return the session
     */
    public AdminSession open(@Nullable String client, Writer output) {
        AdminSession session = new AdminSession(consoleIds.incrementAndGet(), client, output, this);
        consoles.register(session);
        PrintWriter out = session.out();
        out.print("Welcome to the qroxy admin console.\n");
        out.print("Type help for a list of available commands.\n\n");
        if (mode == ConsoleMode.DEVELOPER) {
            out.print("WARNING: This console is running in developer mode, commands can change the state of the proxy.\n\n");
        }
        out.print(PROMPT);
        out.flush();
        LOGGER.debug("Admin console session {} opened from {}", session.id(), client);
        return session;
    }

    /**
     * @return the open console sessions, newest first
     */
    public List<AdminSession> sessions() {
        return consoles.snapshot();
    }

    void closed(AdminSession session) {
        consoles.deregister(session);
        LOGGER.debug("Admin console session {} closed", session.id());
    }

    /**
     * Runs one command line.
     * @return false if the session should end
     */
    boolean execute(AdminSession session, String line, PrintWriter out) {
        String[] words = line.trim().toLowerCase(Locale.ROOT).split("\\s+");
        String command = String.join(" ", words);
        switch (command) {
            case "":
                return true;
            case "help":
                help(out);
                return true;
            case "show services":
                showServices(out);
                return true;
            case "show filters":
                proxy.serviceDiagnostics(out);
                return true;
            case "show sessions":
                proxy.sessionDiagnostics(out);
                return true;
            case "show consoles":
                showConsoles(session, out);
                return true;
            case "quit":
                return false;
            default:
                if (words.length == 3 && command.startsWith("close session ") && mode == ConsoleMode.DEVELOPER) {
                    closeSession(words[2], out);
                }
                else {
                    out.printf("Unknown command '%s'. Type help for a list of available commands.%n", line.trim());
                }
                return true;
        }
    }

    private void help(PrintWriter out) {
        out.println("Available commands:");
        out.println("  help                  Show this list");
        out.println("  show services         Show the services and their filters");
        out.println("  show filters          Show the state shared by each filter");
        out.println("  show sessions         Show the client sessions and their filters' state");
        out.println("  show consoles         Show the admin console sessions");
        if (mode == ConsoleMode.DEVELOPER) {
            out.println("  close session <id>    Close a client session");
        }
        out.println("  quit                  Leave the console");
    }

    private void showServices(PrintWriter out) {
        for (String service : proxy.serviceNames()) {
            out.printf("Service %s: %s%n", service, String.join(" | ", proxy.filterNames(service)));
        }
    }

    private void showConsoles(AdminSession current, PrintWriter out) {
        for (AdminSession session : consoles.snapshot()) {
            out.printf("Console %d from %s%s%n",
                    session.id(),
                    session.client() == null ? "unknown" : session.client(),
                    session == current ? " (this session)" : "");
        }
    }

    private void closeSession(String id, PrintWriter out) {
        long sessionId;
        try {
            sessionId = Long.parseLong(id);
        }
        catch (NumberFormatException e) {
            out.printf("Invalid session id '%s'.%n", id);
            return;
        }
        Optional<ClientSession> session = proxy.findSession(sessionId);
        if (session.isEmpty()) {
            out.printf("No session %d.%n", sessionId);
            return;
        }
        session.get().close();
        LOGGER.info("Session {} closed from admin console", sessionId);
        if (session.get().isClosed()) {
            out.printf("Session %d closed.%n", sessionId);
        }
        else {
            out.printf("Session %d will close when its current statement leaves the filters.%n", sessionId);
        }
    }
}
