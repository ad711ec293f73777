/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy.admin;

import java.io.StringWriter;
import java.time.Instant;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import io.qroxy.proxy.QueryProxy;
import io.qroxy.proxy.config.ConfigParser;
import io.qroxy.proxy.session.ClientSession;
import io.qroxy.test.filter.RecordingDownstream;
import io.qroxy.test.filter.RecordingUpstream;
import io.qroxy.test.time.ManualClock;

import static org.assertj.core.api.Assertions.assertThat;

class AdminConsoleTest {

    private static final String CONFIG = """
            filterDefinitions:
              - name: counting
                type: TestFilterFactory
                config:
                  label: one
            services:
              - name: rw-split
                filters: [counting]
            adminConsole:
              mode: %s
            """;

    private final ConfigParser configParser = new ConfigParser();
    private QueryProxy proxy;

    private AdminConsole console(String mode) {
        proxy = new QueryProxy(configParser.parseConfiguration(CONFIG.formatted(mode)), configParser,
                new ManualClock(Instant.parse("2024-01-15T10:00:00Z")));
        return proxy.adminConsole().orElseThrow();
    }

    @AfterEach
    void tearDown() {
        if (proxy != null) {
            proxy.close();
        }
    }

    @Test
    void shouldGreetAndPrompt() {
        StringWriter out = new StringWriter();

        console("user").open("127.0.0.1", out);

        assertThat(out.toString()).isEqualTo("Welcome to the qroxy admin console.\n"
                + "Type help for a list of available commands.\n\n"
                + "qroxy> ");
    }

    @Test
    void shouldWarnInDeveloperMode() {
        StringWriter out = new StringWriter();

        AdminConsole console = console("developer");
        console.open("127.0.0.1", out);

        assertThat(console.mode()).isEqualTo(ConsoleMode.DEVELOPER);
        assertThat(out.toString()).contains("WARNING: This console is running in developer mode");
    }

    @Test
    void shouldBufferUntilNewline() {
        StringWriter out = new StringWriter();
        AdminSession session = console("user").open(null, out);
        int greeting = out.toString().length();

        assertThat(session.receive("sho")).isTrue();
        assertThat(out.toString()).hasSize(greeting);
        assertThat(session.receive("w services\r\n")).isTrue();

        assertThat(out.toString().substring(greeting)).isEqualTo("Service rw-split: counting" + System.lineSeparator() + "qroxy> ");
    }

    @Test
    void shouldListCommands() {
        StringWriter out = new StringWriter();
        AdminSession session = console("user").open(null, out);

        session.receive("help\n");

        assertThat(out.toString())
                .contains("show services", "show filters", "show sessions", "show consoles", "quit")
                .doesNotContain("close session");
    }

    @Test
    void shouldShowFilterDiagnostics() {
        StringWriter out = new StringWriter();
        AdminSession session = console("user").open(null, out);

        session.receive("SHOW   FILTERS\n");

        assertThat(out.toString()).contains("Service rw-split", "Filter counting (TestFilterFactory)", "  Label: one");
    }

    @Test
    void shouldShowClientSessions() {
        StringWriter out = new StringWriter();
        AdminSession session = console("user").open(null, out);
        ClientSession client = proxy.openSession("rw-split", "10.0.0.1", "alice", new RecordingDownstream(), new RecordingUpstream());

        session.receive("show sessions\n");

        assertThat(out.toString()).contains("1 open session(s)", "Session " + client.id(), "alice@10.0.0.1", "    Filter counting");
    }

    @Test
    void shouldShowConsoles() {
        AdminConsole console = console("user");
        StringWriter first = new StringWriter();
        AdminSession firstSession = console.open("10.1.1.1", first);
        AdminSession secondSession = console.open(null, new StringWriter());

        firstSession.receive("show consoles\n");

        assertThat(first.toString())
                .contains("Console " + firstSession.id() + " from 10.1.1.1 (this session)")
                .contains("Console " + secondSession.id() + " from unknown");
        assertThat(console.sessions()).containsExactly(secondSession, firstSession);
    }

    @Test
    void quitShouldDeregisterSession() {
        AdminConsole console = console("user");
        StringWriter out = new StringWriter();
        AdminSession session = console.open(null, out);

        assertThat(session.receive("quit\nhelp\n")).isFalse();

        assertThat(session.isClosed()).isTrue();
        assertThat(console.sessions()).isEmpty();
        assertThat(out.toString()).endsWith("Goodbye." + System.lineSeparator()).doesNotContain("Available commands");
        assertThat(session.receive("help\n")).isFalse();
    }

    @Test
    void closeShouldDeregisterSession() {
        AdminConsole console = console("user");
        AdminSession session = console.open(null, new StringWriter());

        session.close();
        session.close();

        assertThat(console.sessions()).isEmpty();
    }

    @Test
    void shouldReportUnknownCommand() {
        StringWriter out = new StringWriter();
        AdminSession session = console("user").open(null, out);

        assertThat(session.receive("frobnicate\n")).isTrue();

        assertThat(out.toString()).contains("Unknown command 'frobnicate'. Type help for a list of available commands.");
    }

    @Test
    void shouldTruncateLongCommands() {
        StringWriter out = new StringWriter();
        AdminSession session = console("user").open(null, out);

        session.receive("x".repeat(100) + "\n");

        assertThat(out.toString()).contains("Unknown command '" + "x".repeat(80) + "'.");
    }

    @Test
    void shouldBoundBufferedInputOfUnterminatedCommand() {
        StringWriter out = new StringWriter();
        AdminSession session = console("user").open(null, out);
        String chunk = "x".repeat(1_000_000);

        for (int i = 0; i < 20; i++) {
            assertThat(session.receive(chunk)).isTrue();
        }

        assertThat(session.pendingLength()).isEqualTo(AdminConsole.MAX_COMMAND_LENGTH + 1);

        session.receive("\r\nhelp\n");

        assertThat(session.pendingLength()).isZero();
        assertThat(out.toString()).contains("Unknown command '" + "x".repeat(80) + "'.", "Available commands:");
    }

    @Test
    void shouldKeepCommandOfMaximumLengthEndingInCarriageReturn() {
        StringWriter out = new StringWriter();
        AdminSession session = console("user").open(null, out);

        session.receive("y".repeat(80) + "\r\n");

        assertThat(out.toString()).contains("Unknown command '" + "y".repeat(80) + "'.");
    }

    @Test
    void shouldSplitWordsOnAnyWhitespace() {
        StringWriter out = new StringWriter();
        AdminSession session = console("user").open(null, out);

        session.receive("show\tservices\n");

        assertThat(out.toString()).contains("Service rw-split: counting")
                .doesNotContain("Unknown command");
    }

    @Test
    void closeSessionShouldRequireDeveloperMode() {
        StringWriter out = new StringWriter();
        AdminSession session = console("user").open(null, out);
        ClientSession client = proxy.openSession("rw-split", null, null, new RecordingDownstream(), new RecordingUpstream());

        session.receive("close session " + client.id() + "\n");

        assertThat(client.isClosed()).isFalse();
        assertThat(out.toString()).contains("Unknown command");
    }

    @Test
    void developerShouldCloseClientSession() {
        StringWriter out = new StringWriter();
        AdminSession session = console("developer").open(null, out);
        ClientSession client = proxy.openSession("rw-split", null, null, new RecordingDownstream(), new RecordingUpstream());

        session.receive("close session " + client.id() + "\nclose session 999\nclose session abc\n");

        assertThat(client.isClosed()).isTrue();
        assertThat(proxy.sessions()).isEmpty();
        assertThat(out.toString()).contains("Session " + client.id() + " closed.", "No session 999.", "Invalid session id 'abc'.");
    }
}
