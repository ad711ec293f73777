/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.qroxy.proxy;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.qroxy.proxy.config.ConfigParser;
import io.qroxy.proxy.config.Configuration;
import io.qroxy.proxy.plugin.PluginConfigurationException;
import io.qroxy.proxy.plugin.UnknownPluginInstanceException;
import io.qroxy.proxy.query.Query;
import io.qroxy.proxy.session.ClientSession;
import io.qroxy.test.filter.RecordingDownstream;
import io.qroxy.test.filter.RecordingUpstream;
import io.qroxy.test.time.ManualClock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryProxyTest {

    private static final String CONFIG = """
            queryClassifier: KeywordQueryClassifier
            filterDefinitions:
              - name: first
                type: TestFilterFactory
                config:
                  label: one
              - name: second
                type: TestFilterFactory
            services:
              - name: rw-split
                filters: [first, second]
              - name: plain
            adminConsole:
              mode: user
            """;

    private final ConfigParser configParser = new ConfigParser();
    private final ManualClock clock = new ManualClock(Instant.parse("2024-01-15T10:00:00Z"));
    private final RecordingDownstream router = new RecordingDownstream();
    private final RecordingUpstream client = new RecordingUpstream();
    private QueryProxy proxy;

    @BeforeEach
    void setUp() {
        proxy = new QueryProxy(configParser.parseConfiguration(CONFIG), configParser, clock);
    }

    @AfterEach
    void tearDown() {
        proxy.close();
    }

    @Test
    void shouldStartEveryService() {
        assertThat(proxy.serviceNames()).containsExactly("rw-split", "plain");
        assertThat(proxy.filterNames("rw-split")).containsExactly("first", "second");
        assertThat(proxy.filterNames("plain")).isEmpty();
        assertThat(proxy.adminConsole()).isPresent();
    }

    @Test
    void shouldOpenSessionsWithDistinctIds() {
        ClientSession first = proxy.openSession("rw-split", "10.0.0.1", "alice", router, client);
        clock.advanceMillis(1000);
        ClientSession second = proxy.openSession("plain", "10.0.0.2", "bob", router, client);

        assertThat(first.id()).isNotEqualTo(second.id());
        assertThat(second.connectedAt()).isEqualTo(Instant.parse("2024-01-15T10:00:01Z"));
        assertThat(proxy.sessions()).containsExactly(second, first);
        assertThat(proxy.findSession(first.id())).containsSame(first);
    }

    @Test
    void closingSessionShouldDeregisterIt() {
        ClientSession session = proxy.openSession("rw-split", "10.0.0.1", "alice", router, client);

        session.close();

        assertThat(proxy.sessions()).isEmpty();
        assertThat(proxy.findSession(session.id())).isEmpty();
    }

    @Test
    void shouldRejectUnknownService() {
        assertThatThrownBy(() -> proxy.openSession("nope", null, null, router, client))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown service 'nope', known services are [rw-split, plain]");
    }

    @Test
    void closingProxyShouldCloseSessions() {
        ClientSession session = proxy.openSession("rw-split", "10.0.0.1", "alice", router, client);

        proxy.close();

        assertThat(session.isClosed()).isTrue();
        assertThat(proxy.sessions()).isEmpty();
    }

    @Test
    void shouldWriteServiceAndSessionDiagnostics() {
        ClientSession session = proxy.openSession("rw-split", "10.0.0.1", "alice", router, client);
        session.routeQuery(Query.ofSql("select 1"));

        StringWriter services = new StringWriter();
        proxy.serviceDiagnostics(new PrintWriter(services, true));
        StringWriter sessions = new StringWriter();
        proxy.sessionDiagnostics(new PrintWriter(sessions, true));

        assertThat(services.toString().lines()).containsExactly(
                "Query classifier: KeywordQueryClassifier",
                "Service rw-split",
                "Filter first (TestFilterFactory)",
                "  Label: one",
                "Filter second (TestFilterFactory)",
                "  Label: null",
                "Service plain");
        assertThat(sessions.toString())
                .startsWith("1 open session(s)" + System.lineSeparator() + "Session " + session.id())
                .contains("    Filter first", "    Filter second", "      Queries: 1");
    }

    @Test
    void shouldFailToStartWithUnknownClassifier() {
        Configuration configuration = configParser.parseConfiguration("""
                queryClassifier: NoSuchClassifier
                services:
                  - name: plain
                """);

        assertThatThrownBy(() -> new QueryProxy(configuration, configParser, clock))
                .isInstanceOf(UnknownPluginInstanceException.class);
    }

    @Test
    void shouldFailToStartWhenAFilterCannotBeInitialized() {
        Configuration configuration = configParser.parseConfiguration("""
                filterDefinitions:
                  - name: needy
                    type: RequiresConfigFactory
                services:
                  - name: plain
                    filters: [needy]
                """);

        assertThatThrownBy(() -> new QueryProxy(configuration, configParser, clock))
                .isInstanceOf(PluginConfigurationException.class)
                .hasMessageContaining("RequiresConfigFactory requires configuration");
    }

    @Test
    void filtersShouldBeCreatedPerSession() {
        ClientSession first = proxy.openSession("rw-split", "10.0.0.1", "alice", router, client);
        ClientSession second = proxy.openSession("rw-split", "10.0.0.1", "alice", router, client);

        first.routeQuery(Query.ofSql("select 1"));

        StringWriter out = new StringWriter();
        second.diagnostics(new PrintWriter(out, true));
        assertThat(out.toString()).contains("      Queries: 0");
    }
}
