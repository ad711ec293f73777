/*
 * Copyright Kroxylicious Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.qroxy.app;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Clock;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.qroxy.proxy.QueryProxy;
import io.qroxy.proxy.config.ConfigParser;
import io.qroxy.proxy.config.Configuration;
import io.qroxy.proxy.config.PluginFactoryRegistry;
import io.qroxy.proxy.query.Query;
import io.qroxy.proxy.query.Reply;
import io.qroxy.proxy.session.ClientSession;

import edu.umd.cs.findbugs.annotations.Nullable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * Qroxy application entrypoint
 */
@Command(name = "qroxy", mixinStandardHelpOptions = true, versionProvider = Qroxy.VersionProvider.class, description = "Validates a query interception configuration and replays SQL statements through it")
public class Qroxy implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger("io.qroxy.proxy.StartupShutdownLogger");
    private static final String UNKNOWN = "unknown";
    private final QueryProxyBuilder proxyBuilder;
    private final Clock clock;

    interface QueryProxyBuilder {
        QueryProxy build(Configuration config, PluginFactoryRegistry registry, Clock clock);
    }

    Qroxy() {
        this(QueryProxy::new, Clock.systemDefaultZone());
    }

    Qroxy(QueryProxyBuilder proxyBuilder, Clock clock) {
        this.proxyBuilder = proxyBuilder;
        this.clock = clock;
    }

    @Spec
    private CommandSpec spec;

    @Option(names = { "-c", "--config" }, description = "name of the configuration file", required = true)
    private File configFile;

    @Option(names = "--replay", description = "file of SQL statements to replay, one per line")
    private @Nullable File replayFile;

    @Option(names = "--service", description = "service to replay the statements through, the first service by default")
    private @Nullable String serviceName;

    @Option(names = "--user", description = "user of the replayed session")
    private @Nullable String user;

    @Option(names = "--client-host", description = "client address of the replayed session")
    private @Nullable String clientHost;

    @Override
    public Integer call() throws Exception {
        if (!configFile.exists()) {
            throw new ParameterException(spec.commandLine(), String.format("Given configuration file does not exist: %s", configFile.toPath().toAbsolutePath()));
        }
        if (replayFile != null && !replayFile.exists()) {
            throw new ParameterException(spec.commandLine(), String.format("Given replay file does not exist: %s", replayFile.toPath().toAbsolutePath()));
        }

        ConfigParser configParser = new ConfigParser();
        try (InputStream stream = Files.newInputStream(configFile.toPath())) {
            Configuration config = configParser.parseConfiguration(stream);
            printVersions();
            try (QueryProxy proxy = proxyBuilder.build(config, configParser, clock)) {
                LOGGER.info("Configuration '{}' is valid, services {}", configFile, proxy.serviceNames());
                PrintWriter out = spec.commandLine().getOut();
                if (replayFile != null) {
                    replay(proxy, replayFile, out);
                }
                else {
                    proxy.serviceDiagnostics(out);
                }
                out.flush();
            }
        }
        catch (ParameterException e) {
            throw e;
        }
        catch (Exception e) {
            LOGGER.error("Exception on startup", e);
            throw e;
        }

        return 0;
    }

    private void replay(QueryProxy proxy, File statementFile, PrintWriter out) throws IOException {
        String service = serviceName != null ? serviceName : proxy.serviceNames().get(0);
        if (!proxy.serviceNames().contains(service)) {
            throw new ParameterException(spec.commandLine(), String.format("Unknown service '%s', known services are %s", service, proxy.serviceNames()));
        }
        LoggingRouter router = new LoggingRouter();
        ClientSession session = proxy.openSession(service, clientHost, user, router, reply -> {
            reply.release();
            return true;
        });
        try {
            for (String statement : statements(statementFile)) {
                Query query = Query.ofSql(statement);
                try {
                    session.routeQuery(query);
                    session.clientReply(Reply.ok());
                }
                finally {
                    query.release();
                }
            }
            LOGGER.info("Replayed {} statement(s) through service '{}'", router.routed(), service);
            proxy.serviceDiagnostics(out);
            proxy.sessionDiagnostics(out);
        }
        finally {
            session.close();
        }
    }

    private static List<String> statements(File statementFile) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(statementFile.toPath(), StandardCharsets.UTF_8)) {
            return reader.lines()
                    .map(String::strip)
                    .filter(line -> !line.isEmpty() && !line.startsWith("--"))
                    .toList();
        }
    }

    private static void printVersions() throws Exception {
        String[] versions = new VersionProvider().getVersion();
        for (String version : versions) {
            LOGGER.info("{}", version);
        }
        LOGGER.atInfo()
                .setMessage("Platform: Java {}({}) running on {} {}/{}")
                .addArgument(Runtime::version)
                .addArgument(() -> System.getProperty("java.vendor"))
                .addArgument(() -> System.getProperty("os.name"))
                .addArgument(() -> System.getProperty("os.version"))
                .addArgument(() -> System.getProperty("os.arch"))
                .log();
    }

    /**
     * Qroxy entry point
     * @param args args
     */
    public static void main(String... args) {
        int exitCode = new CommandLine(new Qroxy()).execute(args);
        System.exit(exitCode);
    }

    static class VersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() throws Exception {
            try (InputStream resource = this.getClass().getClassLoader().getResourceAsStream("META-INF/metadata.properties")) {
                if (resource != null) {
                    Properties properties = new Properties();
                    properties.load(resource);
                    return new String[]{ "qroxy: " + properties.getProperty("qroxy.version", UNKNOWN) };
                }
            }
            return new String[]{ UNKNOWN };
        }
    }
}
