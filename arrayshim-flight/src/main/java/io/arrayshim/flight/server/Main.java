package io.arrayshim.flight.server;

import com.beust.jcommander.ParameterException;
import com.typesafe.config.Config;
import io.arrayshim.common.ConfigUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        ConfigUtils.CommandLineConfig commandLine;
        try {
            commandLine = ConfigUtils.loadCommandLineConfig(args);
        } catch (ParameterException e) {
            System.err.println(e.getMessage());
            System.exit(2);
            return;
        }
        var config = ConfigUtils.resolve(commandLine);
        var credentials = ServiceCredentials.resolve(commandLine, config, CredentialPrompt.console());
        start(config, credentials);
    }

    public static BrokerServer createServer(Config config, ServiceCredentials credentials) throws Exception {
        long start = System.nanoTime();
        var server = ServerFactory.builder(config)
                .withCredentials(credentials.username(), credentials.password())
                .build();
        logger.info("Server created in {} ms", (System.nanoTime() - start) / 1_000_000);
        return server;
    }

    public static void start(Config config, ServiceCredentials credentials) throws Exception {
        var server = createServer(config, credentials).start();
        logger.info("Flight Server is up: Listening on URI: {}", server.getLocation().getUri());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                server.close();
            } catch (Exception e) {
                logger.atError().setCause(e).log("Error shutting down server");
            }
        }, "shutdown"));
        server.awaitTermination();
    }
}
