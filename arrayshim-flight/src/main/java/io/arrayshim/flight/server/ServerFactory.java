package io.arrayshim.flight.server;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.typesafe.config.Config;
import io.arrayshim.common.ConfigBasedProvider;
import io.arrayshim.common.ConfigBasedStartupScriptProvider;
import io.arrayshim.common.StartupScriptProvider;
import io.arrayshim.common.database.DatabaseCallExecutor;
import io.arrayshim.common.database.DatabaseClient;
import io.arrayshim.common.database.JdbcDatabaseClient;
import io.arrayshim.flight.BrokerRecorder;
import io.arrayshim.flight.MicroMeterBrokerRecorder;
import io.arrayshim.flight.context.ContextBuilder;
import io.arrayshim.flight.context.ContextManager;
import io.arrayshim.flight.context.IngestingContextBuilder;
import io.arrayshim.flight.context.QueryContext;
import io.arrayshim.flight.server.auth.Authenticator;
import io.arrayshim.flight.server.auth.AuthUtils;
import io.arrayshim.flight.server.auth.HandshakeAuthHandler;
import io.arrayshim.flight.store.SessionTokenStore;
import io.arrayshim.flight.store.TicketStore;
import io.micrometer.core.instrument.logging.LoggingMeterRegistry;
import org.apache.arrow.flight.FlightServer;
import org.apache.arrow.flight.Location;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.Executors;

/**
 * Assembles a {@link BrokerServer} from configuration. Every collaborator can be replaced
 * through the builder; anything not supplied is created from the configuration.
 *
 * <pre>{@code
 * BrokerServer server = ServerFactory.builder(config)
 *         .withCredentials("svc", "secret")
 *         .build()
 *         .start();
 * }</pre>
 */
public final class ServerFactory {

    private static final Logger logger = LoggerFactory.getLogger(ServerFactory.class);

    public static final String FLIGHT_HOST_KEY = "flight.host";
    public static final String FLIGHT_PORT_KEY = "flight.port";
    public static final String FLIGHT_USE_ENCRYPTION_KEY = "flight.use_encryption";
    public static final String FLIGHT_KEYSTORE_KEY = "flight.keystore";
    public static final String FLIGHT_SERVER_CERT_KEY = "flight.server_cert";
    public static final String ITEM_EXPIRATION_AGE_KEY = "item_expiration_age";
    public static final String FETCH_SIZE_KEY = "fetch_size";
    public static final String DATABASE_URL_KEY = "database.url";
    public static final String DATABASE_USERNAME_KEY = "database.username";
    public static final String DATABASE_PASSWORD_KEY = "database.password";
    public static final String DATABASE_MAX_CONCURRENT_CALLS_KEY = "database.max_concurrent_calls";
    public static final String PRODUCER_ID_KEY = "producer_id";

    private ServerFactory() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static ServerBuilder builder(Config config) {
        return new ServerBuilder(config);
    }

    public static final class ServerBuilder {
        private final Config config;

        private Location location;
        private String producerId;
        private BufferAllocator allocator;
        private Clock clock;
        private String username;
        private String password;
        private DatabaseClient databaseClient;
        private Authenticator authenticator;
        private ContextBuilder contextBuilder;
        private QueryContext initialContext;
        private BrokerRecorder recorder;

        private ServerBuilder(Config config) {
            this.config = config;
        }

        /**
         * Sets the address to listen on instead of {@code flight.host}/{@code flight.port}.
         *
         * @param location the server location
         * @return this builder
         */
        public ServerBuilder withLocation(Location location) {
            this.location = location;
            return this;
        }

        /**
         * @param producerId identifier used to tag metrics
         * @return this builder
         */
        public ServerBuilder withProducerId(String producerId) {
            this.producerId = producerId;
            return this;
        }

        public ServerBuilder withAllocator(BufferAllocator allocator) {
            this.allocator = allocator;
            return this;
        }

        /**
         * Sets the clock session tokens and tickets are aged with.
         *
         * @param clock the clock to use
         * @return this builder
         */
        public ServerBuilder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Sets the service account used to query the backing database, overriding
         * {@code database.username} and {@code database.password}.
         *
         * @return this builder
         */
        public ServerBuilder withCredentials(String username, String password) {
            this.username = username;
            this.password = password;
            return this;
        }

        public ServerBuilder withDatabaseClient(DatabaseClient databaseClient) {
            this.databaseClient = databaseClient;
            return this;
        }

        public ServerBuilder withAuthenticator(Authenticator authenticator) {
            this.authenticator = authenticator;
            return this;
        }

        /**
         * Sets how {@code REFRESH_CONTEXT} rebuilds the query context. Without one, the
         * configured tables are ingested from the backing database.
         *
         * @return this builder
         */
        public ServerBuilder withContextBuilder(ContextBuilder contextBuilder) {
            this.contextBuilder = contextBuilder;
            return this;
        }

        /**
         * Serves {@code initialContext} at startup instead of building one.
         *
         * @return this builder
         */
        public ServerBuilder withInitialContext(QueryContext initialContext) {
            this.initialContext = initialContext;
            return this;
        }

        public ServerBuilder withRecorder(BrokerRecorder recorder) {
            this.recorder = recorder;
            return this;
        }

        /**
         * Builds the server without starting it. Unless an initial context was supplied,
         * the configured tables are loaded first.
         *
         * @throws Exception if the initial context cannot be built or a component fails to load
         */
        public BrokerServer build() throws Exception {
            var finalLocation = location != null ? location : readLocationFromConfig();
            var finalProducerId = producerId != null
                    ? producerId
                    : (config.hasPath(PRODUCER_ID_KEY) ? config.getString(PRODUCER_ID_KEY) : UUID.randomUUID().toString());
            var finalAllocator = allocator != null ? allocator : new RootAllocator();
            var finalClock = clock != null ? clock : Clock.systemUTC();
            var fetchSize = config.getInt(FETCH_SIZE_KEY);
            var expirationAge = config.getDuration(ITEM_EXPIRATION_AGE_KEY);
            var callExecutor = new DatabaseCallExecutor(config.getInt(DATABASE_MAX_CONCURRENT_CALLS_KEY));
            var finalRecorder = recorder != null
                    ? recorder
                    : new MicroMeterBrokerRecorder(new LoggingMeterRegistry(), finalProducerId);

            try {
                var finalDatabaseClient = databaseClient != null
                        ? databaseClient
                        : new JdbcDatabaseClient(config.getString(DATABASE_URL_KEY), fetchSize);
                var finalAuthenticator = authenticator != null
                        ? authenticator
                        : AuthUtils.getAuthenticator(config, finalDatabaseClient, callExecutor);
                var finalContextBuilder = contextBuilder != null
                        ? contextBuilder
                        : new IngestingContextBuilder(finalDatabaseClient, callExecutor,
                                username != null ? username : optionalString(DATABASE_USERNAME_KEY),
                                password != null ? password : optionalString(DATABASE_PASSWORD_KEY),
                                IngestingContextBuilder.TableSource.fromConfig(config),
                                loadStartupScriptProvider(),
                                finalAllocator);
                var finalInitialContext = initialContext != null ? initialContext : finalContextBuilder.rebuild();

                var sessionTokenStore = new SessionTokenStore(finalClock, expirationAge);
                var ticketStore = new TicketStore(finalClock);
                var streamExecutor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                        .setNameFormat("flight-stream-%d")
                        .setDaemon(true)
                        .build());
                var producer = new ArrayFlightProducer(finalProducerId, sessionTokenStore, ticketStore,
                        new ContextManager(finalInitialContext), finalContextBuilder,
                        finalAllocator, fetchSize, streamExecutor, finalRecorder);

                var builder = FlightServer.builder(finalAllocator, finalLocation, producer)
                        .authHandler(new HandshakeAuthHandler(finalAuthenticator, sessionTokenStore, finalRecorder));
                if (config.getBoolean(FLIGHT_USE_ENCRYPTION_KEY)) {
                    builder.useTls(getInputStreamForResource(config.getString(FLIGHT_SERVER_CERT_KEY)),
                            getInputStreamForResource(config.getString(FLIGHT_KEYSTORE_KEY)));
                }
                logger.info("Producer {} configured for {}", finalProducerId, finalLocation.getUri());
                return new BrokerServer(builder.build(), producer, callExecutor, finalAllocator);
            } catch (Exception e) {
                callExecutor.close();
                throw e;
            }
        }

        private String optionalString(String key) {
            return config.hasPath(key) ? config.getString(key) : null;
        }

        private StartupScriptProvider loadStartupScriptProvider() throws Exception {
            return ConfigBasedProvider.load(config, StartupScriptProvider.STARTUP_SCRIPT_CONFIG_PREFIX,
                    StartupScriptProvider.class, new ConfigBasedStartupScriptProvider());
        }

        private Location readLocationFromConfig() {
            var host = config.getString(FLIGHT_HOST_KEY);
            var port = config.getInt(FLIGHT_PORT_KEY);
            return config.getBoolean(FLIGHT_USE_ENCRYPTION_KEY)
                    ? Location.forGrpcTls(host, port)
                    : Location.forGrpcInsecure(host, port);
        }
    }

    /**
     * Opens {@code location} as a file if one exists at that path, otherwise as a classpath
     * resource.
     */
    static InputStream getInputStreamForResource(String location) throws IOException {
        var path = Path.of(location);
        if (Files.isRegularFile(path)) {
            return new FileInputStream(path.toFile());
        }
        var inputStream = Thread.currentThread().getContextClassLoader().getResourceAsStream(location);
        if (inputStream == null) {
            throw new IllegalArgumentException("File not found! : " + location);
        }
        return inputStream;
    }
}
