package io.arrayshim.flight.server.auth;

import com.typesafe.config.Config;
import io.arrayshim.common.database.DatabaseCallExecutor;
import io.arrayshim.common.database.DatabaseClient;
import io.arrayshim.flight.store.UnauthorizedException;
import org.apache.arrow.flight.CallHeaders;
import org.apache.arrow.flight.CallOption;
import org.apache.arrow.flight.CallStatus;
import org.apache.arrow.flight.FlightCallHeaders;
import org.apache.arrow.flight.FlightConstants;
import org.apache.arrow.flight.FlightProducer;
import org.apache.arrow.flight.HeaderCallOption;
import org.apache.arrow.flight.ServerHeaderMiddleware;
import org.apache.arrow.flight.auth.ClientAuthHandler;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Iterator;

public class AuthUtils {

    public static final String AUTHORIZATION_HEADER = "authorization";
    public static final String BEARER_PREFIX = "Bearer ";

    public static final String AUTHENTICATOR_KEY = "authenticator";
    public static final String TYPE_KEY = "type";
    public static final String TYPE_CONFIG = "config";
    public static final String TYPE_DATABASE = "database";

    private AuthUtils() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Creates the authenticator described by the {@code authenticator} section: {@code type =
     * config} checks the users listed in the configuration, {@code type = database} checks
     * credentials against the backing database.
     */
    public static Authenticator getAuthenticator(Config config, DatabaseClient databaseClient,
                                                 DatabaseCallExecutor callExecutor) {
        var authConfig = config.getConfig(AUTHENTICATOR_KEY);
        var type = authConfig.hasPath(TYPE_KEY) ? authConfig.getString(TYPE_KEY) : TYPE_CONFIG;
        return switch (type) {
            case TYPE_CONFIG -> new ConfigBasedAuthenticator(authConfig);
            case TYPE_DATABASE -> new DatabaseAuthenticator(databaseClient, callExecutor,
                    authConfig.hasPath(DatabaseAuthenticator.ADMIN_USERS_KEY)
                            ? new HashSet<>(authConfig.getStringList(DatabaseAuthenticator.ADMIN_USERS_KEY))
                            : new HashSet<>());
            default -> throw new IllegalArgumentException("Unknown authenticator type " + type);
        };
    }

    /**
     * Reads the session token of a call from its {@code authorization} header. A
     * {@code Bearer } prefix is accepted.
     *
     * @throws UnauthorizedException when the call carries no token
     * @throws org.apache.arrow.flight.FlightRuntimeException with status {@code UNKNOWN}
     *         when the header value is not a printable ASCII token
     */
    public static String readSessionToken(FlightProducer.CallContext context) throws UnauthorizedException {
        ServerHeaderMiddleware middleware = context.getMiddleware(FlightConstants.HEADER_KEY);
        if (middleware == null) {
            throw new UnauthorizedException(UnauthorizedException.Reason.NO_TOKEN);
        }
        return readSessionToken(middleware.headers());
    }

    public static String readSessionToken(CallHeaders headers) throws UnauthorizedException {
        if (!headers.containsKey(AUTHORIZATION_HEADER)) {
            throw new UnauthorizedException(UnauthorizedException.Reason.NO_TOKEN);
        }
        var value = headers.get(AUTHORIZATION_HEADER);
        if (value == null) {
            throw new UnauthorizedException(UnauthorizedException.Reason.NO_TOKEN);
        }
        if (value.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            value = value.substring(BEARER_PREFIX.length());
        }
        if (value.isEmpty() || !isPrintableAscii(value)) {
            throw CallStatus.UNKNOWN.withDescription("error reading request header").toRuntimeException();
        }
        return value;
    }

    private static boolean isPrintableAscii(String value) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < 0x20 || c > 0x7e) {
                return false;
            }
        }
        return true;
    }

    /**
     * Call option presenting {@code token} in the {@code authorization} header.
     */
    public static CallOption sessionToken(String token) {
        var headers = new FlightCallHeaders();
        headers.insert(AUTHORIZATION_HEADER, token);
        return new HeaderCallOption(headers);
    }

    /**
     * Client side of the handshake. After {@code FlightClient#authenticate} returns,
     * {@link #token()} holds the session token.
     */
    public static class HandshakeClientAuthHandler implements ClientAuthHandler {

        private final String identity;
        private final String credential;
        private final boolean admin;
        private volatile String token;

        public HandshakeClientAuthHandler(String identity, String credential, boolean admin) {
            this.identity = identity;
            this.credential = credential;
            this.admin = admin;
        }

        @Override
        public void authenticate(ClientAuthSender outgoing, Iterator<byte[]> incoming) {
            outgoing.send(identity.getBytes(StandardCharsets.UTF_8));
            outgoing.send(credential.getBytes(StandardCharsets.UTF_8));
            outgoing.send((admin ? "1" : "0").getBytes(StandardCharsets.UTF_8));
            token = new String(incoming.next(), StandardCharsets.UTF_8);
        }

        @Override
        public byte[] getCallToken() {
            return token == null ? new byte[0] : token.getBytes(StandardCharsets.UTF_8);
        }

        public String token() {
            return token;
        }
    }
}
