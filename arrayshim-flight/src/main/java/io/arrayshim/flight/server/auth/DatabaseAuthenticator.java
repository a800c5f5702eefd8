package io.arrayshim.flight.server.auth;

import io.arrayshim.common.database.DatabaseCallExecutor;
import io.arrayshim.common.database.DatabaseClient;
import io.arrayshim.common.database.DatabaseConnection;
import io.arrayshim.flight.store.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;

/**
 * Accepts exactly the credentials the backing database accepts. An administrative session
 * is granted only to identities listed in {@code admin_users}.
 */
public class DatabaseAuthenticator implements Authenticator {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseAuthenticator.class);

    public static final String ADMIN_USERS_KEY = "admin_users";

    private final DatabaseClient databaseClient;
    private final DatabaseCallExecutor callExecutor;
    private final Set<String> adminUsers;

    public DatabaseAuthenticator(DatabaseClient databaseClient, DatabaseCallExecutor callExecutor, Set<String> adminUsers) {
        this.databaseClient = databaseClient;
        this.callExecutor = callExecutor;
        this.adminUsers = Set.copyOf(adminUsers);
    }

    @Override
    public Optional<Role> authenticate(String identity, String credential, boolean adminRequested) throws Exception {
        if (adminRequested && !adminUsers.contains(identity)) {
            return Optional.empty();
        }
        var accepted = callExecutor.call(() -> {
            try (var connection = databaseClient.connect(identity, credential)) {
                if (connection instanceof DatabaseConnection.Closed closed) {
                    logger.debug("Backing database refused {}: {} {}", identity, closed.code(), closed.message());
                    return false;
                }
                return true;
            }
        });
        if (!accepted) {
            return Optional.empty();
        }
        return Optional.of(adminRequested ? Role.ADMIN : Role.REGULAR);
    }
}
