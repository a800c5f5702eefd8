package io.arrayshim.flight.server.auth;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigObject;
import io.arrayshim.flight.store.Role;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Users listed in the {@code users} section of the authenticator configuration. Only
 * SHA-256 digests of the passwords are kept in memory.
 */
public class ConfigBasedAuthenticator implements Authenticator {

    public static final String USERS_KEY = "users";
    public static final String USERNAME_KEY = "username";
    public static final String PASSWORD_KEY = "password";
    public static final String ADMIN_KEY = "admin";

    private record User(byte[] passwordHash, boolean admin) { }

    private final Map<String, User> users = new HashMap<>();

    public ConfigBasedAuthenticator(Config config) {
        List<? extends ConfigObject> entries = config.hasPath(USERS_KEY) ? config.getObjectList(USERS_KEY) : List.of();
        entries.forEach(o -> {
            var user = o.toConfig();
            var admin = user.hasPath(ADMIN_KEY) && user.getBoolean(ADMIN_KEY);
            users.put(user.getString(USERNAME_KEY), new User(hash(user.getString(PASSWORD_KEY)), admin));
        });
    }

    @Override
    public Optional<Role> authenticate(String identity, String credential, boolean adminRequested) {
        var user = users.get(identity);
        if (user == null || credential.isEmpty()
                || !MessageDigest.isEqual(user.passwordHash(), hash(credential))) {
            return Optional.empty();
        }
        if (!adminRequested) {
            return Optional.of(Role.REGULAR);
        }
        return user.admin() ? Optional.of(Role.ADMIN) : Optional.empty();
    }

    static byte[] hash(String value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
