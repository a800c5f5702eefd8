package io.arrayshim.flight.server.auth;

import com.typesafe.config.ConfigFactory;
import io.arrayshim.flight.store.Role;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigBasedAuthenticatorTest {

    private static ConfigBasedAuthenticator authenticator;

    @BeforeAll
    public static void setup() {
        authenticator = new ConfigBasedAuthenticator(ConfigFactory.parseString("""
                users = [
                  { username = "alice", password = "pw" }
                  { username = "root", password = "secret", admin = true }
                ]
                """));
    }

    @ParameterizedTest
    @CsvSource({
            "alice, pw, false, REGULAR",
            "root, secret, false, REGULAR",
            "root, secret, true, ADMIN"
    })
    public void testAccepted(String identity, String credential, boolean admin, Role expected) {
        assertEquals(Optional.of(expected), authenticator.authenticate(identity, credential, admin));
    }

    @ParameterizedTest
    @CsvSource({
            "alice, wrong, false",
            "alice, pw, true",
            "bob, pw, false",
            "root, pw, true"
    })
    public void testRefused(String identity, String credential, boolean admin) {
        assertEquals(Optional.empty(), authenticator.authenticate(identity, credential, admin));
    }

    @Test
    public void testEmptyCredentialRefused() {
        var withEmptyPassword = new ConfigBasedAuthenticator(ConfigFactory.parseString("""
                users = [ { username = "nobody", password = "" } ]
                """));
        assertEquals(Optional.empty(), withEmptyPassword.authenticate("nobody", "", false));
    }
}
