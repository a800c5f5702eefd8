package io.arrayshim.flight.server;

import com.typesafe.config.ConfigFactory;
import io.arrayshim.common.ConfigUtils;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ServiceCredentialsTest {

    private static class RecordingPrompt implements CredentialPrompt {
        private final List<String> asked = new ArrayList<>();

        @Override
        public String readUsername() {
            asked.add("username");
            return "prompted-user";
        }

        @Override
        public String readPassword() {
            asked.add("password");
            return "prompted-password";
        }

        @Override
        public String readPasswordFromStdin() {
            asked.add("stdin");
            return "stdin-password";
        }
    }

    @Test
    public void testCommandLineWins() throws Exception {
        var prompt = new RecordingPrompt();
        var commandLine = ConfigUtils.loadCommandLineConfig(new String[]{"-u", "svc", "-p", "secret"});
        var config = ConfigFactory.parseString("database { username = other, password = other }");
        assertEquals(new ServiceCredentials("svc", "secret"), ServiceCredentials.resolve(commandLine, config, prompt));
        assertTrue(prompt.asked.isEmpty());
    }

    @Test
    public void testPasswordFromStdin() throws Exception {
        var prompt = new RecordingPrompt();
        var commandLine = ConfigUtils.loadCommandLineConfig(new String[]{"--username", "svc", "--password-stdin"});
        var credentials = ServiceCredentials.resolve(commandLine, ConfigFactory.empty(), prompt);
        assertEquals(new ServiceCredentials("svc", "stdin-password"), credentials);
        assertEquals(List.of("stdin"), prompt.asked);
    }

    @Test
    public void testMissingCredentialsArePrompted() throws Exception {
        var prompt = new RecordingPrompt();
        var commandLine = ConfigUtils.loadCommandLineConfig(new String[]{});
        var credentials = ServiceCredentials.resolve(commandLine, ConfigFactory.empty(), prompt);
        assertEquals(new ServiceCredentials("prompted-user", "prompted-password"), credentials);
        assertEquals(List.of("username", "password"), prompt.asked);
    }

    @Test
    public void testConfigUsedBeforePrompt() throws Exception {
        var prompt = new RecordingPrompt();
        var commandLine = ConfigUtils.loadCommandLineConfig(new String[]{});
        var config = ConfigFactory.parseString("database { username = svc }");
        var credentials = ServiceCredentials.resolve(commandLine, config, prompt);
        assertEquals(new ServiceCredentials("svc", "prompted-password"), credentials);
        assertEquals(List.of("password"), prompt.asked);
    }
}
