package io.arrayshim.common;

import com.beust.jcommander.ParameterException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigUtilsTest {

    @Test
    public void testConfOverrides() {
        var commandLine = ConfigUtils.loadCommandLineConfig(new String[]{
                "--conf", "arrayshim.fetch_size=10",
                "--conf", "arrayshim.flight.port=4000"});
        var config = ConfigUtils.resolve(commandLine);
        assertEquals(10, config.getInt("fetch_size"));
        assertEquals(4000, config.getInt("flight.port"));
        assertNull(commandLine.username());
        assertFalse(commandLine.passwordStdin());
    }

    @Test
    public void testConfTakesPrecedenceOverConfigFile(@TempDir Path dir) throws IOException {
        var file = dir.resolve("server.conf");
        Files.writeString(file, "arrayshim { fetch_size = 50, item_expiration_age = 1h }");
        var commandLine = ConfigUtils.loadCommandLineConfig(new String[]{
                "--config-file", file.toString(),
                "--conf", "arrayshim.fetch_size=7"});
        var config = ConfigUtils.resolve(commandLine);
        assertEquals(7, config.getInt("fetch_size"));
        assertEquals("1h", config.getString("item_expiration_age"));
    }

    @Test
    public void testMissingConfigFile(@TempDir Path dir) {
        var missing = dir.resolve("missing.conf").toString();
        assertThrows(ParameterException.class,
                () -> ConfigUtils.loadCommandLineConfig(new String[]{"--config-file", missing}));
    }

    @Test
    public void testCredentials() {
        var commandLine = ConfigUtils.loadCommandLineConfig(new String[]{"-u", "svc", "-p", "secret"});
        assertEquals("svc", commandLine.username());
        assertEquals("secret", commandLine.password());
    }

    @Test
    public void testPasswordAndPasswordStdinAreExclusive() {
        var e = assertThrows(ParameterException.class,
                () -> ConfigUtils.loadCommandLineConfig(new String[]{"-u", "svc", "-p", "secret", "--password-stdin"}));
        assertEquals("--password and --password-stdin are mutually exclusive", e.getMessage());
    }

    @Test
    public void testPasswordRequiresUsername() {
        assertThrows(ParameterException.class,
                () -> ConfigUtils.loadCommandLineConfig(new String[]{"--password", "secret"}));
        assertThrows(ParameterException.class,
                () -> ConfigUtils.loadCommandLineConfig(new String[]{"--password-stdin"}));
    }
}
