package io.arrayshim.flight.server;

import com.typesafe.config.Config;
import io.arrayshim.common.ConfigUtils;

import java.io.IOException;

/**
 * The account the server uses to read table data from the backing database.
 */
public record ServiceCredentials(String username, String password) {

    /**
     * Takes each credential from the command line, then the configuration, and finally
     * asks {@code prompt} for whatever is still missing.
     */
    public static ServiceCredentials resolve(ConfigUtils.CommandLineConfig commandLine,
                                             Config config,
                                             CredentialPrompt prompt) throws IOException {
        var username = commandLine.username();
        if (username == null && config.hasPath(ServerFactory.DATABASE_USERNAME_KEY)) {
            username = config.getString(ServerFactory.DATABASE_USERNAME_KEY);
        }
        if (username == null) {
            username = prompt.readUsername();
        }

        var password = commandLine.password();
        if (password == null && commandLine.passwordStdin()) {
            password = prompt.readPasswordFromStdin();
        }
        if (password == null && config.hasPath(ServerFactory.DATABASE_PASSWORD_KEY)) {
            password = config.getString(ServerFactory.DATABASE_PASSWORD_KEY);
        }
        if (password == null) {
            password = prompt.readPassword();
        }
        return new ServiceCredentials(username, password);
    }
}
