package io.arrayshim.flight.server;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Asks the operator for credentials missing from the command line and configuration.
 */
public interface CredentialPrompt {

    String readUsername() throws IOException;

    String readPassword() throws IOException;

    /**
     * Reads the first line of standard input, for {@code --password-stdin}.
     */
    String readPasswordFromStdin() throws IOException;

    static CredentialPrompt console() {
        return new CredentialPrompt() {
            private BufferedReader stdin;

            @Override
            public String readUsername() throws IOException {
                var console = System.console();
                if (console != null) {
                    return console.readLine("Username: ");
                }
                System.out.print("Username: ");
                return readLine();
            }

            @Override
            public String readPassword() throws IOException {
                var console = System.console();
                if (console != null) {
                    var password = console.readPassword("Password: ");
                    return password == null ? null : new String(password);
                }
                System.out.print("Password: ");
                return readLine();
            }

            @Override
            public String readPasswordFromStdin() throws IOException {
                return readLine();
            }

            private synchronized String readLine() throws IOException {
                if (stdin == null) {
                    stdin = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
                }
                var line = stdin.readLine();
                if (line == null) {
                    throw new IOException("standard input closed before credentials were read");
                }
                return line;
            }
        };
    }
}
