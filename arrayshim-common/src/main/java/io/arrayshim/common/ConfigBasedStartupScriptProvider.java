package io.arrayshim.common;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the script from the inline {@code content} key followed by the file or classpath
 * resource named by {@code script_location}.
 */
public class ConfigBasedStartupScriptProvider implements StartupScriptProvider {

    public static final String CONTENT_KEY = "content";
    public static final String SCRIPT_LOCATION_KEY = "script_location";

    private Config config = ConfigFactory.empty();

    @Override
    public String getStartupScript() throws IOException {
        var sb = new StringBuilder();
        if (config.hasPath(CONTENT_KEY)) {
            sb.append(config.getString(CONTENT_KEY).trim()).append("\n");
        }
        if (config.hasPath(SCRIPT_LOCATION_KEY)) {
            var location = config.getString(SCRIPT_LOCATION_KEY);
            var path = Path.of(location);
            if (Files.isRegularFile(path)) {
                sb.append(Files.readString(path).trim()).append("\n");
            } else {
                try (InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(location)) {
                    if (in == null) {
                        throw new IOException("startup script not found: " + location);
                    }
                    sb.append(new String(in.readAllBytes(), StandardCharsets.UTF_8).trim()).append("\n");
                }
            }
        }
        return sb.toString().trim();
    }

    @Override
    public void setConfig(Config config) {
        this.config = config;
    }
}
