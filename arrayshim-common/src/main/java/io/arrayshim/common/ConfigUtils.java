package io.arrayshim.common;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.util.List;

public class ConfigUtils {

    public static final String CONFIG_PATH = "arrayshim";

    public record CommandLineConfig(Config config,
                                    String username,
                                    String password,
                                    boolean passwordStdin,
                                    List<String> mainParameters) { }

    private ConfigUtils() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Parses the command line. Every {@code --conf} entry is a HOCON fragment; they take
     * precedence over the file named by {@code --config-file}.
     *
     * @throws ParameterException if the arguments are malformed or the credential flags conflict
     */
    public static CommandLineConfig loadCommandLineConfig(String[] args) {
        var argv = new Args();
        JCommander.newBuilder()
                .addObject(argv)
                .build()
                .parse(args);
        if (argv.password != null && argv.passwordStdin) {
            throw new ParameterException("--password and --password-stdin are mutually exclusive");
        }
        if ((argv.password != null || argv.passwordStdin) && argv.username == null) {
            throw new ParameterException("a password can only be supplied together with --username");
        }
        var buffer = new StringBuilder();
        if (argv.configs != null) {
            argv.configs.forEach(c -> {
                buffer.append(c);
                buffer.append("\n");
            });
        }
        var config = ConfigFactory.parseString(buffer.toString());
        if (argv.configFile != null) {
            var file = new File(argv.configFile);
            if (!file.isFile()) {
                throw new ParameterException("config file not found: " + argv.configFile);
            }
            config = config.withFallback(ConfigFactory.parseFile(file));
        }
        return new CommandLineConfig(config, argv.username, argv.password, argv.passwordStdin,
                argv.mainParameters == null ? List.of() : argv.mainParameters);
    }

    /**
     * Resolves the effective {@value #CONFIG_PATH} section: command line, then the classpath
     * {@code application.conf}/{@code reference.conf}.
     */
    public static Config resolve(CommandLineConfig commandLineConfig) {
        return commandLineConfig.config()
                .withFallback(ConfigFactory.load())
                .resolve()
                .getConfig(CONFIG_PATH);
    }

    public static class Args {
        @Parameter(names = {"--conf"}, description = "Configuration overrides in HOCON syntax")
        private List<String> configs;

        @Parameter(names = {"--config-file"}, description = "HOCON file with the server configuration")
        private String configFile;

        @Parameter(names = {"-u", "--username"}, description = "Service account used to query the backing database")
        private String username;

        @Parameter(names = {"-p", "--password"}, description = "Password of the service account")
        private String password;

        @Parameter(names = {"--password-stdin"}, description = "Read the service account password from stdin")
        private boolean passwordStdin;

        @Parameter
        private List<String> mainParameters;
    }
}
