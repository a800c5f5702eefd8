package io.arrayshim.common;

import java.io.IOException;

/**
 * Supplies SQL run against every freshly built query context, after its tables are loaded.
 */
public interface StartupScriptProvider extends ConfigBasedProvider {

    String STARTUP_SCRIPT_CONFIG_PREFIX = "startup_script_provider";

    /**
     * @return the script, or an empty string when there is nothing to run
     */
    String getStartupScript() throws IOException;
}
