package io.arrayshim.common;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * A pluggable component configured from a section of the server configuration. The
 * implementation is picked by the {@value #CLASS_KEY} key of that section and must have a
 * public no-arg constructor.
 */
public interface ConfigBasedProvider {

    String CLASS_KEY = "class";

    static <T extends ConfigBasedProvider> T load(Config config, String prefixKey,
                                                  Class<T> type, T defaultObject) throws Exception {
        var innerConfig = config.hasPath(prefixKey) ? config.getConfig(prefixKey) : ConfigFactory.empty();
        if (!innerConfig.hasPath(CLASS_KEY)) {
            defaultObject.setConfig(innerConfig);
            return defaultObject;
        }
        var clazz = Class.forName(innerConfig.getString(CLASS_KEY));
        if (!type.isAssignableFrom(clazz)) {
            throw new IllegalArgumentException("%s does not implement %s".formatted(clazz.getName(), type.getName()));
        }
        T object = type.cast(clazz.getConstructor().newInstance());
        object.setConfig(innerConfig);
        return object;
    }

    void setConfig(Config config);
}
