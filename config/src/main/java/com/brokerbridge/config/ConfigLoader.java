package com.brokerbridge.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import com.typesafe.config.ConfigResolveOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Loads and merges session configuration from several sources.
 *
 * <p>Sources are layered in this order, later ones overriding earlier ones:</p>
 * <ol>
 *   <li>reference.conf on the classpath (library defaults)</li>
 *   <li>application.conf on the classpath</li>
 *   <li>files passed to {@link #load(String...)}, from the file system or the classpath</li>
 *   <li>system properties</li>
 * </ol>
 *
 * <pre>{@code
 * Config config = ConfigLoader.load("paper-account.conf");
 * SessionConfig sessionConfig = SessionConfig.fromConfig(config.getConfig("broker-session"));
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {}

    /**
     * reference.conf, application.conf and system properties.
     */
    public static Config load() {
        return ConfigFactory.load();
    }

    public static Config load(String... configFiles) {
        return load(Arrays.asList(configFiles));
    }

    public static Config load(List<String> configFiles) {
        return builder().addFiles(configFiles).build();
    }

    /**
     * Read a duration, accepting both HOCON durations ({@code 500ms}) and plain
     * numbers, which are taken as milliseconds.
     */
    public static Duration getDuration(Config config, String path) {
        try {
            return config.getDuration(path);
        } catch (ConfigException.WrongType e) {
            throw new ConfigurationException("Not a duration: " + path, e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for fine-grained control over which sources are merged.
     */
    public static final class Builder {
        private final List<String> configFiles = new ArrayList<>();
        private boolean includeSystemProperties = true;
        private boolean includeApplicationConf = true;
        private boolean includeReferenceConf = true;

        private Builder() {}

        public Builder addFile(String path) {
            this.configFiles.add(path);
            return this;
        }

        public Builder addFiles(List<String> paths) {
            this.configFiles.addAll(paths);
            return this;
        }

        public Builder withSystemProperties(boolean include) {
            this.includeSystemProperties = include;
            return this;
        }

        public Builder withApplicationConf(boolean include) {
            this.includeApplicationConf = include;
            return this;
        }

        public Builder withReferenceConf(boolean include) {
            this.includeReferenceConf = include;
            return this;
        }

        public Config build() {
            Config config = ConfigFactory.empty();

            if (includeReferenceConf) {
                config = config.withFallback(ConfigFactory.defaultReference());
            }
            if (includeApplicationConf) {
                config = ConfigFactory.defaultApplication().withFallback(config);
            }
            for (String filePath : configFiles) {
                config = loadConfigFile(filePath).withFallback(config);
                log.info("Loaded config file: {}", filePath);
            }
            if (includeSystemProperties) {
                config = ConfigFactory.systemProperties().withFallback(config);
            }

            return config.resolve(ConfigResolveOptions.defaults());
        }

        private Config loadConfigFile(String path) {
            File file = new File(path);
            if (file.exists()) {
                try {
                    return ConfigFactory.parseFile(file, ConfigParseOptions.defaults());
                } catch (ConfigException e) {
                    throw new ConfigurationException("Failed to parse config file: " + path, e);
                }
            }
            Config classpathConfig = ConfigFactory.parseResources(path, ConfigParseOptions.defaults());
            if (classpathConfig.isEmpty()) {
                throw new ConfigurationException("Config file not found: " + path);
            }
            return classpathConfig;
        }
    }

    /**
     * Thrown when configuration cannot be loaded or is invalid.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
