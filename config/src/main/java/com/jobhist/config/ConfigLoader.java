package com.jobhist.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import com.typesafe.config.ConfigResolveOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Loads and merges configuration from multiple sources.
 *
 * <p>Configuration is loaded in the following order (later sources override earlier):
 * <ol>
 *   <li>reference.conf (from classpath - defaults, one per module)</li>
 *   <li>application.conf (from classpath)</li>
 *   <li>Config files specified via {@link #load(String...)} or {@link #load(List)}</li>
 *   <li>System properties</li>
 * </ol>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Config config = ConfigLoader.load("site.conf");
 * StreamConfig streamConfig = StreamConfig.fromConfig(config.getConfig("jobhist.stream"));
 *
 * // Or use the builder
 * Config config = ConfigLoader.builder()
 *     .addFile("site.conf")
 *     .withSystemProperties(false)
 *     .build();
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Root path of all jobhist settings.
     */
    public static final String ROOT = "jobhist";

    private ConfigLoader() {}

    /**
     * Load configuration using default loading order:
     * reference.conf -> application.conf -> system properties.
     */
    public static Config load() {
        return builder().build();
    }

    /**
     * Load configuration with additional config files.
     * Files are loaded in order, with later files overriding earlier ones.
     *
     * @param configFiles paths to config files
     * @return merged configuration
     */
    public static Config load(String... configFiles) {
        return load(Arrays.asList(configFiles));
    }

    /**
     * Load configuration with additional config files.
     *
     * @param configFiles list of paths to config files
     * @return merged configuration
     */
    public static Config load(List<String> configFiles) {
        return builder().addFiles(configFiles).build();
    }

    /**
     * Create a builder for more control over configuration loading.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for ConfigLoader with fine-grained control over loading.
     */
    public static final class Builder {
        private final List<String> configFiles = new ArrayList<>();
        private boolean includeSystemProperties = true;
        private boolean includeApplicationConf = true;
        private boolean includeReferenceConf = true;

        private Builder() {}

        /**
         * Add a config file to load.
         */
        public Builder addFile(String path) {
            this.configFiles.add(path);
            return this;
        }

        /**
         * Add multiple config files to load.
         */
        public Builder addFiles(List<String> paths) {
            this.configFiles.addAll(paths);
            return this;
        }

        /**
         * Whether to include system properties in resolution.
         * Default: true
         */
        public Builder withSystemProperties(boolean include) {
            this.includeSystemProperties = include;
            return this;
        }

        /**
         * Whether to load application.conf from classpath.
         * Default: true
         */
        public Builder withApplicationConf(boolean include) {
            this.includeApplicationConf = include;
            return this;
        }

        /**
         * Whether to load reference.conf from classpath.
         * Default: true
         */
        public Builder withReferenceConf(boolean include) {
            this.includeReferenceConf = include;
            return this;
        }

        /**
         * Build the merged configuration.
         *
         * @throws IllegalArgumentException if a listed config file does not exist
         */
        public Config build() {
            Config config = ConfigFactory.empty();

            if (includeReferenceConf) {
                config = config.withFallback(ConfigFactory.defaultReference());
                log.debug("Loaded reference.conf");
            }

            if (includeApplicationConf) {
                config = ConfigFactory.defaultApplication().withFallback(config);
                log.debug("Loaded application.conf");
            }

            for (String path : configFiles) {
                File file = new File(path);
                if (!file.isFile()) {
                    throw new IllegalArgumentException("Config file not found: " + path);
                }
                Config fileConfig = ConfigFactory.parseFile(file,
                        ConfigParseOptions.defaults().setAllowMissing(false));
                config = fileConfig.withFallback(config);
                log.debug("Loaded config file: {}", path);
            }

            if (includeSystemProperties) {
                config = ConfigFactory.systemProperties().withFallback(config);
            }

            return config.resolve(ConfigResolveOptions.defaults());
        }
    }
}
