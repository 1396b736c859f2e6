package com.voltsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link MonitorConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * <li>Built-in defaults ({@link MonitorConfig#defaults()})</li>
 * </ol>
 *
 * <p>
 * Every {@code from*} method validates the parsed configuration so that a
 * misconfigured deployment fails at startup, not on the first alert.
 * </p>
 *
 * @since 1.0.0
 */
public final class MonitorConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(MonitorConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "MONITOR_CONFIG_PATH";

    public static final String DEFAULT_RESOURCE = "monitor.yml";

    private MonitorConfigLoader() {
        // utility class
    }

    /**
     * Load the configuration using automatic resolution.
     *
     * @return parsed and validated configuration
     * @throws IllegalStateException if validation fails
     */
    public static MonitorConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading monitor configuration from environment path: {}", envPath);
            return fromFile(envPath);
        }
        if (MonitorConfigLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) != null) {
            LOG.info("Loading monitor configuration from classpath: {}", DEFAULT_RESOURCE);
            return fromClasspath(DEFAULT_RESOURCE);
        }
        LOG.info("No monitor configuration found, using built-in defaults");
        MonitorConfig config = MonitorConfig.defaults();
        config.validate();
        return config;
    }

    /**
     * Load the configuration from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static MonitorConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Monitor config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read monitor config file: " + path, e);
        }
    }

    /**
     * Load the configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static MonitorConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = MonitorConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    private static MonitorConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(MonitorConfig.class, options));
        MonitorConfig config = yaml.load(is);

        if (config == null) {
            LOG.warn("Monitor configuration is empty, using built-in defaults");
            config = MonitorConfig.defaults();
        }
        config.validate();

        LOG.info("Loaded {} threshold profile(s), retention {}", config.getProfiles().size(),
                config.getRetention());
        return config;
    }
}
