package com.backupinsight.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Loads and validates {@link AnalysisConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <p>
 * All {@code load*} methods validate after parsing so a bad configuration
 * fails before any component is built.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "BACKUP_INSIGHT_CONFIG_PATH";

    /** Classpath resource used when no override is present. */
    public static final String DEFAULT_RESOURCE = "analysis.yml";

    private ConfigLoader() {
        // utility class - not instantiable
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load configuration using automatic resolution: the file named by
     * {@code BACKUP_INSIGHT_CONFIG_PATH} if it exists, otherwise
     * {@code analysis.yml} on the classpath.
     *
     * @return parsed and validated configuration
     * @throws InvalidConfigurationException if validation fails
     */
    public static AnalysisConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading analysis configuration from environment path: {}", envPath);
            return fromFile(envPath);
        }
        LOG.info("Loading analysis configuration from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException      if the file does not exist
     * @throws IllegalStateException         if reading or parsing fails
     * @throws InvalidConfigurationException if validation fails
     */
    public static AnalysisConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read config file: " + path, e);
        }
    }

    /**
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException      if the resource does not exist
     * @throws IllegalStateException         if reading or parsing fails
     * @throws InvalidConfigurationException if validation fails
     */
    public static AnalysisConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static AnalysisConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(AnalysisConfig.class, options));

        AnalysisConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed analysis configuration in " + source
                    + ": " + e.getMessage(), e);
        }

        if (config == null) {
            LOG.warn("Analysis configuration {} is empty, using defaults", source);
            config = AnalysisConfig.defaults();
        }
        config.validate();

        LOG.info("Loaded analysis configuration: {}", config);
        return config;
    }
}
