package com.pulsewatch.core.config;

import com.pulsewatch.core.error.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.ByteArrayInputStream;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Loads and validates {@link AnalyticsConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * <p>
 * Invalid global sections fail the load. Malformed SLO definitions and
 * metric policies are excluded and logged; they stay out of evaluation until
 * the configuration is fixed.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalyticsConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(AnalyticsConfigLoader.class);

    /** Environment variable that can override the default config location. */
    public static final String ENV_CONFIG_PATH = "ANALYTICS_CONFIG_PATH";

    /** Classpath resource used when no path is configured. */
    public static final String DEFAULT_RESOURCE = "analytics.yml";

    private AnalyticsConfigLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load configuration using automatic resolution: {@code ANALYTICS_CONFIG_PATH}
     * if set and the file exists, otherwise {@value #DEFAULT_RESOURCE} on the
     * classpath, otherwise built-in defaults.
     *
     * @return parsed and validated configuration
     * @throws InvalidConfigurationException if a global section is invalid
     */
    public static AnalyticsConfig load() {
        String envPath = System.getenv(ENV_CONFIG_PATH);
        if (envPath != null && !envPath.isBlank() && Files.exists(Path.of(envPath))) {
            LOG.info("Loading analytics configuration from environment path: {}", envPath);
            return fromFile(envPath);
        }
        if (AnalyticsConfigLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) == null) {
            LOG.warn("No {} on the classpath, using built-in defaults", DEFAULT_RESOURCE);
            return finish(new AnalyticsConfig());
        }
        LOG.info("Loading analytics configuration from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws IllegalArgumentException      if the file does not exist
     * @throws IllegalStateException         if reading fails
     * @throws InvalidConfigurationException if the content is invalid
     */
    public static AnalyticsConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is);
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
     * @throws InvalidConfigurationException if the content is invalid
     */
    public static AnalyticsConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = AnalyticsConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new IllegalArgumentException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read classpath resource: " + resource, e);
        }
    }

    /**
     * @param yaml configuration document
     * @return parsed and validated configuration
     */
    public static AnalyticsConfig fromString(String yaml) {
        Objects.requireNonNull(yaml, "yaml must not be null");
        return parseAndValidate(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static AnalyticsConfig parseAndValidate(InputStream is) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(AnalyticsConfig.class, options));
        AnalyticsConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new InvalidConfigurationException("Malformed analytics configuration: " + e.getMessage());
        }
        if (config == null) {
            LOG.warn("Analytics configuration is empty, using built-in defaults");
            config = new AnalyticsConfig();
        }
        return finish(config);
    }

    private static AnalyticsConfig finish(AnalyticsConfig config) {
        config.validate();
        List<String> rejected = config.pruneInvalid();
        for (String reason : rejected) {
            LOG.warn("Excluded from evaluation: {}", reason);
        }
        LOG.info("Loaded analytics configuration: {} SLO(s), {} metric policy(ies), {} excluded",
                config.getSlos().size(), config.getDetection().getMetrics().size(), rejected.size());
        return config;
    }
}
