package com.aerarisk.core.config;

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
import java.util.Objects;

/**
 * Loads and validates {@link ModelConfig} from a YAML source.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Explicit file system path passed to {@link #load(String)}</li>
 * <li>Classpath resource {@value #DEFAULT_RESOURCE}</li>
 * <li>Built-in defaults when neither exists</li>
 * </ol>
 *
 * <p>
 * Every loaded configuration is validated so that a bad parameter fails the
 * run before any data is read.
 * </p>
 *
 * @since 1.0.0
 */
public final class ModelConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ModelConfigLoader.class);

    /** Environment variable naming an override YAML file. */
    public static final String ENV_MODEL_CONFIG_PATH = "MODEL_CONFIG_PATH";

    /** Classpath resource consulted when no override path is given. */
    public static final String DEFAULT_RESOURCE = "model.yml";

    private ModelConfigLoader() {
        // utility class
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Load the model configuration.
     *
     * @param overridePath file path to load from; {@code null} or blank to use
     *                     the classpath resource
     * @return parsed and validated configuration
     * @throws ConfigurationException if the file is missing, unreadable or invalid
     */
    public static ModelConfig load(String overridePath) {
        if (overridePath != null && !overridePath.isBlank()) {
            LOG.info("Loading model configuration from {}", overridePath);
            return fromFile(overridePath);
        }
        if (ModelConfigLoader.class.getClassLoader().getResource(DEFAULT_RESOURCE) == null) {
            LOG.info("No {} on classpath, using built-in model defaults", DEFAULT_RESOURCE);
            return ModelConfig.defaults();
        }
        LOG.info("Loading model configuration from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Load the model configuration from a file system path.
     *
     * @param path path to the YAML file; must not be {@code null}
     * @return parsed and validated configuration
     * @throws ConfigurationException if the file is missing, unreadable or invalid
     */
    public static ModelConfig fromFile(String path) {
        Objects.requireNonNull(path, "Model config path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new ConfigurationException("Model config file not found: " + path, e);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read model config file: " + path, e);
        }
    }

    /**
     * Load the model configuration from a classpath resource.
     *
     * @param resource classpath resource name; must not be {@code null}
     * @return parsed and validated configuration
     * @throws ConfigurationException if the resource is missing, unreadable or invalid
     */
    public static ModelConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = ModelConfigLoader.class.getClassLoader().getResourceAsStream(resource);
        if (is == null) {
            throw new ConfigurationException("Classpath resource not found: " + resource);
        }
        try (is) {
            return parseAndValidate(is, resource);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read classpath resource: " + resource, e);
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static ModelConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(ModelConfig.class, options));

        ModelConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed model configuration in " + source, e);
        }

        if (config == null) {
            LOG.warn("Model configuration {} is empty, using built-in defaults", source);
            config = ModelConfig.defaults();
        }
        config.validate();

        LOG.info("Loaded {}", config);
        return config;
    }
}
