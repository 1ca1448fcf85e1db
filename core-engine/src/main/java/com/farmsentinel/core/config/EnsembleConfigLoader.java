package com.farmsentinel.core.config;

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
 * Loads and validates {@link EnsembleConfig} from YAML.
 *
 * <h3>Resolution Order</h3>
 * <ol>
 * <li>Environment variable {@value #ENV_CONFIG_PATH} (file system path)</li>
 * <li>Explicit file system path passed to {@link #fromFile(String)}</li>
 * <li>Classpath resource via {@link #fromClasspath(String)}</li>
 * </ol>
 *
 * <p>
 * Every {@code load*} method validates after parsing, so a bad threshold or
 * weight stops startup instead of skewing scores.
 * </p>
 *
 * @since 1.0.0
 */
public final class EnsembleConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(EnsembleConfigLoader.class);

    public static final String ENV_CONFIG_PATH = "ENSEMBLE_CONFIG_PATH";

    public static final String DEFAULT_RESOURCE = "ensemble.yml";

    private EnsembleConfigLoader() {
    }

    /**
     * Load from {@code ENSEMBLE_CONFIG_PATH} when it names an existing file,
     * else from {@code ensemble.yml} on the classpath.
     */
    public static EnsembleConfig load() {
        return load(System.getenv(ENV_CONFIG_PATH));
    }

    /**
     * @param overridePath optional file path; ignored when blank or missing
     */
    public static EnsembleConfig load(String overridePath) {
        if (overridePath != null && !overridePath.isBlank() && Files.exists(Path.of(overridePath))) {
            LOG.info("Loading ensemble configuration from path: {}", overridePath);
            return fromFile(overridePath);
        }
        LOG.info("Loading ensemble configuration from classpath: {}", DEFAULT_RESOURCE);
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * @throws IllegalArgumentException if the file does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static EnsembleConfig fromFile(String path) {
        Objects.requireNonNull(path, "Config file path must not be null");
        try (InputStream is = new FileInputStream(path)) {
            return parseAndValidate(is, path);
        } catch (FileNotFoundException e) {
            throw new IllegalArgumentException("Ensemble config file not found: " + path, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read ensemble config file: " + path, e);
        }
    }

    /**
     * @throws IllegalArgumentException if the resource does not exist
     * @throws IllegalStateException    if reading or validation fails
     */
    public static EnsembleConfig fromClasspath(String resource) {
        Objects.requireNonNull(resource, "Classpath resource name must not be null");
        InputStream is = EnsembleConfigLoader.class.getClassLoader().getResourceAsStream(resource);
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

    private static EnsembleConfig parseAndValidate(InputStream is, String source) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        Yaml yaml = new Yaml(new Constructor(EnsembleConfig.class, options));
        EnsembleConfig config;
        try {
            config = yaml.load(is);
        } catch (YAMLException e) {
            throw new IllegalStateException("Malformed ensemble configuration in " + source + ": " + e.getMessage(), e);
        }

        if (config == null) {
            LOG.warn("Ensemble configuration {} is empty, using defaults", source);
            config = new EnsembleConfig();
        }
        config.validate();

        LOG.info("Loaded ensemble configuration: {}", config);
        return config;
    }
}
