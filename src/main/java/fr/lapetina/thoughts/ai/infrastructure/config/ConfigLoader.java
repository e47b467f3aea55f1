package fr.lapetina.thoughts.ai.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Loads the orchestrator configuration once, from the file system or the classpath.
 *
 * <p>There is no reload: the resulting {@link OrchestrationSettings} is immutable and
 * lives as long as the process.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Map<String, String> environment;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this(configPath, System.getenv());
    }

    public ConfigLoader(String configPath, Map<String, String> environment) {
        this.configPath = Paths.get(configPath);
        this.environment = Map.copyOf(environment);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(OrchestratorConfig.class, loaderOptions));
    }

    /**
     * Loads and validates the configuration.
     *
     * @return The immutable settings
     * @throws ConfigurationException if loading or validation fails
     */
    public OrchestrationSettings load() {
        OrchestrationSettings settings = OrchestrationSettings.from(loadConfig(), environment);
        log.info("Configuration loaded: available={}, primary={}, secondary={}, strategy={}",
                settings.availableBackends(), settings.primaryBackend(),
                settings.secondaryBackend(), settings.strategy().configName());
        settings.connections().values().forEach(c -> log.debug("Backend connection: {}", c));
        return settings;
    }

    /**
     * Reads the raw configuration without validating it.
     */
    public OrchestratorConfig loadConfig() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private OrchestratorConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads and validates configuration from an input stream.
     */
    public OrchestrationSettings loadFromStream(InputStream inputStream) {
        return OrchestrationSettings.from(parse(inputStream, "stream"), environment);
    }

    private OrchestratorConfig parse(InputStream is, String source) {
        try {
            OrchestratorConfig config = yaml.load(is);
            return config != null ? config : new OrchestratorConfig();
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid YAML in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Exception for configuration errors.
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
