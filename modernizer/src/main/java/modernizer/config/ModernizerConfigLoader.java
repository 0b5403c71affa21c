package modernizer.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Loads modernizer configuration from properties or YAML files.
 *
 * <p>Configuration is searched in the following order:
 * <ol>
 *   <li>{@code modernizer.properties} on the classpath</li>
 *   <li>{@code modernizer.yml} on the classpath</li>
 * </ol>
 *
 * <p>System properties override file-based configuration. Use the
 * {@code modernizer.} prefix for property names
 * (e.g., {@code -Dmodernizer.sandbox.mode=LOCAL}).
 *
 * <h2>Configuration Properties:</h2>
 * <ul>
 *   <li>{@code modernizer.sessions.root} - directory for session output</li>
 *   <li>{@code modernizer.repair.max.attempts} - repair attempt bound</li>
 *   <li>{@code modernizer.env.legacy.image} / {@code modernizer.env.legacy.interpreter}</li>
 *   <li>{@code modernizer.env.modern.image} / {@code modernizer.env.modern.interpreter}</li>
 *   <li>{@code modernizer.timeout.execution} - per-execution timeout in seconds</li>
 *   <li>{@code modernizer.timeout.stage} - per-stage timeout in seconds, 0 disables</li>
 *   <li>{@code modernizer.sandbox.mode} - AUTO, SANDBOXED or LOCAL</li>
 *   <li>{@code modernizer.sandbox.runtime} - container CLI</li>
 *   <li>{@code modernizer.verification.workers} - verification pool size</li>
 *   <li>{@code modernizer.preprocess.max.fix.iterations} - parse-fix bound</li>
 *   <li>{@code modernizer.alert.level} - DEBUG, WARNING, or ERROR</li>
 * </ul>
 *
 * @see ModernizerConfig
 */
public final class ModernizerConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ModernizerConfigLoader.class);

    private ModernizerConfigLoader() {}

    /**
     * Load from classpath (modernizer.properties or modernizer.yml).
     * @throws ModernizerConfigException if no config file found
     */
    public static ModernizerConfig load() {
        InputStream is = getResource("modernizer.properties");
        if (is != null) {
            return loadProperties(is, "modernizer.properties");
        }

        is = getResource("modernizer.yml");
        if (is != null) {
            return loadYaml(is, "modernizer.yml");
        }

        throw new ModernizerConfigException(
                "Config file required: modernizer.properties or modernizer.yml");
    }

    /**
     * Loads configuration from an external file.
     *
     * @param path path to the configuration file (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     * @throws ModernizerConfigException if the configuration is invalid
     */
    public static ModernizerConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, name);
            }
            return loadProperties(is, name);
        }
    }

    private static InputStream getResource(String name) {
        return ModernizerConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static ModernizerConfig loadProperties(InputStream is, String source) {
        try (is) {
            Properties props = new Properties();
            props.load(is);
            log.info("Loaded config from {}", source);
            return parse(props);
        } catch (IOException e) {
            throw new ModernizerConfigException("Failed to load " + source, e);
        }
    }

    private static ModernizerConfig loadYaml(InputStream is, String source) {
        Map<String, Object> root;
        try {
            root = new Yaml().load(is);
        } catch (RuntimeException e) {
            throw new ModernizerConfigException("Failed to parse " + source, e);
        }
        if (root == null) {
            return parse(new Properties());
        }
        Properties props = new Properties();
        flatten("", root, props);
        log.info("Loaded config from {}", source);
        return parse(props);
    }

    @SuppressWarnings("unchecked")
    private static void flatten(String prefix, Map<String, Object> map, Properties props) {
        for (var entry : map.entrySet()) {
            String key = prefix.isEmpty() ? String.valueOf(entry.getKey()) : prefix + "." + entry.getKey();
            Object val = entry.getValue();
            if (val instanceof Map) {
                flatten(key, (Map<String, Object>) val, props);
            } else if (val != null) {
                props.setProperty(key, val.toString());
            }
        }
    }

    private static ModernizerConfig parse(Properties props) {
        ModernizerConfig.Builder b = ModernizerConfig.builder();

        getString(props, "modernizer.sessions.root").ifPresent(v -> b.sessionsRoot(Path.of(v)));

        getInt(props, "modernizer.repair.max.attempts").ifPresent(v -> {
            if (v >= 0) {
                b.maxRepairAttempts(v);
            } else {
                log.warn("Invalid repair.max.attempts: {}", v);
            }
        });

        getString(props, "modernizer.env.legacy.image").ifPresent(b::legacyImage);
        getString(props, "modernizer.env.legacy.interpreter").ifPresent(b::legacyInterpreter);
        getString(props, "modernizer.env.modern.image").ifPresent(b::modernImage);
        getString(props, "modernizer.env.modern.interpreter").ifPresent(b::modernInterpreter);

        getLong(props, "modernizer.timeout.execution").ifPresent(v -> {
            if (v > 0) {
                b.executionTimeoutSeconds(v);
            } else {
                log.warn("Invalid timeout.execution: {}", v);
            }
        });
        getLong(props, "modernizer.timeout.stage").ifPresent(b::stageTimeoutSeconds);

        getString(props, "modernizer.sandbox.mode").ifPresent(v -> {
            try {
                b.sandboxMode(SandboxMode.valueOf(v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid sandbox.mode: {}", v);
            }
        });
        getString(props, "modernizer.sandbox.runtime").ifPresent(b::containerRuntime);

        getInt(props, "modernizer.verification.workers").ifPresent(v -> {
            if (v > 0) b.verificationWorkers(v);
        });
        getInt(props, "modernizer.preprocess.max.fix.iterations").ifPresent(v -> {
            if (v > 0) b.maxFixIterations(v);
        });

        getString(props, "modernizer.alert.level").ifPresent(v -> {
            try {
                b.alertLevel(AlertLevel.valueOf(v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid alert.level: {}", v);
            }
        });

        return b.build();
    }

    private static Optional<String> getString(Properties props, String key) {
        String val = System.getProperty(key);
        if (val == null) val = props.getProperty(key);
        if (val == null || val.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(val.trim());
    }

    private static Optional<Long> getLong(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Long.parseLong(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }

    private static Optional<Integer> getInt(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Integer.parseInt(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }
}
