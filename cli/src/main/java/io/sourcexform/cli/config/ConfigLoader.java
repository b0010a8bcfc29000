package io.sourcexform.cli.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.IntConsumer;

/**
 * Loads {@link CliConfig} from a YAML file with an environment variable overlay.
 *
 * <pre>
 * migration:
 *   spec: migrations/emissions-scopes.yaml
 *   base-dir: .
 *   targets: [internal/handlers/emissions.go]
 * run:
 *   dry-run: false
 *   parallelism: 4
 * logging:
 *   format: text
 *   level: INFO
 * </pre>
 *
 * <p>
 * Environment variables take precedence over YAML values. A variable counts as set only if it is
 * defined and non-blank after trimming.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /** Loaded from the working directory when no {@code --config} is given and the file exists. */
    public static final String DEFAULT_CONFIG_FILE = "source-xform.yaml";

    private static final Set<String> KNOWN_SECTIONS = Set.of("migration", "run", "logging");

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads configuration from the given YAML file, applying overrides from {@link System#getenv}.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static CliConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads configuration from the given YAML file, applying overrides from the supplied lookup.
     * The lookup returns {@code null} for undefined variables.
     *
     * @throws ConfigLoadException if the file is missing or invalid
     */
    public static CliConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException("Configuration file not found: " + configPath);
        }
        try (InputStream in = Files.newInputStream(configPath)) {
            JsonNode root = YAML_MAPPER.readTree(in);
            if (root == null || root.isMissingNode()) {
                root = YAML_MAPPER.createObjectNode();
            }
            return mapToConfig(root, envLookup);
        } catch (ConfigLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        } catch (NumberFormatException e) {
            throw new ConfigLoadException("Invalid number in configuration " + configPath + ": " + e.getMessage(), e);
        }
    }

    /** Defaults with the environment overlay applied; used when no configuration file exists. */
    public static CliConfig defaults(Function<String, String> envLookup) {
        return mapToConfig(YAML_MAPPER.createObjectNode(), envLookup);
    }

    private static CliConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        if (!root.isObject()) {
            throw new ConfigLoadException("Configuration root must be a YAML mapping");
        }
        root.fieldNames().forEachRemaining(key -> {
            if (!KNOWN_SECTIONS.contains(key)) {
                throw new ConfigLoadException("Unknown configuration section '" + key + "', expected one of "
                        + KNOWN_SECTIONS.stream().sorted().toList());
            }
        });
        CliConfig.Builder builder = CliConfig.builder();

        // --- YAML mapping ---

        JsonNode migration = root.path("migration");
        if (migration.has("spec")) builder.specPath(migration.get("spec").asText());
        if (migration.has("base-dir")) builder.baseDir(migration.get("base-dir").asText());
        if (migration.has("targets")) builder.targets(stringList(migration.get("targets"), "migration.targets"));

        JsonNode run = root.path("run");
        if (run.has("dry-run")) builder.dryRun(run.get("dry-run").asBoolean());
        if (run.has("parallelism")) builder.parallelism(intValue(run.get("parallelism"), "run.parallelism"));

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment overlay ---

        envString(envLookup, "SOURCEXFORM_SPEC", builder::specPath);
        envString(envLookup, "SOURCEXFORM_BASE_DIR", builder::baseDir);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);
        envInt(envLookup, "SOURCEXFORM_PARALLELISM", builder::parallelism);
        envBool(envLookup, "SOURCEXFORM_DRY_RUN", builder::dryRun);

        return builder.build();
    }

    // --- Env var helpers ---

    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, IntConsumer setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            try {
                setter.accept(Integer.parseInt(value));
            } catch (NumberFormatException e) {
                throw new ConfigLoadException(envVar + " must be an integer, was '" + value + "'", e);
            }
        }
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            String value = envLookup.apply(envVar).trim();
            if (!value.equalsIgnoreCase("true") && !value.equalsIgnoreCase("false")) {
                throw new ConfigLoadException(envVar + " must be true or false, was '" + value + "'");
            }
            setter.accept(Boolean.parseBoolean(value));
        }
    }

    // --- YAML helpers ---

    private static int intValue(JsonNode node, String key) {
        if (!node.isIntegralNumber()) {
            throw new ConfigLoadException(key + " must be an integer, was '" + node.asText() + "'");
        }
        return node.asInt();
    }

    private static List<String> stringList(JsonNode node, String key) {
        if (!node.isArray()) {
            throw new ConfigLoadException(key + " must be a list of paths");
        }
        List<String> values = new ArrayList<>();
        node.forEach(item -> values.add(item.asText()));
        return values;
    }
}
