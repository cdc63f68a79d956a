package de.mirkosertic.querywarmup.config;

import de.mirkosertic.querywarmup.ast.BooleanOperand;
import de.mirkosertic.querywarmup.ast.PhrasePrefixQuery;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Configuration of query planning.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.querywarmup/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_DEFAULT_FIELDS = "WARMUP_DEFAULT_FIELDS";
    private static final String ENV_SCHEMA_PATH = "WARMUP_SCHEMA_PATH";
    private static final String PROP_VALIDATE = "warmup.validate";
    private static final String PROP_SCHEMA_PATH = "warmup.schema.path";
    private static final String CONFIG_DIR = ".querywarmup";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    private List<String> defaultFields = new ArrayList<>();
    private boolean validate = true;
    private int phrasePrefixMaxExpansions = PhrasePrefixQuery.DEFAULT_MAX_EXPANSIONS;
    private BooleanOperand defaultOperator = BooleanOperand.AND;
    private boolean lenient = false;
    private @Nullable String schemaPath;

    private final Map<String, String> environment;
    private final Properties systemProperties;

    private ApplicationConfig(final Map<String, String> environment, final Properties systemProperties) {
        this.environment = environment;
        this.systemProperties = systemProperties;
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        return load(getUserConfigPath(), System.getenv(), System.getProperties());
    }

    public static ApplicationConfig load(final Path userConfigPath, final Map<String, String> environment,
                                         final Properties systemProperties) {
        final ApplicationConfig config = new ApplicationConfig(environment, systemProperties);

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig(userConfigPath);

        // Step 3: Apply system properties and environment variables (highest priority)
        config.applyOverrides();

        logger.info("Configuration loaded: defaultFields={}, validate={}, maxExpansions={}, defaultOperator={}",
                config.defaultFields, config.validate, config.phrasePrefixMaxExpansions, config.defaultOperator);

        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig(final Path userConfigPath) {
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        // Navigate to warmup section
        final Map<String, Object> warmupConfig = (Map<String, Object>) config.get("warmup");
        if (warmupConfig == null) {
            return;
        }

        if (warmupConfig.containsKey("default-fields")) {
            final Object fields = warmupConfig.get("default-fields");
            if (fields instanceof List) {
                this.defaultFields = new ArrayList<>((List<String>) fields);
            }
        }
        if (warmupConfig.containsKey("validate")) {
            this.validate = (Boolean) warmupConfig.get("validate");
        }
        if (warmupConfig.containsKey("phrase-prefix-max-expansions")) {
            this.phrasePrefixMaxExpansions = ((Number) warmupConfig.get("phrase-prefix-max-expansions")).intValue();
        }
        if (warmupConfig.containsKey("default-operator")) {
            this.defaultOperator = parseOperator(warmupConfig.get("default-operator").toString());
        }
        if (warmupConfig.containsKey("lenient")) {
            this.lenient = (Boolean) warmupConfig.get("lenient");
        }
        if (warmupConfig.get("schema-path") != null) {
            final String resolved = resolveVariables(warmupConfig.get("schema-path").toString(), environment,
                    systemProperties);
            this.schemaPath = resolved.isBlank() ? null : resolved;
        }
    }

    private void applyOverrides() {
        final String propValidate = systemProperties.getProperty(PROP_VALIDATE);
        if (propValidate != null && !propValidate.isEmpty()) {
            this.validate = Boolean.parseBoolean(propValidate.trim());
        }
        final String propSchemaPath = systemProperties.getProperty(PROP_SCHEMA_PATH);
        if (propSchemaPath != null && !propSchemaPath.isEmpty()) {
            this.schemaPath = propSchemaPath;
        }

        // Default fields from environment (overrides all other sources)
        final String envFields = environment.get(ENV_DEFAULT_FIELDS);
        if (envFields != null && !envFields.trim().isEmpty()) {
            this.defaultFields = new ArrayList<>();
            for (final String field : envFields.split(",")) {
                final String trimmed = field.trim();
                if (!trimmed.isEmpty()) {
                    this.defaultFields.add(trimmed);
                }
            }
            logger.info("Default fields from environment: {}", this.defaultFields);
        }
        final String envSchemaPath = environment.get(ENV_SCHEMA_PATH);
        if (envSchemaPath != null && !envSchemaPath.trim().isEmpty()) {
            this.schemaPath = envSchemaPath.trim();
        }
    }

    private static BooleanOperand parseOperator(final String value) {
        return switch (value.trim().toLowerCase()) {
            case "and" -> BooleanOperand.AND;
            case "or" -> BooleanOperand.OR;
            default -> throw new IllegalArgumentException("Unknown default operator: " + value);
        };
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    static String resolveVariables(final String value, final Map<String, String> environment,
                                   final Properties systemProperties) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = environment.get(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = systemProperties.getProperty(varName, defaultValue);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR, USER_CONFIG_FILE);
    }

    // Getters
    public List<String> getDefaultFields() {
        return List.copyOf(defaultFields);
    }

    public boolean isValidate() {
        return validate;
    }

    public int getPhrasePrefixMaxExpansions() {
        return phrasePrefixMaxExpansions;
    }

    public BooleanOperand getDefaultOperator() {
        return defaultOperator;
    }

    public boolean isLenient() {
        return lenient;
    }

    public @Nullable String getSchemaPath() {
        return schemaPath;
    }
}
