package com.caseflow.orchestrator.core.engine.config;

import com.caseflow.orchestrator.integration.enumerations.CaseFlowRepeatActionPolicy;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;

/**
 * Builds a {@link CaseFlowEngineConfig} from layered sources.
 *
 * <h2>Resolution order</h2>
 * Later sources win:
 * <ol>
 *   <li>Built-in defaults</li>
 *   <li>Classpath resource {@code caseflow.properties}</li>
 *   <li>System properties, e.g. {@code -Dcaseflow.engine.max-steps=80}</li>
 *   <li>Environment variables, e.g. {@code CASEFLOW_ENGINE_MAX_STEPS=80}</li>
 * </ol>
 *
 * <p>Durations accept ISO-8601 ({@code PT30S}) or a plain number of seconds.
 * A value that cannot be parsed is ignored with a warning.
 */
@Slf4j
public class CaseFlowConfigLoader {

    public static final String DEFAULT_RESOURCE = "caseflow.properties";

    public static final String MAX_STEPS = "caseflow.engine.max-steps";
    public static final String REPEAT_ACTION_POLICY = "caseflow.engine.repeat-action-policy";
    public static final String HISTORY_WINDOW = "caseflow.oracle.history-window";
    public static final String POLLING_INTERVAL = "caseflow.polling.interval";
    public static final String POLLING_MAX_ATTEMPTS = "caseflow.polling.max-attempts";
    public static final String LOCK_DURATION = "caseflow.lock.duration";
    public static final String LOCK_WAIT_TIMEOUT = "caseflow.lock.wait-timeout";
    public static final String STORE_TYPE = "caseflow.store.type";
    public static final String STORE_PATH = "caseflow.store.path";

    private final String resourceName;
    private final Properties systemProperties;
    private final Map<String, String> environment;

    public CaseFlowConfigLoader() {
        this(DEFAULT_RESOURCE, System.getProperties(), System.getenv());
    }

    public CaseFlowConfigLoader(String resourceName, Properties systemProperties, Map<String, String> environment) {
        this.resourceName = resourceName;
        this.systemProperties = systemProperties;
        this.environment = environment;
    }

    public static CaseFlowEngineConfig loadDefault() {
        return new CaseFlowConfigLoader().load();
    }

    public CaseFlowEngineConfig load() {
        Properties fileProperties = loadResource();
        CaseFlowEngineConfig defaults = CaseFlowEngineConfig.defaults();

        CaseFlowEngineConfig config = CaseFlowEngineConfig.builder()
                .maxSteps(resolve(fileProperties, MAX_STEPS, Integer::parseInt).orElse(defaults.getMaxSteps()))
                .repeatActionPolicy(resolve(fileProperties, REPEAT_ACTION_POLICY, v -> CaseFlowRepeatActionPolicy.valueOf(v.toUpperCase(Locale.ROOT)))
                        .orElse(defaults.getRepeatActionPolicy()))
                .historyWindow(resolve(fileProperties, HISTORY_WINDOW, Integer::parseInt).orElse(defaults.getHistoryWindow()))
                .pollingInterval(resolve(fileProperties, POLLING_INTERVAL, CaseFlowConfigLoader::parseDuration).orElse(defaults.getPollingInterval()))
                .maxPollAttempts(resolve(fileProperties, POLLING_MAX_ATTEMPTS, Integer::parseInt).orElse(defaults.getMaxPollAttempts()))
                .lockDuration(resolve(fileProperties, LOCK_DURATION, CaseFlowConfigLoader::parseDuration).orElse(defaults.getLockDuration()))
                .lockWaitTimeout(resolve(fileProperties, LOCK_WAIT_TIMEOUT, CaseFlowConfigLoader::parseDuration).orElse(defaults.getLockWaitTimeout()))
                .storeType(resolve(fileProperties, STORE_TYPE, v -> CaseFlowStoreType.valueOf(v.toUpperCase(Locale.ROOT)))
                        .orElse(defaults.getStoreType()))
                .storePath(resolve(fileProperties, STORE_PATH, Function.identity()).orElse(defaults.getStorePath()))
                .build();

        log.info("CaseFlow configuration loaded: {}", config);
        return config;
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    private Properties loadResource() {
        Properties properties = new Properties();
        ClassLoader classLoader = Optional.ofNullable(Thread.currentThread().getContextClassLoader())
                .orElse(CaseFlowConfigLoader.class.getClassLoader());
        try (InputStream in = classLoader.getResourceAsStream(resourceName)) {
            if (in == null) {
                log.debug("No {} found on classpath, using defaults", resourceName);
                return properties;
            }
            properties.load(in);
        } catch (IOException e) {
            log.warn("Failed to read {}. Using defaults.", resourceName, e);
        }
        return properties;
    }

    private <T> Optional<T> resolve(Properties fileProperties, String key, Function<String, T> parser) {
        // Environment wins over system properties, which win over the file
        String[] candidates = {
                environment.get(toEnvironmentName(key)),
                systemProperties.getProperty(key),
                fileProperties.getProperty(key)
        };
        for (String candidate : candidates) {
            if (candidate == null || candidate.isBlank()) {
                continue;
            }
            try {
                return Optional.of(parser.apply(candidate.trim()));
            } catch (IllegalArgumentException | DateTimeParseException e) {
                log.warn("Invalid value for {}: {}. Ignoring.", key, candidate);
            }
        }
        return Optional.empty();
    }

    static String toEnvironmentName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    static Duration parseDuration(String value) {
        if (value.chars().allMatch(Character::isDigit)) {
            return Duration.ofSeconds(Long.parseLong(value));
        }
        return Duration.parse(value);
    }
}
