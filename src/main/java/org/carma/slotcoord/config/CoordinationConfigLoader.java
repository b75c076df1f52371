package org.carma.slotcoord.config;

import org.carma.slotcoord.mechanism.ReplacementPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.*;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;

/**
 * Loads {@link CoordinationConfig} from YAML.
 *
 * Sources, in order of preference:
 * - an explicit file path
 * - the classpath resource {@value #DEFAULT_RESOURCE}
 *
 * The loaded config is validated before it is returned, so a bad file fails
 * here rather than mid-run.
 */
public class CoordinationConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(CoordinationConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "coordination.yaml";

    private final Yaml yaml;

    public CoordinationConfigLoader() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        this.yaml = new Yaml(options);
    }

    // ========================================================================
    // LOADING
    // ========================================================================

    public CoordinationConfig load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Configuration file not found: " + file);
        }
        log.info("Loading coordination config from {}", file);
        try (InputStream is = Files.newInputStream(file)) {
            return load(is);
        }
    }

    public CoordinationConfig loadDefault() throws IOException {
        try (InputStream is = CoordinationConfigLoader.class.getClassLoader()
                .getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                throw new IOException("Classpath resource not found: " + DEFAULT_RESOURCE);
            }
            log.info("Loading coordination config from classpath:{}", DEFAULT_RESOURCE);
            return load(is);
        }
    }

    public CoordinationConfig load(InputStream is) {
        Object raw;
        try {
            raw = yaml.load(is);
        } catch (YAMLException e) {
            throw new ConfigurationException("Malformed YAML: " + e.getMessage());
        }
        if (raw == null) {
            return new CoordinationConfig().validate();
        }
        if (!(raw instanceof Map)) {
            throw new ConfigurationException("Top level of the config must be a mapping");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> map = (Map<String, Object>) raw;
        return parse(map).validate();
    }

    public CoordinationConfig loadString(String content) {
        return load(new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)));
    }

    // ========================================================================
    // PARSING
    // ========================================================================

    @SuppressWarnings("unchecked")
    private CoordinationConfig parse(Map<String, Object> raw) {
        CoordinationConfig config = new CoordinationConfig();

        config.numStations = getInt(raw, "numStations", config.numStations);
        config.numSlots = getInt(raw, "numSlots", config.numSlots);
        config.maxRounds = getInt(raw, "maxRounds", config.maxRounds);
        config.queryTimeoutMs = getLong(raw, "queryTimeoutMs", config.queryTimeoutMs);
        config.convergenceThreshold = getInt(raw, "convergenceThreshold", config.convergenceThreshold);
        config.stopOnConvergence = getBoolean(raw, "stopOnConvergence", config.stopOnConvergence);
        config.recordStore = getString(raw, "recordStore", config.recordStore);
        config.replacementPolicy = getEnum(raw, "replacementPolicy",
            ReplacementPolicy.Kind.class, config.replacementPolicy);
        config.stationOrder = getEnum(raw, "stationOrder", StationOrder.class, config.stationOrder);

        if (raw.containsKey("seed")) {
            Object seed = raw.get("seed");
            config.seed = seed == null ? null : toIntegral("seed", seed, Long.MIN_VALUE, Long.MAX_VALUE);
        }

        Object ids = raw.get("stationIds");
        if (ids != null) {
            if (!(ids instanceof List)) {
                throw new ConfigurationException("stationIds must be a list");
            }
            config.stationIds = new ArrayList<>();
            for (Object id : (List<Object>) ids) {
                config.stationIds.add(String.valueOf(id));
            }
            if (!raw.containsKey("numStations")) {
                config.numStations = config.stationIds.size();
            }
        }

        Map<String, Object> demandMap = getSection(raw, "demand");
        if (demandMap != null) {
            config.demand.refresh = getEnum(demandMap, "refresh",
                DemandRefreshPolicy.class, config.demand.refresh);
            config.demand.interval = getInt(demandMap, "interval", config.demand.interval);
            Map<String, Object> fixed = getSection(demandMap, "fixed");
            if (fixed != null) {
                config.demand.fixed = new LinkedHashMap<>();
                for (Map.Entry<String, Object> entry : fixed.entrySet()) {
                    config.demand.fixed.put(entry.getKey(), getInt(fixed, entry.getKey(), 0));
                }
            }
        }

        Map<String, Object> simMap = getSection(raw, "simulation");
        if (simMap != null) {
            config.simulation.malformedRate = getDouble(simMap, "malformedRate", config.simulation.malformedRate);
            config.simulation.failureRate = getDouble(simMap, "failureRate", config.simulation.failureRate);
            config.simulation.noiseRate = getDouble(simMap, "noiseRate", config.simulation.noiseRate);
        }

        return config;
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    @SuppressWarnings("unchecked")
    private Map<String, Object> getSection(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) return null;
        if (!(value instanceof Map)) {
            throw new ConfigurationException(key + " must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        return (int) toIntegral(key, value, Integer.MIN_VALUE, Integer.MAX_VALUE);
    }

    private long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        return toIntegral(key, value, Long.MIN_VALUE, Long.MAX_VALUE);
    }

    /**
     * Whole numbers only; floats and values outside [min, max] are rejected
     * rather than truncated or wrapped.
     */
    private long toIntegral(String key, Object value, long min, long max) {
        if (value instanceof BigInteger) {
            BigInteger big = (BigInteger) value;
            if (big.bitLength() >= Long.SIZE) {
                throw new ConfigurationException(key + " is out of range: " + value);
            }
            value = big.longValue();
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            long number = ((Number) value).longValue();
            if (number < min || number > max) {
                throw new ConfigurationException(key + " is out of range: " + value);
            }
            return number;
        }
        throw new ConfigurationException(key + " must be an integer, got: " + value);
    }

    private double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        throw new ConfigurationException(key + " must be a number, got: " + value);
    }

    private boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new ConfigurationException(key + " must be true or false, got: " + value);
    }

    private <E extends Enum<E>> E getEnum(Map<String, Object> map, String key, Class<E> type, E defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        try {
            return Enum.valueOf(type, value.toString().trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown " + key + ": " + value
                + " (expected one of " + Arrays.toString(type.getEnumConstants()) + ")");
        }
    }
}
