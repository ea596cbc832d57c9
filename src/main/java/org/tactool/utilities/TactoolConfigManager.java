package org.tactool.utilities;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tactool.model.InvalidLabelException;
import org.tactool.model.PointLabel;
import org.tactool.model.PointSettings;
import org.tactool.service.csv.InstrumentDialect;
import org.tactool.service.image.ImageExportService;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * TactoolConfigManager
 *
 * <p>Reads TACtool settings from YAML. Values are looked up in the user's file first and then in the
 * bundled {@code tactool-defaults.yml}, so a user file only needs the keys it changes and a missing or
 * broken user file still yields a working configuration.
 *
 * <p>Sections:
 * <ul>
 *   <li>{@code defaults} - starting {@link PointSettings} for new and imported points</li>
 *   <li>{@code instrument} - column layout of the instrument coordinate file</li>
 *   <li>{@code export} - image export format</li>
 * </ul>
 *
 * @since 1.0
 */
public class TactoolConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(TactoolConfigManager.class);

    static final String DEFAULTS_RESOURCE = "/tactool-defaults.yml";

    private final Map<String, Object> configData;
    private final Map<String, Object> builtInData;

    TactoolConfigManager(Map<String, Object> configData, Map<String, Object> builtInData) {
        this.configData = new LinkedHashMap<>(configData);
        this.builtInData = new LinkedHashMap<>(builtInData);
    }

    /**
     * @return a manager holding only the bundled defaults
     */
    public static TactoolConfigManager loadDefaults() {
        return new TactoolConfigManager(new LinkedHashMap<>(), loadBuiltIn());
    }

    /**
     * Loads a user configuration file on top of the bundled defaults.
     * Errors are logged and the defaults are used instead.
     *
     * @param configPath YAML file to read
     */
    public static TactoolConfigManager load(Path configPath) {
        return new TactoolConfigManager(loadConfig(configPath), loadBuiltIn());
    }

    /**
     * Loads a YAML file into a Map.
     *
     * @return map of YAML data, or an empty map on error
     */
    private static Map<String, Object> loadConfig(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in, path.toString());
        } catch (NoSuchFileException e) {
            logger.error("YAML file not found: {}", path);
        } catch (IOException e) {
            logger.error("Error reading YAML: {}", path, e);
        }
        return new LinkedHashMap<>();
    }

    private static Map<String, Object> loadBuiltIn() {
        try (InputStream in = TactoolConfigManager.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                logger.error("Bundled configuration {} is missing", DEFAULTS_RESOURCE);
                return new LinkedHashMap<>();
            }
            return parse(in, DEFAULTS_RESOURCE);
        } catch (IOException e) {
            logger.error("Error reading bundled configuration {}", DEFAULTS_RESOURCE, e);
            return new LinkedHashMap<>();
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parse(InputStream in, String source) {
        try {
            Object loaded = new Yaml().load(in);
            if (loaded instanceof Map) {
                return new LinkedHashMap<>((Map<String, Object>) loaded);
            }
            if (loaded != null) {
                logger.error("YAML root is not a map: {}", source);
            }
        } catch (YAMLException e) {
            logger.error("Error parsing YAML: {}", source, e);
        }
        return new LinkedHashMap<>();
    }

    // ==================== LOOKUP ====================

    /**
     * Retrieves a nested value, from the user file if it has it, otherwise from the bundled defaults.
     *
     * @param keys sequence of keys, e.g. "instrument", "x_header"
     * @return the value, or null if neither source has it
     */
    public Object getConfigItem(String... keys) {
        Object value = lookup(configData, keys);
        if (value == null) {
            value = lookup(builtInData, keys);
        }
        if (value == null) {
            logger.debug("No configuration value at {}", String.join("/", keys));
        }
        return value;
    }

    private static Object lookup(Map<String, Object> root, String... keys) {
        Object current = root;
        for (String key : keys) {
            if (current instanceof Map<?, ?> map && map.containsKey(key)) {
                current = map.get(key);
            } else {
                return null;
            }
        }
        return current;
    }

    public String getString(String... keys) {
        Object v = getConfigItem(keys);
        return v == null ? null : v.toString();
    }

    public Integer getInteger(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.intValue();
        try {
            return (v != null) ? Integer.parseInt(v.toString().trim()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected int at {} but got {}", String.join("/", keys), v);
            return null;
        }
    }

    public Double getDouble(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Number n) return n.doubleValue();
        try {
            return (v != null) ? Double.parseDouble(v.toString().trim()) : null;
        } catch (NumberFormatException e) {
            logger.warn("Expected double at {} but got {}", String.join("/", keys), v);
            return null;
        }
    }

    public Boolean getBoolean(String... keys) {
        Object v = getConfigItem(keys);
        if (v instanceof Boolean b) return b;
        return v != null && Boolean.parseBoolean(v.toString());
    }

    /**
     * Retrieves a section as a map. User keys override bundled keys one level deep.
     *
     * @return the merged section, or null if neither source has it
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getSection(String... keys) {
        Object builtIn = lookup(builtInData, keys);
        Object user = lookup(configData, keys);
        if (!(builtIn instanceof Map) && !(user instanceof Map)) {
            return null;
        }
        Map<String, Object> merged = new LinkedHashMap<>();
        if (builtIn instanceof Map<?, ?>) {
            merged.putAll((Map<String, Object>) builtIn);
        }
        if (user instanceof Map<?, ?>) {
            merged.putAll((Map<String, Object>) user);
        }
        return merged;
    }

    // ==================== TYPED SETTINGS ====================

    /**
     * Builds the starting point settings from the {@code defaults} section. An unusable value is logged
     * and replaced by the built-in default for that field.
     */
    public PointSettings getPointSettings() {
        PointSettings builtIn = PointSettings.defaults();

        Integer diameter = getInteger("defaults", "diameter");
        if (diameter == null || diameter <= 0) {
            logger.warn("Invalid default diameter {}, using {}", diameter, builtIn.getDiameter());
            diameter = builtIn.getDiameter();
        }
        Double scale = getDouble("defaults", "scale");
        if (scale == null || !(scale > 0) || scale.isInfinite()) {
            logger.warn("Invalid default scale {}, using {}", scale, builtIn.getScale());
            scale = builtIn.getScale();
        }
        PointLabel label = builtIn.getLabel();
        String labelText = getString("defaults", "label");
        if (labelText != null) {
            try {
                label = PointLabel.parse(labelText);
            } catch (InvalidLabelException e) {
                logger.warn("Invalid default label: {}", e.getMessage());
            }
        }

        return new PointSettings(
                getString("defaults", "sample_name"),
                getString("defaults", "mount_name"),
                getString("defaults", "material"),
                getString("defaults", "colour"),
                diameter,
                scale,
                label);
    }

    /**
     * Builds the instrument file layout from the {@code instrument} section.
     *
     * @throws IllegalArgumentException if a configured header name is blank
     */
    public InstrumentDialect getInstrumentDialect() {
        Boolean invertX = getBoolean("instrument", "invert_x");
        return new InstrumentDialect(
                getString("instrument", "id_header"),
                getString("instrument", "x_header"),
                getString("instrument", "y_header"),
                getString("instrument", "label_header"),
                getString("instrument", "reference_label"),
                invertX == null || invertX);
    }

    /**
     * @return the configured image export format, {@code png} if unset
     */
    public String getImageFormat() {
        String format = getString("export", "image_format");
        return format == null || format.isBlank() ? ImageExportService.DEFAULT_FORMAT : format.trim();
    }

    // ==================== VALIDATION ====================

    /**
     * Lists every problem in the effective configuration.
     *
     * @return human-readable problems, empty if the configuration is usable as-is
     */
    public List<String> validateConfiguration() {
        List<String> problems = new ArrayList<>();

        Integer diameter = getInteger("defaults", "diameter");
        if (diameter == null || diameter <= 0) {
            problems.add("defaults.diameter must be a positive integer");
        }
        Double scale = getDouble("defaults", "scale");
        if (scale == null || !(scale > 0) || scale.isInfinite()) {
            problems.add("defaults.scale must be a positive number");
        }
        String label = getString("defaults", "label");
        if (label != null) {
            try {
                PointLabel.parse(label);
            } catch (InvalidLabelException e) {
                problems.add("defaults.label: " + e.getMessage());
            }
        }

        for (String key : Arrays.asList("id_header", "x_header", "y_header", "label_header", "reference_label")) {
            String value = getString("instrument", key);
            if (value == null || value.isBlank()) {
                problems.add("instrument." + key + " must not be blank");
            }
        }

        if (!problems.isEmpty()) {
            logger.error("Configuration validation failed: {}", problems);
        } else {
            logger.info("Configuration validation passed");
        }
        return problems;
    }
}
