package imagekit.crop.utilities;

import imagekit.crop.model.AspectRatioPreset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * CropConfig
 *
 * <p>Loads and queries the crop dialog YAML configuration:
 *   - Defaults ship on the classpath as {@code crop-dialog.yml}.
 *   - An override file named by the {@code imagekit.crop.config} system property is merged on top.
 *   - Offers type safe getters (getDouble, getString, getList) over nested keys.
 *   - Typed accessors for each dialog setting fall back to built-in defaults with a warning.
 */
public class CropConfig {
    private static final Logger logger = LoggerFactory.getLogger(CropConfig.class);

    public static final String DEFAULT_RESOURCE = "/crop-dialog.yml";
    public static final String OVERRIDE_PROPERTY = "imagekit.crop.config";

    private final Map<String, Object> configData;

    /**
     * Creates a configuration from an already parsed YAML tree.
     *
     * @param configData nested map as produced by SnakeYAML
     */
    public CropConfig(Map<String, Object> configData) {
        this.configData = new LinkedHashMap<>(configData);
    }

    /**
     * Loads the classpath defaults and, if the {@value #OVERRIDE_PROPERTY} system property
     * is set, merges the named file over them.
     */
    public static CropConfig load() {
        Map<String, Object> data = loadResource(DEFAULT_RESOURCE);
        String overridePath = System.getProperty(OVERRIDE_PROPERTY);
        if (overridePath != null && !overridePath.isBlank()) {
            logger.info("Applying crop configuration overrides from {}", overridePath);
            deepMerge(data, loadFile(Paths.get(overridePath)));
        }
        return new CropConfig(data);
    }

    /**
     * Loads the classpath defaults and merges {@code overrideFile} over them.
     */
    public static CropConfig load(Path overrideFile) {
        Map<String, Object> data = loadResource(DEFAULT_RESOURCE);
        deepMerge(data, loadFile(overrideFile));
        return new CropConfig(data);
    }

    /**
     * Configuration with only the built-in defaults, ignoring all files.
     */
    public static CropConfig defaults() {
        return new CropConfig(Collections.emptyMap());
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> loadResource(String resource) {
        Yaml yaml = new Yaml();
        try (InputStream in = CropConfig.class.getResourceAsStream(resource)) {
            if (in == null) {
                logger.warn("Default configuration {} not found on classpath", resource);
                return new LinkedHashMap<>();
            }
            Object loaded = yaml.load(in);
            if (loaded instanceof Map) {
                return new LinkedHashMap<>((Map<String, Object>) loaded);
            }
            logger.error("YAML root is not a map: {}", resource);
        } catch (IOException e) {
            logger.error("Error reading YAML resource: {}", resource, e);
        } catch (RuntimeException e) {
            logger.error("Error parsing YAML resource: {}", resource, e);
        }
        return new LinkedHashMap<>();
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> loadFile(Path path) {
        Yaml yaml = new Yaml();
        try (InputStream in = new FileInputStream(path.toFile())) {
            Object loaded = yaml.load(in);
            if (loaded instanceof Map) {
                return new LinkedHashMap<>((Map<String, Object>) loaded);
            } else {
                logger.error("YAML root is not a map: {}", path);
            }
        } catch (FileNotFoundException e) {
            logger.error("YAML file not found: {}", path, e);
        } catch (IOException e) {
            logger.error("Error reading YAML: {}", path, e);
        } catch (RuntimeException e) {
            logger.error("Error parsing YAML: {}", path, e);
        }
        return new LinkedHashMap<>();
    }

    @SuppressWarnings("unchecked")
    private static void deepMerge(Map<String, Object> base, Map<String, Object> overrides) {
        for (Map.Entry<String, Object> entry : overrides.entrySet()) {
            Object existing = base.get(entry.getKey());
            if (existing instanceof Map<?, ?> && entry.getValue() instanceof Map<?, ?>) {
                Map<String, Object> merged = new LinkedHashMap<>((Map<String, Object>) existing);
                deepMerge(merged, (Map<String, Object>) entry.getValue());
                base.put(entry.getKey(), merged);
            } else {
                base.put(entry.getKey(), entry.getValue());
            }
        }
    }

    /**
     * Retrieve a nested value from the configuration.
     *
     * @param keys Sequence of keys (e.g., "display", "max_width").
     * @return The value at the end of the key path, or null if not found.
     */
    public Object getConfigItem(String... keys) {
        Object current = configData;
        for (int i = 0; i < keys.length; i++) {
            String key = keys[i];
            if (current instanceof Map<?, ?> map && map.containsKey(key)) {
                current = map.get(key);
                continue;
            }
            logger.debug("Key '{}' not found at level {} of {}", key, i, Arrays.toString(keys));
            return null;
        }
        return current;
    }

    public String getString(String... keys) {
        Object v = getConfigItem(keys);
        return (v != null) ? v.toString() : null;
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

    @SuppressWarnings("unchecked")
    public List<Object> getList(String... keys) {
        Object v = getConfigItem(keys);
        return (v instanceof List<?>) ? (List<Object>) v : null;
    }

    // ========== Typed settings ==========

    public double getMaxDisplayWidth() {
        return positiveDouble(1200, "display", "max_width");
    }

    public double getMaxDisplayHeight() {
        return positiveDouble(800, "display", "max_height");
    }

    /** Fraction of the screen width the canvas may use. */
    public double getContainerWidthFraction() {
        return fraction(0.65, "display", "container_width_fraction");
    }

    /** Fraction of the screen height the canvas may use. */
    public double getContainerHeightFraction() {
        return fraction(0.75, "display", "container_height_fraction");
    }

    /**
     * Largest display size the crop canvas may take on a screen whose usable area is
     * {@code screenWidth} x {@code screenHeight}: the configured maximum, or the configured
     * share of the screen if that is smaller.
     *
     * @return {@code {maxWidth, maxHeight}}
     */
    public double[] getCanvasArea(double screenWidth, double screenHeight) {
        double maxWidth = Math.min(getMaxDisplayWidth(), screenWidth * getContainerWidthFraction());
        double maxHeight = Math.min(getMaxDisplayHeight(), screenHeight * getContainerHeightFraction());
        return new double[]{maxWidth, maxHeight};
    }

    /** Minimum width and height, in display pixels, of a selection that counts. */
    public double getMinSelectionExtent() {
        return positiveDouble(5, "selection", "min_extent");
    }

    public double getPreviewMaxSize() {
        return positiveDouble(180, "preview", "max_size");
    }

    public String getOverlayColor() {
        return stringOr("#000000", "overlay", "color");
    }

    public double getOverlayOpacity() {
        return fraction(0.5, "overlay", "opacity");
    }

    public String getBorderColor() {
        return stringOr("#667eea", "border", "color");
    }

    public double getBorderWidth() {
        return positiveDouble(2, "border", "width");
    }

    public double getBorderDash() {
        return positiveDouble(5, "border", "dash");
    }

    public String getOutputSuffix() {
        String suffix = getString("output", "suffix");
        return suffix != null ? suffix : CroppedNameGenerator.DEFAULT_SUFFIX;
    }

    /**
     * Directory cropped images are written to; the user's home directory if not configured.
     */
    public Path getOutputDirectory() {
        String dir = getString("output", "directory");
        if (dir == null || dir.isBlank()) {
            return Paths.get(System.getProperty("user.home"));
        }
        if (dir.startsWith("~")) {
            dir = System.getProperty("user.home") + dir.substring(1);
        }
        return Paths.get(dir);
    }

    public float getJpegQuality() {
        return (float) fraction(0.95, "output", "jpeg_quality");
    }

    /**
     * Aspect ratio presets in display order. The first entry is forced to be free-form, so a
     * freshly opened session always starts unconstrained.
     */
    public List<AspectRatioPreset> getRatioPresets() {
        List<AspectRatioPreset> presets = new ArrayList<>();
        List<Object> entries = getList("ratios");
        if (entries != null) {
            for (Object entry : entries) {
                if (!(entry instanceof Map<?, ?> map)) {
                    logger.warn("Ignoring ratio preset that is not a map: {}", entry);
                    continue;
                }
                Object label = map.get("label");
                Object ratio = map.get("ratio");
                try {
                    double value = ratio instanceof Number n ? n.doubleValue() : Double.parseDouble(String.valueOf(ratio));
                    presets.add(new AspectRatioPreset(String.valueOf(label), value));
                } catch (IllegalArgumentException e) {
                    logger.warn("Ignoring invalid ratio preset {}: {}", entry, e.getMessage());
                }
            }
        }
        if (presets.isEmpty() || !presets.get(0).isFreeForm()) {
            if (!presets.isEmpty()) {
                logger.warn("First ratio preset must be free-form, prepending '{}'", AspectRatioPreset.FREE.label());
            }
            presets.add(0, AspectRatioPreset.FREE);
        }
        return Collections.unmodifiableList(presets);
    }

    private double positiveDouble(double fallback, String... keys) {
        Double value = getDouble(keys);
        if (value == null) {
            return fallback;
        }
        if (!(value > 0)) {
            logger.warn("{} must be positive but is {}, using {}", String.join("/", keys), value, fallback);
            return fallback;
        }
        return value;
    }

    private double fraction(double fallback, String... keys) {
        Double value = getDouble(keys);
        if (value == null) {
            return fallback;
        }
        if (!(value > 0 && value <= 1)) {
            logger.warn("{} must be in (0, 1] but is {}, using {}", String.join("/", keys), value, fallback);
            return fallback;
        }
        return value;
    }

    private String stringOr(String fallback, String... keys) {
        String value = getString(keys);
        return (value == null || value.isBlank()) ? fallback : value;
    }
}
