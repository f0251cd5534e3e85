package imagekit.crop.utilities;

import static org.junit.jupiter.api.Assertions.*;

import imagekit.crop.model.AspectRatioPreset;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Unit tests for CropConfig: classpath defaults, file overrides and typed fallbacks.
 */
class CropConfigTest {

    @TempDir Path tmp;

    private Path writeYaml(String yaml) throws IOException {
        Path file = tmp.resolve("override.yml");
        Files.writeString(file, yaml);
        return file;
    }

    // ==================== Defaults Tests ====================

    @Test
    @DisplayName("Built-in defaults apply when nothing is configured")
    void testBuiltInDefaults() {
        CropConfig config = CropConfig.defaults();

        assertEquals(1200, config.getMaxDisplayWidth());
        assertEquals(800, config.getMaxDisplayHeight());
        assertEquals(0.65, config.getContainerWidthFraction());
        assertEquals(0.75, config.getContainerHeightFraction());
        assertEquals(5, config.getMinSelectionExtent());
        assertEquals(180, config.getPreviewMaxSize());
        assertEquals("#000000", config.getOverlayColor());
        assertEquals(0.5, config.getOverlayOpacity());
        assertEquals("#667eea", config.getBorderColor());
        assertEquals(2, config.getBorderWidth());
        assertEquals(5, config.getBorderDash());
        assertEquals("_cropped", config.getOutputSuffix());
        assertEquals(0.95f, config.getJpegQuality());
        assertEquals(List.of(AspectRatioPreset.FREE), config.getRatioPresets());
    }

    @Test
    @DisplayName("Classpath configuration provides the ratio presets, free-form first")
    void testClasspathPresets() {
        List<AspectRatioPreset> presets = CropConfig.load().getRatioPresets();

        assertEquals(6, presets.size());
        assertTrue(presets.get(0).isFreeForm());
        assertEquals("1:1", presets.get(1).label());
        assertEquals(16.0 / 9.0, presets.get(4).ratio(), 1e-6);
        assertThrows(UnsupportedOperationException.class, () -> presets.add(AspectRatioPreset.FREE));
    }

    // ==================== Override Tests ====================

    @Test
    @DisplayName("Override files are deep-merged over the defaults")
    void testOverrideMerges() throws IOException {
        Path file = writeYaml("display:\n  max_width: 900\noutput:\n  suffix: \"-crop\"\n");

        CropConfig config = CropConfig.load(file);

        assertEquals(900, config.getMaxDisplayWidth());
        assertEquals(800, config.getMaxDisplayHeight(), "sibling keys survive the merge");
        assertEquals("-crop", config.getOutputSuffix());
        assertEquals(6, config.getRatioPresets().size());
    }

    @Test
    @DisplayName("A missing override file leaves the defaults in place")
    void testMissingOverride() {
        CropConfig config = CropConfig.load(tmp.resolve("does-not-exist.yml"));
        assertEquals(1200, config.getMaxDisplayWidth());
    }

    @Test
    @DisplayName("Out-of-range values fall back to defaults")
    void testInvalidValuesFallBack() throws IOException {
        Path file = writeYaml(
                "overlay:\n  opacity: 2\n"
                        + "selection:\n  min_extent: -3\n"
                        + "preview:\n  max_size: lots\n");

        CropConfig config = CropConfig.load(file);

        assertEquals(0.5, config.getOverlayOpacity());
        assertEquals(5, config.getMinSelectionExtent());
        assertEquals(180, config.getPreviewMaxSize());
    }

    @Test
    @DisplayName("A preset list without free-form gets one prepended, invalid entries are skipped")
    void testPresetsNormalized() throws IOException {
        Path file = writeYaml(
                "ratios:\n"
                        + "  - label: \"Square\"\n    ratio: 1\n"
                        + "  - label: \"Broken\"\n    ratio: -2\n"
                        + "  - just a string\n"
                        + "  - label: \"Wide\"\n    ratio: \"2.5\"\n");

        List<AspectRatioPreset> presets = CropConfig.load(file).getRatioPresets();

        assertEquals(3, presets.size());
        assertEquals(AspectRatioPreset.FREE, presets.get(0));
        assertEquals("Square", presets.get(1).label());
        assertEquals(2.5, presets.get(2).ratio());
    }

    // ==================== Accessor Tests ====================

    @Test
    @DisplayName("Nested lookups return null for missing keys")
    void testGetConfigItem() {
        CropConfig config = new CropConfig(Map.of("a", Map.of("b", "7")));

        assertEquals("7", config.getString("a", "b"));
        assertEquals(7.0, config.getDouble("a", "b"));
        assertNull(config.getConfigItem("a", "c"));
        assertNull(config.getConfigItem("a", "b", "c"));
        assertNull(config.getList("a"));
    }

    // ==================== Canvas Area Tests ====================

    @ParameterizedTest
    @CsvSource({
            "1920, 1080, 1200, 800",
            "1280, 720, 832, 540",
            "3840, 2160, 1200, 800",
            "800, 600, 520, 450"
    })
    @DisplayName("The canvas is capped by the configured maximum or the share of the screen")
    void testCanvasArea(double screenWidth, double screenHeight, double expectedWidth, double expectedHeight) {
        double[] area = CropConfig.defaults().getCanvasArea(screenWidth, screenHeight);

        assertEquals(expectedWidth, area[0], 1e-9);
        assertEquals(expectedHeight, area[1], 1e-9);
    }

    @Test
    @DisplayName("A 1200x800 image keeps its size on a full HD screen")
    void testCanvasAreaDoesNotShrinkFittingImage() {
        double[] area = CropConfig.load().getCanvasArea(1920, 1040);

        assertEquals(1200, area[0], 1e-9);
        assertEquals(780, area[1], 1e-9);
        assertTrue(area[0] > 360, "the cap does not depend on any small owner window");
    }

    @Test
    @DisplayName("Output directory defaults to the home directory and expands a leading ~")
    void testOutputDirectory() {
        String home = System.getProperty("user.home");

        assertEquals(Paths.get(home), CropConfig.defaults().getOutputDirectory());
        CropConfig tilde = new CropConfig(Map.of("output", Map.of("directory", "~/crops")));
        assertEquals(Paths.get(home + "/crops"), tilde.getOutputDirectory());
        CropConfig absolute = new CropConfig(Map.of("output", Map.of("directory", tmp.toString())));
        assertEquals(tmp, absolute.getOutputDirectory());
    }
}
