package imagekit.crop.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Natural and displayed dimensions of the image loaded into a crop session.
 *
 * <p>The display size is derived from the natural size by a single uniform scale, so the
 * aspect ratio of the source is preserved:
 * <pre>{@code
 * scale = displayWidth / naturalWidth
 * }</pre>
 *
 * <p>A viewport is created once the source image has been decoded and is immutable until a
 * new image is loaded. Use {@link #fit(int, int, double, double)} to derive one from a
 * viewing area.
 *
 * @since 0.1.0
 */
public final class Viewport {
    private static final Logger logger = LoggerFactory.getLogger(Viewport.class);

    private final int naturalWidth;
    private final int naturalHeight;
    private final int displayWidth;
    private final int displayHeight;
    private final double scale;

    /**
     * Creates a viewport from explicit natural and display sizes.
     *
     * @param naturalWidth  width of the source image in pixels, must be positive
     * @param naturalHeight height of the source image in pixels, must be positive
     * @param displayWidth  width of the drawing surface in pixels, must be positive
     * @param displayHeight height of the drawing surface in pixels, must be positive
     * @throws IllegalArgumentException if any dimension is not positive
     */
    public Viewport(int naturalWidth, int naturalHeight, int displayWidth, int displayHeight) {
        if (naturalWidth <= 0 || naturalHeight <= 0) {
            throw new IllegalArgumentException(
                    "Natural size must be positive: " + naturalWidth + "x" + naturalHeight);
        }
        if (displayWidth <= 0 || displayHeight <= 0) {
            throw new IllegalArgumentException(
                    "Display size must be positive: " + displayWidth + "x" + displayHeight);
        }
        this.naturalWidth = naturalWidth;
        this.naturalHeight = naturalHeight;
        this.displayWidth = displayWidth;
        this.displayHeight = displayHeight;
        this.scale = (double) displayWidth / naturalWidth;
    }

    /**
     * Fits an image into a viewing area.
     *
     * <p>If the image exceeds the area in either axis it is scaled down by
     * {@code min(maxWidth / width, maxHeight / height)} and both display dimensions are
     * rounded to whole pixels. Otherwise the image is displayed at its natural size.
     *
     * @param naturalWidth  source width in pixels
     * @param naturalHeight source height in pixels
     * @param maxWidth      width of the viewing area
     * @param maxHeight     height of the viewing area
     * @return the fitted viewport
     */
    public static Viewport fit(int naturalWidth, int naturalHeight, double maxWidth, double maxHeight) {
        int width = naturalWidth;
        int height = naturalHeight;

        if (width > maxWidth || height > maxHeight) {
            double fitScale = Math.min(maxWidth / width, maxHeight / height);
            width = Math.max(1, (int) Math.round(width * fitScale));
            height = Math.max(1, (int) Math.round(height * fitScale));
        }

        Viewport viewport = new Viewport(naturalWidth, naturalHeight, width, height);
        logger.debug("Fitted {}x{} into {}x{} -> display {}x{} (scale {})",
                naturalWidth, naturalHeight, maxWidth, maxHeight, width, height, viewport.scale);
        return viewport;
    }

    public int getNaturalWidth() { return naturalWidth; }

    public int getNaturalHeight() { return naturalHeight; }

    public int getDisplayWidth() { return displayWidth; }

    public int getDisplayHeight() { return displayHeight; }

    /**
     * @return display pixels per source pixel, always positive
     */
    public double getScale() { return scale; }

    @Override
    public String toString() {
        return "Viewport[natural=" + naturalWidth + "x" + naturalHeight
                + ", display=" + displayWidth + "x" + displayHeight
                + ", scale=" + scale + "]";
    }
}
