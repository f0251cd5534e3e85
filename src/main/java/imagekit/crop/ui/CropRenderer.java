package imagekit.crop.ui;

import imagekit.crop.model.SelectionRect;
import imagekit.crop.model.Viewport;
import imagekit.crop.utilities.CoordinateTransform;
import imagekit.crop.utilities.CropConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Draws the crop canvas and the selection preview.
 *
 * <p>Main canvas, back to front:
 * <ol>
 *   <li>The whole source image scaled to the display size.</li>
 *   <li>If the selection is at least the minimum extent: a translucent dark overlay across the
 *       canvas, with the selected area cleared and redrawn from the source at full clarity.</li>
 *   <li>A dashed border around the selection.</li>
 * </ol>
 *
 * <p>The preview surface shows only the selected region, sampled from the source and scaled
 * down to fit {@code previewMaxSize} on its longer side while keeping the selection's aspect
 * ratio. It is emptied when there is no valid selection.
 *
 * <p>The renderer only reads the viewport and selection.
 */
public class CropRenderer {
    private static final Logger logger = LoggerFactory.getLogger(CropRenderer.class);

    private final RenderSurface main;
    private final RenderSurface preview;

    private final double minExtent;
    private final double previewMaxSize;
    private final String overlayColor;
    private final double overlayOpacity;
    private final String borderColor;
    private final double borderWidth;
    private final double borderDash;

    public CropRenderer(RenderSurface main, RenderSurface preview, CropConfig config) {
        if (main == null || preview == null) {
            throw new IllegalArgumentException("Both render surfaces are required");
        }
        this.main = main;
        this.preview = preview;
        this.minExtent = config.getMinSelectionExtent();
        this.previewMaxSize = config.getPreviewMaxSize();
        this.overlayColor = config.getOverlayColor();
        this.overlayOpacity = config.getOverlayOpacity();
        this.borderColor = config.getBorderColor();
        this.borderWidth = config.getBorderWidth();
        this.borderDash = config.getBorderDash();
    }

    /**
     * Sizes the main surface for a newly opened viewport and draws the plain image.
     */
    public void initialize(Viewport viewport) {
        main.resize(viewport.getDisplayWidth(), viewport.getDisplayHeight());
        render(viewport, SelectionRect.EMPTY);
        clearPreview();
        logger.debug("Canvas initialized for {}", viewport);
    }

    /**
     * Redraws both surfaces for the current selection.
     *
     * @return true if a selection overlay was drawn
     */
    public boolean redraw(Viewport viewport, SelectionRect selection) {
        boolean overlay = render(viewport, selection);
        if (overlay) {
            renderPreview(viewport, selection);
        } else {
            clearPreview();
        }
        return overlay;
    }

    /**
     * Redraws the main surface.
     *
     * @return true if a selection overlay was drawn, false if the selection is below the
     *         minimum extent and only the image was drawn
     */
    public boolean render(Viewport viewport, SelectionRect selection) {
        double displayWidth = viewport.getDisplayWidth();
        double displayHeight = viewport.getDisplayHeight();

        main.clearRect(0, 0, displayWidth, displayHeight);
        main.drawSource(0, 0, viewport.getNaturalWidth(), viewport.getNaturalHeight(),
                0, 0, displayWidth, displayHeight);

        if (selection.isBelow(minExtent)) {
            return false;
        }

        double x = selection.getX();
        double y = selection.getY();
        double w = selection.getWidth();
        double h = selection.getHeight();

        main.fillRect(0, 0, displayWidth, displayHeight, overlayColor, overlayOpacity);

        // spotlight: punch out the selection and redraw it from the source
        main.clearRect(x, y, w, h);
        double[] src = CoordinateTransform.toSourceRect(x, y, w, h, viewport);
        main.drawSource(src[0], src[1], src[2], src[3], x, y, w, h);

        main.strokeDashedRect(x, y, w, h, borderColor, borderWidth, borderDash);
        return true;
    }

    /**
     * Draws the selected region onto the preview surface.
     *
     * @return {@code {width, height}} of the preview, or null if the selection is below the
     *         minimum extent and nothing was drawn
     */
    public double[] renderPreview(Viewport viewport, SelectionRect selection) {
        if (selection.isBelow(minExtent)) {
            return null;
        }
        double[] size = previewSize(selection.getWidth(), selection.getHeight(), previewMaxSize);

        preview.resize(size[0], size[1]);
        preview.clearRect(0, 0, size[0], size[1]);
        double[] src = CoordinateTransform.toSourceRect(
                selection.getX(), selection.getY(), selection.getWidth(), selection.getHeight(), viewport);
        preview.drawSource(src[0], src[1], src[2], src[3], 0, 0, size[0], size[1]);
        return size;
    }

    public void clearPreview() {
        preview.clear();
    }

    /**
     * Fits a {@code width x height} rectangle into a {@code maxSize} square, keeping its
     * aspect ratio. Rectangles that already fit keep their size; scaled ones are rounded.
     *
     * @return {@code {previewWidth, previewHeight}}
     */
    public static double[] previewSize(double width, double height, double maxSize) {
        if (width > maxSize || height > maxSize) {
            double s = Math.min(maxSize / width, maxSize / height);
            return new double[]{Math.round(width * s), Math.round(height * s)};
        }
        return new double[]{width, height};
    }
}
