package imagekit.crop.utilities;

import imagekit.crop.model.CanvasOrigin;
import imagekit.crop.model.RealRegion;
import imagekit.crop.model.SelectionRect;
import imagekit.crop.model.Viewport;

/**
 * CoordinateTransform
 *
 * <p>Conversions between the three coordinate spaces of the crop dialog:
 * <ul>
 *   <li><b>Pointer space</b>: absolute event coordinates, as reported by the input source</li>
 *   <li><b>Display space</b>: pixels of the crop canvas, {@code [0, displayWidth] x [0, displayHeight]}</li>
 *   <li><b>Real-pixel space</b>: pixels of the unscaled source image</li>
 * </ul>
 *
 * <p>All methods are total. Pointer coordinates are clamped to the canvas, so no result ever
 * references pixels outside the loaded image.
 */
public final class CoordinateTransform {

    private CoordinateTransform() {
    }

    /**
     * Converts a pointer position to canvas-local display coordinates, clamped to the canvas.
     *
     * @param pointerX absolute pointer x
     * @param pointerY absolute pointer y
     * @param origin   top-left corner of the canvas in pointer space
     * @param viewport current viewport, supplying the canvas size
     * @return {@code {x, y}} in display space
     */
    public static double[] toCanvasLocal(double pointerX, double pointerY, CanvasOrigin origin, Viewport viewport) {
        double x = pointerX - origin.minX();
        double y = pointerY - origin.minY();
        return new double[]{
                clamp(x, viewport.getDisplayWidth()),
                clamp(y, viewport.getDisplayHeight())
        };
    }

    /**
     * Converts a display-space point to real pixels: {@code round(displayX / scale)}.
     *
     * @return {@code {realX, realY}}
     */
    public static int[] toRealPixels(double displayX, double displayY, Viewport viewport) {
        return new int[]{
                toReal(displayX, viewport),
                toReal(displayY, viewport)
        };
    }

    /**
     * Converts a real-pixel point back to display space: {@code realX * scale}.
     *
     * @return {@code {displayX, displayY}}
     */
    public static double[] toDisplay(double realX, double realY, Viewport viewport) {
        return new double[]{
                realX * viewport.getScale(),
                realY * viewport.getScale()
        };
    }

    /**
     * Converts a selection to the real-pixel region it covers.
     *
     * <p>Each of x, y, width and height is rounded independently. Because both the offset and
     * the extent may round up, the origin is clamped to the image and the extent to what
     * remains of it, keeping the region inside the source.
     *
     * @param rect     selection in display space
     * @param viewport current viewport
     * @return the region in source pixels
     */
    public static RealRegion toRealRegion(SelectionRect rect, Viewport viewport) {
        int naturalWidth = viewport.getNaturalWidth();
        int naturalHeight = viewport.getNaturalHeight();

        int realX = Math.min(toReal(rect.getX(), viewport), naturalWidth);
        int realY = Math.min(toReal(rect.getY(), viewport), naturalHeight);
        int realWidth = Math.min(toReal(rect.getWidth(), viewport), naturalWidth - realX);
        int realHeight = Math.min(toReal(rect.getHeight(), viewport), naturalHeight - realY);

        return new RealRegion(realX, realY, realWidth, realHeight);
    }

    /**
     * Source-image rectangle to sample when drawing a display-space rectangle, without
     * rounding: {@code {x / scale, y / scale, width / scale, height / scale}}.
     */
    public static double[] toSourceRect(double x, double y, double width, double height, Viewport viewport) {
        double scale = viewport.getScale();
        return new double[]{x / scale, y / scale, width / scale, height / scale};
    }

    /**
     * Clamps {@code value} to {@code [0, max]}.
     */
    public static double clamp(double value, double max) {
        return Math.max(0, Math.min(value, max));
    }

    private static int toReal(double display, Viewport viewport) {
        return Math.max(0, (int) Math.round(display / viewport.getScale()));
    }
}
