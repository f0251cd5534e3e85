package imagekit.crop.model;

/**
 * Position of the crop canvas's top-left corner in the coordinate space pointer events are
 * reported in (scene coordinates for JavaFX).
 *
 * @param minX left edge of the canvas
 * @param minY top edge of the canvas
 */
public record CanvasOrigin(double minX, double minY) {

    public static final CanvasOrigin ZERO = new CanvasOrigin(0, 0);
}
