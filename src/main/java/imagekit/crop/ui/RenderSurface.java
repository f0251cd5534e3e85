package imagekit.crop.ui;

/**
 * A 2D drawing target bound to one source image.
 *
 * <p>This is the only drawing API the crop renderer uses, so any environment with a canvas
 * and image blitting can host the dialog. Coordinates are surface pixels except for the
 * source rectangle of {@link #drawSource}, which is in source-image pixels.
 */
public interface RenderSurface {

    /**
     * Resizes the surface. Contents are unspecified afterwards.
     */
    void resize(double width, double height);

    double getWidth();

    double getHeight();

    /**
     * Clears a rectangle to fully transparent.
     */
    void clearRect(double x, double y, double width, double height);

    /**
     * Draws part of the source image, scaled to fit the destination rectangle.
     *
     * @param sx source x, in image pixels
     * @param sy source y, in image pixels
     * @param sw source width, in image pixels
     * @param sh source height, in image pixels
     * @param dx destination x
     * @param dy destination y
     * @param dw destination width
     * @param dh destination height
     */
    void drawSource(double sx, double sy, double sw, double sh,
                    double dx, double dy, double dw, double dh);

    /**
     * Fills a rectangle with a colour.
     *
     * @param color   CSS-style colour, e.g. {@code "#000000"}
     * @param opacity 0 (transparent) to 1 (opaque)
     */
    void fillRect(double x, double y, double width, double height, String color, double opacity);

    /**
     * Strokes the outline of a rectangle with a dashed line.
     *
     * @param color     CSS-style colour
     * @param lineWidth stroke width in pixels
     * @param dash      length of each dash and each gap
     */
    void strokeDashedRect(double x, double y, double width, double height,
                          String color, double lineWidth, double dash);

    /**
     * Clears the whole surface.
     */
    default void clear() {
        clearRect(0, 0, getWidth(), getHeight());
    }
}
