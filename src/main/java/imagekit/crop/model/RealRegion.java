package imagekit.crop.model;

/**
 * A rectangle in real-pixel space, the coordinates of the unscaled source image.
 *
 * @param x      left edge in source pixels
 * @param y      top edge in source pixels
 * @param width  width in source pixels
 * @param height height in source pixels
 */
public record RealRegion(int x, int y, int width, int height) {
}
