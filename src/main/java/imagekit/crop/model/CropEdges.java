package imagekit.crop.model;

/**
 * Number of source pixels removed from each side of the image by a crop.
 *
 * <p>For a region of {@code realWidth x realHeight} pixels,
 * {@code left + realWidth + right == naturalWidth} and
 * {@code top + realHeight + bottom == naturalHeight}.
 *
 * @param top    pixels removed from the top edge
 * @param right  pixels removed from the right edge
 * @param bottom pixels removed from the bottom edge
 * @param left   pixels removed from the left edge
 */
public record CropEdges(int top, int right, int bottom, int left) {

    public CropEdges {
        if (top < 0 || right < 0 || bottom < 0 || left < 0) {
            throw new IllegalArgumentException(
                    "Crop edges cannot be negative: top=" + top + ", right=" + right
                            + ", bottom=" + bottom + ", left=" + left);
        }
    }

    /**
     * Derives the edges that keep exactly {@code region} of a {@code naturalWidth x naturalHeight} image.
     */
    public static CropEdges around(RealRegion region, int naturalWidth, int naturalHeight) {
        return new CropEdges(
                region.y(),
                naturalWidth - region.x() - region.width(),
                naturalHeight - region.y() - region.height(),
                region.x());
    }
}
