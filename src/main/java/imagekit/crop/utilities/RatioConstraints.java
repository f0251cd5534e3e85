package imagekit.crop.utilities;

/**
 * Aspect-ratio enforcement for the end point of a drag.
 *
 * <p>The order of operations is fixed:
 * <ol>
 *   <li>the raw end point has already been clamped to the canvas,</li>
 *   <li>{@code endY} is replaced so that the height equals {@code width / ratio}, below the
 *       start point if the pointer is below it, above otherwise,</li>
 *   <li>{@code endY} is clamped again.</li>
 * </ol>
 * The second clamp can cut the height short at the top or bottom edge of the canvas; the ratio
 * is then not honoured exactly for that rectangle.
 */
public final class RatioConstraints {

    private RatioConstraints() {
    }

    /**
     * Applies a ratio constraint to a clamped end point.
     *
     * @param startX        drag start x, display space
     * @param startY        drag start y, display space
     * @param endX          clamped end x
     * @param endY          clamped end y
     * @param ratio         width / height, {@code 0} for free-form
     * @param displayHeight canvas height used for the second clamp
     * @return the constrained end y; {@code endY} unchanged for free-form
     */
    public static double constrainEndY(double startX, double startY, double endX, double endY,
                                       double ratio, double displayHeight) {
        if (ratio <= 0) {
            return endY;
        }
        double width = Math.abs(endX - startX);
        double height = width / ratio;
        double constrained = startY + (endY > startY ? height : -height);
        return CoordinateTransform.clamp(constrained, displayHeight);
    }
}
