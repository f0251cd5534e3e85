package imagekit.crop.model;

/**
 * Rectangle selected on the crop canvas, defined by the point where the drag started and
 * the point where it currently ends.
 *
 * <p>Coordinates are in display space (canvas pixels). The two corners are unordered: the
 * drag may run leftwards or upwards, so {@code startX} may be greater than {@code endX}.
 * Use the normalized accessors ({@link #getX()}, {@link #getY()}, {@link #getWidth()},
 * {@link #getHeight()}) for geometry.
 *
 * <pre>{@code
 * SelectionRect rect = new SelectionRect(300, 200, 100, 100);
 * rect.getX();      // 100.0
 * rect.getY();      // 100.0
 * rect.getWidth();  // 200.0
 * rect.getHeight(); // 100.0
 * }</pre>
 *
 * <p>Instances are immutable; the selection state machine replaces its rectangle on every
 * update.
 *
 * @since 0.1.0
 */
public final class SelectionRect {

    /** Zero-size rectangle at the origin, the state after a clear. */
    public static final SelectionRect EMPTY = new SelectionRect(0, 0, 0, 0);

    private final double startX;
    private final double startY;
    private final double endX;
    private final double endY;

    public SelectionRect(double startX, double startY, double endX, double endY) {
        this.startX = startX;
        this.startY = startY;
        this.endX = endX;
        this.endY = endY;
    }

    public double getStartX() { return startX; }

    public double getStartY() { return startY; }

    public double getEndX() { return endX; }

    public double getEndY() { return endY; }

    /**
     * @return the leftmost coordinate, {@code min(startX, endX)}
     */
    public double getX() { return Math.min(startX, endX); }

    /**
     * @return the topmost coordinate, {@code min(startY, endY)}
     */
    public double getY() { return Math.min(startY, endY); }

    /**
     * @return {@code |endX - startX|}
     */
    public double getWidth() { return Math.abs(endX - startX); }

    /**
     * @return {@code |endY - startY|}
     */
    public double getHeight() { return Math.abs(endY - startY); }

    /**
     * Checks whether the selection is too small to count as a selection.
     * A rectangle narrower or shorter than {@code minExtent} produces no overlay and cannot
     * be committed.
     *
     * @param minExtent minimum extent in display pixels on both axes
     * @return true if either side is below {@code minExtent}
     */
    public boolean isBelow(double minExtent) {
        return getWidth() < minExtent || getHeight() < minExtent;
    }

    /**
     * @return a copy with a new end point and the same start point
     */
    public SelectionRect withEnd(double newEndX, double newEndY) {
        return new SelectionRect(startX, startY, newEndX, newEndY);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SelectionRect other)) return false;
        return Double.compare(startX, other.startX) == 0
                && Double.compare(startY, other.startY) == 0
                && Double.compare(endX, other.endX) == 0
                && Double.compare(endY, other.endY) == 0;
    }

    @Override
    public int hashCode() {
        int result = Double.hashCode(startX);
        result = 31 * result + Double.hashCode(startY);
        result = 31 * result + Double.hashCode(endX);
        result = 31 * result + Double.hashCode(endY);
        return result;
    }

    @Override
    public String toString() {
        return String.format("SelectionRect[x=%.1f, y=%.1f, w=%.1f, h=%.1f]",
                getX(), getY(), getWidth(), getHeight());
    }
}
