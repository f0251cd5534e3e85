package imagekit.crop.model;

/**
 * A single input event as seen by the selection state machine, independent of whether it
 * came from a mouse, a pen or a touch screen.
 *
 * <p>Coordinates are absolute (the same space as {@link CanvasOrigin}). {@code END} and
 * {@code CANCEL} carry the last known position when the source provides one; the state
 * machine does not read it.
 *
 * @param kind phase of the gesture
 * @param x    pointer x
 * @param y    pointer y
 */
public record PointerInput(Kind kind, double x, double y) {

    public enum Kind {
        START,
        MOVE,
        END,
        CANCEL
    }

    public PointerInput {
        if (kind == null) {
            throw new IllegalArgumentException("Input kind is required");
        }
    }

    public static PointerInput start(double x, double y) {
        return new PointerInput(Kind.START, x, y);
    }

    public static PointerInput move(double x, double y) {
        return new PointerInput(Kind.MOVE, x, y);
    }

    public static PointerInput end(double x, double y) {
        return new PointerInput(Kind.END, x, y);
    }

    public static PointerInput cancel() {
        return new PointerInput(Kind.CANCEL, Double.NaN, Double.NaN);
    }
}
