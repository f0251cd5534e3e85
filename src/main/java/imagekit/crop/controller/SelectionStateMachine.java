package imagekit.crop.controller;

import imagekit.crop.model.CanvasOrigin;
import imagekit.crop.model.PointerInput;
import imagekit.crop.model.SelectionRect;
import imagekit.crop.model.Viewport;
import imagekit.crop.utilities.CoordinateTransform;
import imagekit.crop.utilities.RatioConstraints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the crop selection of one dialog session and advances it on unified pointer input.
 *
 * <p>States:
 * <ul>
 *   <li>{@link State#IDLE}: no drag in progress; the rectangle keeps the last selection</li>
 *   <li>{@link State#DRAWING}: pointer held down; every move replaces the end point</li>
 *   <li>{@link State#CLEARED}: explicit reset, an idle state with a zero-size rectangle</li>
 * </ul>
 *
 * <p>Transitions:
 * <pre>
 *   START            any state  -> DRAWING   start = end = clamped pointer
 *   MOVE             DRAWING    -> DRAWING   end = clamped pointer, ratio applied, re-clamped
 *   END / CANCEL     DRAWING    -> IDLE      rectangle frozen
 *   clear()          any state  -> CLEARED   rectangle zeroed
 * </pre>
 * MOVE, END and CANCEL outside a drag are ignored. The canvas origin captured on START is
 * used for the whole drag, so moves reported outside the canvas still resolve against it.
 *
 * <p>Every coordinate of the rectangle stays within {@code [0, displayWidth] x [0, displayHeight]}.
 * All calls are expected on a single (UI) thread.
 */
public class SelectionStateMachine {
    private static final Logger logger = LoggerFactory.getLogger(SelectionStateMachine.class);

    public enum State {
        IDLE,
        DRAWING,
        CLEARED
    }

    private final Viewport viewport;
    private State state = State.CLEARED;
    private SelectionRect selection = SelectionRect.EMPTY;
    private CanvasOrigin dragOrigin = CanvasOrigin.ZERO;
    private double ratio = 0;

    public SelectionStateMachine(Viewport viewport) {
        if (viewport == null) {
            throw new IllegalArgumentException("Viewport is required");
        }
        this.viewport = viewport;
    }

    /**
     * Advances the machine with one input event.
     *
     * @param input  the event, in pointer space
     * @param origin canvas top-left in pointer space at the time of the event; only read on START
     * @return true if the selection changed and the view should be redrawn
     */
    public boolean handle(PointerInput input, CanvasOrigin origin) {
        switch (input.kind()) {
            case START:
                return start(input.x(), input.y(), origin);
            case MOVE:
                return move(input.x(), input.y());
            case END:
            case CANCEL:
                return end(input.kind());
            default:
                throw new IllegalStateException("Unhandled input kind: " + input.kind());
        }
    }

    private boolean start(double pointerX, double pointerY, CanvasOrigin origin) {
        dragOrigin = origin != null ? origin : CanvasOrigin.ZERO;
        double[] p = CoordinateTransform.toCanvasLocal(pointerX, pointerY, dragOrigin, viewport);
        selection = new SelectionRect(p[0], p[1], p[0], p[1]);
        state = State.DRAWING;
        logger.debug("Drag started at ({}, {})", p[0], p[1]);
        return true;
    }

    private boolean move(double pointerX, double pointerY) {
        if (state != State.DRAWING) {
            return false;
        }
        double[] p = CoordinateTransform.toCanvasLocal(pointerX, pointerY, dragOrigin, viewport);
        double endX = p[0];
        double endY = RatioConstraints.constrainEndY(
                selection.getStartX(), selection.getStartY(), endX, p[1], ratio, viewport.getDisplayHeight());

        SelectionRect updated = selection.withEnd(endX, endY);
        if (updated.equals(selection)) {
            return false;
        }
        selection = updated;
        logger.trace("Selection now {}", selection);
        return true;
    }

    private boolean end(PointerInput.Kind kind) {
        if (state != State.DRAWING) {
            return false;
        }
        state = State.IDLE;
        logger.debug("Drag {} with {}", kind == PointerInput.Kind.CANCEL ? "cancelled" : "ended", selection);
        return false;
    }

    /**
     * Zeroes the selection. Valid in any state, including mid-drag.
     */
    public void clear() {
        selection = SelectionRect.EMPTY;
        state = State.CLEARED;
        logger.debug("Selection cleared");
    }

    /**
     * Sets the ratio constraint for subsequent moves. The current rectangle is not reshaped.
     *
     * @param ratio width / height, 0 for free-form
     * @throws IllegalArgumentException if {@code ratio} is negative or not finite
     */
    public void setRatio(double ratio) {
        if (!(ratio >= 0) || Double.isInfinite(ratio)) {
            throw new IllegalArgumentException("Ratio must be a finite non-negative number: " + ratio);
        }
        this.ratio = ratio;
        logger.debug("Ratio constraint set to {}", ratio == 0 ? "free" : ratio);
    }

    public double getRatio() {
        return ratio;
    }

    public State getState() {
        return state;
    }

    public boolean isDrawing() {
        return state == State.DRAWING;
    }

    /**
     * @return true once a drag has started and until the next {@link #clear()}, whatever the
     *         size of the rectangle
     */
    public boolean hasSelection() {
        return state != State.CLEARED;
    }

    public SelectionRect getSelection() {
        return selection;
    }

    public Viewport getViewport() {
        return viewport;
    }
}
