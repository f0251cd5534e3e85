package imagekit.crop.ui;

import imagekit.crop.model.CanvasOrigin;
import imagekit.crop.model.PointerInput;

import java.util.function.Consumer;

/**
 * Connects a pointer/touch source to the selection state machine.
 *
 * <p>Implementations listen for gesture starts on the canvas itself and, while a drag is
 * in progress, for moves and releases at a scope wider than the canvas so that a drag which
 * leaves the widget still finishes. That wider binding must be released when the drag ends
 * and by {@link #unbind()}.
 */
public interface InputBinding {

    /**
     * Starts delivering input to {@code listener}. Replaces any previous listener.
     */
    void bind(Consumer<PointerInput> listener);

    /**
     * Stops delivering input and releases every binding, including one held for an
     * in-progress drag. Calling it when nothing is bound does nothing.
     */
    void unbind();

    /**
     * @return whether the wider drag-tracking binding is currently held
     */
    boolean isTrackingDrag();

    /**
     * @return the canvas top-left corner in the coordinate space of delivered events
     */
    CanvasOrigin currentOrigin();
}
