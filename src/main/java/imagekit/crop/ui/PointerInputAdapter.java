package imagekit.crop.ui;

import imagekit.crop.model.PointerInput;
import javafx.event.EventType;
import javafx.scene.input.MouseButton;
import javafx.scene.input.MouseEvent;
import javafx.scene.input.TouchEvent;
import javafx.scene.input.TouchPoint;

import java.util.List;
import java.util.Optional;

/**
 * Converts JavaFX mouse and touch events to {@link PointerInput}s in scene coordinates.
 *
 * <ul>
 *   <li>Only the primary mouse button starts and ends a drag.</li>
 *   <li>Mouse events synthesized from touch are dropped; the touch events themselves are used.</li>
 *   <li>Touch events use the first touch point only; multi-touch gestures are not interpreted.</li>
 * </ul>
 */
public final class PointerInputAdapter {

    private PointerInputAdapter() {
    }

    public static Optional<PointerInput> fromMouse(MouseEvent event) {
        if (event.isSynthesized()) {
            return Optional.empty();
        }
        EventType<? extends MouseEvent> type = event.getEventType();
        double x = event.getSceneX();
        double y = event.getSceneY();

        if (type == MouseEvent.MOUSE_PRESSED) {
            return event.getButton() == MouseButton.PRIMARY
                    ? Optional.of(PointerInput.start(x, y)) : Optional.empty();
        } else if (type == MouseEvent.MOUSE_DRAGGED) {
            return Optional.of(PointerInput.move(x, y));
        } else if (type == MouseEvent.MOUSE_RELEASED) {
            return event.getButton() == MouseButton.PRIMARY
                    ? Optional.of(PointerInput.end(x, y)) : Optional.empty();
        }
        return Optional.empty();
    }

    public static Optional<PointerInput> fromTouch(TouchEvent event) {
        List<TouchPoint> points = event.getTouchPoints();
        if (points == null || points.isEmpty()) {
            return Optional.empty();
        }
        TouchPoint primary = points.get(0);
        double x = primary.getSceneX();
        double y = primary.getSceneY();

        EventType<TouchEvent> type = event.getEventType();
        if (type == TouchEvent.TOUCH_PRESSED) {
            return Optional.of(PointerInput.start(x, y));
        } else if (type == TouchEvent.TOUCH_MOVED) {
            return Optional.of(PointerInput.move(x, y));
        } else if (type == TouchEvent.TOUCH_RELEASED) {
            return Optional.of(PointerInput.end(x, y));
        }
        return Optional.empty();
    }
}
